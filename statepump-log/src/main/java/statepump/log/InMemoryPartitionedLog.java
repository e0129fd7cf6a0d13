/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package statepump.log;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.log.LiveLogListener;
import statepump.interfaces.log.LiveLogReader;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.TransientTransportException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.LongSupplier;

/**
 * An in-process partitioned log service with a retention floor. Each partition numbers its records
 * contiguously from 0. Expiring records hands them to an optional capture sink first, so that expiry and
 * capture together behave like a retention-bounded log service feeding a cold archive.
 * <p>
 * Subscribers receive records in order on their own fibers. The service can be taken offline, which
 * disconnects every subscriber and fails every request, to exercise a client's recovery.
 */
public class InMemoryPartitionedLog implements LiveLogReader {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryPartitionedLog.class);

  private final ConcurrentHashMap<String, Partition> partitions = new ConcurrentHashMap<>();
  @Nullable
  private final RecordCaptureSink captureSink;
  private final LongSupplier clock;
  private volatile boolean online = true;

  public InMemoryPartitionedLog(@Nullable RecordCaptureSink captureSink, LongSupplier clock) {
    this.captureSink = captureSink;
    this.clock = clock;
  }

  public InMemoryPartitionedLog(@Nullable RecordCaptureSink captureSink) {
    this(captureSink, System::currentTimeMillis);
  }

  public InMemoryPartitionedLog() {
    this(null);
  }

  /**
   * Durably accept a record.
   *
   * @return The sequence number assigned to it.
   */
  public long append(String partitionKey, ByteBuffer body) {
    return getPartition(partitionKey).append(body);
  }

  /**
   * Expire all records with sequence numbers below newFloor, capturing them first if a sink is set.
   * Has no effect if the floor is already at or beyond newFloor.
   *
   * @throws IOException if the capture sink could not store the records; nothing is expired then.
   */
  public void expireBefore(String partitionKey, long newFloor) throws IOException {
    getPartition(partitionKey).expireBefore(newFloor);
  }

  /**
   * Deliver an already delivered record again to current subscribers, as an at-least-once transport may.
   */
  public void redeliver(String partitionKey, long seqNum) {
    getPartition(partitionKey).redeliver(seqNum);
  }

  /**
   * Sever every subscription, each of which is told of the disconnect.
   */
  public void disconnectAll() {
    partitions.values().forEach(Partition::disconnectAll);
  }

  /**
   * While offline, every subscription is severed and every request fails with TransientTransportException.
   */
  public void setOnline(boolean online) {
    this.online = online;
    if (!online) {
      disconnectAll();
    }
  }

  public long getNextSeqNum(String partitionKey) {
    return getPartition(partitionKey).getNextSeqNum();
  }

  @Override
  public ListenableFuture<Long> getOldestAvailableSeqNum(String partitionKey) {
    if (!online) {
      return Futures.immediateFailedFuture(offline());
    }
    return Futures.immediateFuture(getPartition(partitionKey).getFloor());
  }

  @Override
  public ListenableFuture<Disposable> subscribe(String partitionKey, long fromSeqNum, Fiber fiber,
                                                LiveLogListener listener) {
    if (!online) {
      return Futures.immediateFailedFuture(offline());
    }
    return Futures.immediateFuture(getPartition(partitionKey).subscribe(fromSeqNum, fiber, listener));
  }

  private Partition getPartition(String partitionKey) {
    return partitions.computeIfAbsent(partitionKey, Partition::new);
  }

  private static TransientTransportException offline() {
    return new TransientTransportException("Log service is offline");
  }

  private class Partition {
    private final String partitionKey;
    private final Deque<LogRecord> retained = new ArrayDeque<>();
    private final Set<Subscription> subscriptions = new CopyOnWriteArraySet<>();
    private long floor = 0;
    private long nextSeqNum = 0;

    Partition(String partitionKey) {
      this.partitionKey = partitionKey;
    }

    synchronized long getFloor() {
      return floor;
    }

    synchronized long getNextSeqNum() {
      return nextSeqNum;
    }

    synchronized long append(ByteBuffer body) {
      final LogRecord record = new LogRecord(partitionKey, nextSeqNum, clock.getAsLong(), body);
      retained.addLast(record);
      nextSeqNum++;

      for (Subscription subscription : subscriptions) {
        subscription.deliver(record);
      }
      return record.getSeqNum();
    }

    synchronized void expireBefore(long newFloor) throws IOException {
      if (newFloor > nextSeqNum) {
        throw new IllegalArgumentException("Cannot expire records not yet appended: floor " + newFloor
            + ", next " + nextSeqNum);
      }
      if (newFloor <= floor) {
        return;
      }

      final List<LogRecord> expiring = new ArrayList<>();
      for (LogRecord record : retained) {
        if (record.getSeqNum() >= newFloor) {
          break;
        }
        expiring.add(record);
      }

      if (captureSink != null) {
        captureSink.capture(partitionKey, expiring);
      }

      for (int i = 0; i < expiring.size(); i++) {
        retained.removeFirst();
      }
      LOG.debug("Partition {} expired records [{}, {})", partitionKey, floor, newFloor);
      floor = newFloor;
    }

    synchronized void redeliver(long seqNum) {
      for (LogRecord record : retained) {
        if (record.getSeqNum() == seqNum) {
          subscriptions.forEach((subscription) -> subscription.deliver(record));
          return;
        }
      }
      throw new IllegalArgumentException("No retained record " + seqNum + " in partition " + partitionKey);
    }

    synchronized Disposable subscribe(long fromSeqNum, Fiber fiber, LiveLogListener listener) {
      final Subscription subscription = new Subscription(this, fiber, listener);
      for (LogRecord record : retained) {
        if (record.getSeqNum() >= fromSeqNum) {
          subscription.deliver(record);
        }
      }
      subscriptions.add(subscription);
      LOG.debug("Partition {} subscribed from {} (floor {})", partitionKey, fromSeqNum, floor);
      return subscription;
    }

    void disconnectAll() {
      for (Subscription subscription : subscriptions) {
        subscription.disconnect(new TransientTransportException("Subscription to partition "
            + partitionKey + " lost"));
      }
    }

    void remove(Subscription subscription) {
      subscriptions.remove(subscription);
    }
  }

  private static class Subscription implements Disposable {
    private final Partition partition;
    private final Fiber fiber;
    private final LiveLogListener listener;
    private volatile boolean active = true;

    Subscription(Partition partition, Fiber fiber, LiveLogListener listener) {
      this.partition = partition;
      this.fiber = fiber;
      this.listener = listener;
    }

    void deliver(LogRecord record) {
      fiber.execute(() -> {
        if (active) {
          listener.onRecord(record);
        }
      });
    }

    void disconnect(Throwable cause) {
      partition.remove(this);
      fiber.execute(() -> {
        if (active) {
          active = false;
          listener.onDisconnect(cause);
        }
      });
    }

    @Override
    public void dispose() {
      active = false;
      partition.remove(this);
    }
  }
}
