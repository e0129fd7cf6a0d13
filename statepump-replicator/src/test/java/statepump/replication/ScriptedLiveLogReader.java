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

package statepump.replication;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import statepump.interfaces.log.LiveLogListener;
import statepump.interfaces.log.LiveLogReader;
import statepump.interfaces.log.LogRecord;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A live log whose records, disconnects and unanswered requests are driven by the test, for conditions
 * a well-behaved log never produces, such as a record arriving ahead of its turn.
 */
class ScriptedLiveLogReader implements LiveLogReader {
  private final AtomicInteger floorRequestCount = new AtomicInteger(0);
  private final AtomicInteger subscribeCount = new AtomicInteger(0);
  private volatile long floor = 0;
  private volatile int unansweredFloorRequests = 0;
  private volatile Fiber subscriberFiber;
  private volatile LiveLogListener subscriber;

  void setFloor(long floor) {
    this.floor = floor;
  }

  /**
   * Leave the next few retention floor requests without any reply.
   */
  void ignoreFloorRequests(int howMany) {
    unansweredFloorRequests = howMany;
  }

  int getFloorRequestCount() {
    return floorRequestCount.get();
  }

  int getSubscribeCount() {
    return subscribeCount.get();
  }

  boolean hasSubscriber() {
    return subscriber != null;
  }

  void deliver(long seqNum, ByteBuffer body) {
    final LiveLogListener listener = subscriber;
    final LogRecord record = new LogRecord(ReplicaTestUtil.PARTITION, seqNum, 0, body);
    subscriberFiber.execute(() -> listener.onRecord(record));
  }

  void disconnect(Throwable cause) {
    final LiveLogListener listener = subscriber;
    subscriber = null;
    subscriberFiber.execute(() -> listener.onDisconnect(cause));
  }

  @Override
  public ListenableFuture<Long> getOldestAvailableSeqNum(String partitionKey) {
    floorRequestCount.incrementAndGet();
    if (unansweredFloorRequests > 0) {
      unansweredFloorRequests--;
      return SettableFuture.create();
    }
    return Futures.immediateFuture(floor);
  }

  @Override
  public ListenableFuture<Disposable> subscribe(String partitionKey, long fromSeqNum, Fiber fiber,
                                                LiveLogListener listener) {
    subscribeCount.incrementAndGet();
    subscriberFiber = fiber;
    subscriber = listener;
    return Futures.immediateFuture(() -> {
      if (subscriber == listener) {
        subscriber = null;
      }
    });
  }
}
