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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.replication.ReplicaState;
import statepump.interfaces.replication.StateCodec;
import statepump.interfaces.snapshot.SnapshotStore;
import statepump.util.FiberOnly;
import statepump.util.FiberSupplier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Periodically persists the state of one replica, so that a restarted replica resumes close to where this
 * one left off. A snapshot is due once the configured interval has elapsed or the configured number of
 * events has been applied since the last one, whichever comes first, and only if the state has advanced.
 * <p>
 * The scheduler only reads the replica's published state; it never blocks the engine. A failed write is
 * logged and retried on the next tick.
 */
public class SnapshotScheduler<S extends ReplicaState> {
  private static final Logger LOG = LoggerFactory.getLogger(SnapshotScheduler.class);

  private final String partitionKey;
  private final Supplier<S> currentState;
  private final StateCodec<S> stateCodec;
  private final SnapshotStore snapshotStore;
  private final Fiber fiber;
  private final ReplicaClock clock;
  private final long intervalMillis;
  private final long eventCountThreshold;
  private final long pollIntervalMillis;
  private final int snapshotsRetained;

  private final AtomicLong writeCount = new AtomicLong(0);
  private final AtomicLong failureCount = new AtomicLong(0);
  private volatile long lastWrittenSeqNum = -1;

  // Fiber-only
  private long lastWriteTime;

  public SnapshotScheduler(String partitionKey,
                           Supplier<S> currentState,
                           StateCodec<S> stateCodec,
                           SnapshotStore snapshotStore,
                           FiberSupplier fiberSupplier,
                           ReplicaConfiguration configuration) {
    this.partitionKey = partitionKey;
    this.currentState = currentState;
    this.stateCodec = stateCodec;
    this.snapshotStore = snapshotStore;
    this.clock = configuration.getClock();
    this.intervalMillis = configuration.getSnapshotIntervalMillis();
    this.eventCountThreshold = configuration.getSnapshotEventCountThreshold();
    this.pollIntervalMillis = configuration.getSnapshotPollIntervalMillis();
    this.snapshotsRetained = configuration.getSnapshotsRetained();
    this.fiber = fiberSupplier.getFiber(this::onUncaughtException);
  }

  /**
   * Begin polling. The state current at this moment counts as already persisted, since the replica has
   * just been restored from it or caught up to it.
   */
  public void start() {
    lastWrittenSeqNum = currentState.get().getSeqNum();
    lastWriteTime = clock.currentTimeMillis();
    fiber.scheduleWithFixedDelay(this::tick, pollIntervalMillis, pollIntervalMillis, TimeUnit.MILLISECONDS);
    fiber.start();
  }

  public void stop() {
    fiber.dispose();
  }

  /**
   * Write a snapshot of the current state regardless of the schedule.
   *
   * @return A future with true if a snapshot was written, false if the state had not advanced or the
   * store rejected it; or with the store's exception.
   */
  public ListenableFuture<Boolean> snapshotNow() {
    final SettableFuture<Boolean> result = SettableFuture.create();
    fiber.execute(() -> {
      try {
        result.set(writeSnapshot(currentState.get()));
      } catch (IOException e) {
        failureCount.incrementAndGet();
        result.setException(e);
      }
    });
    return result;
  }

  public long getLastWrittenSeqNum() {
    return lastWrittenSeqNum;
  }

  public long getWriteCount() {
    return writeCount.get();
  }

  public long getFailureCount() {
    return failureCount.get();
  }

  @FiberOnly
  private void tick() {
    final S state = currentState.get();
    final long eventsSinceLastWrite = state.getSeqNum() - lastWrittenSeqNum;
    if (eventsSinceLastWrite <= 0) {
      return;
    }

    final boolean intervalElapsed = intervalMillis > 0
        && clock.currentTimeMillis() - lastWriteTime >= intervalMillis;
    final boolean thresholdReached = eventCountThreshold > 0
        && eventsSinceLastWrite >= eventCountThreshold;
    if (!intervalElapsed && !thresholdReached) {
      return;
    }

    try {
      writeSnapshot(state);
    } catch (IOException e) {
      failureCount.incrementAndGet();
      LOG.warn("Unable to snapshot partition {} at {}; will retry: {}", partitionKey, state.getSeqNum(), e.toString());
    }
  }

  @FiberOnly
  private boolean writeSnapshot(S state) throws IOException {
    final long seqNum = state.getSeqNum();
    if (seqNum <= lastWrittenSeqNum) {
      return false;
    }

    final boolean written = snapshotStore.write(partitionKey, seqNum, stateCodec.encode(state));
    lastWrittenSeqNum = seqNum;
    lastWriteTime = clock.currentTimeMillis();

    if (!written) {
      // Another writer already stored this or a later snapshot
      LOG.info("Snapshot of partition {} at {} was superseded", partitionKey, seqNum);
      return false;
    }

    writeCount.incrementAndGet();
    LOG.debug("Wrote snapshot of partition {} at {}", partitionKey, seqNum);

    if (snapshotsRetained > 0) {
      pruneOldSnapshots();
    }
    return true;
  }

  @FiberOnly
  private void pruneOldSnapshots() {
    try {
      final int deleted = snapshotStore.retainLatest(partitionKey, snapshotsRetained);
      if (deleted > 0) {
        LOG.debug("Pruned {} old snapshots of partition {}", deleted, partitionKey);
      }
    } catch (IOException e) {
      // The next successful write prunes again
      LOG.warn("Unable to prune old snapshots of partition {}: {}", partitionKey, e.toString());
    }
  }

  private void onUncaughtException(Throwable t) {
    failureCount.incrementAndGet();
    LOG.error("Snapshot scheduler of partition {} encountered an exception", partitionKey, t);
  }
}
