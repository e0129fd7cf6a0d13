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
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Subscriber;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.log.ArchiveReader;
import statepump.interfaces.log.LiveLogListener;
import statepump.interfaces.log.LiveLogReader;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.RangeUnavailableException;
import statepump.interfaces.log.TransientTransportException;
import statepump.interfaces.replication.Event;
import statepump.interfaces.replication.MalformedEventException;
import statepump.interfaces.replication.MalformedEventPolicy;
import statepump.interfaces.replication.PayloadCodec;
import statepump.interfaces.replication.Replica;
import statepump.interfaces.replication.ReplicaEvent;
import statepump.interfaces.replication.ReplicaPhase;
import statepump.interfaces.replication.ReplicaState;
import statepump.interfaces.replication.SequenceGapException;
import statepump.interfaces.replication.StateCodec;
import statepump.interfaces.replication.StateReducer;
import statepump.interfaces.snapshot.CorruptSnapshotException;
import statepump.interfaces.snapshot.SnapshotStore;
import statepump.interfaces.snapshot.StoredSnapshot;
import statepump.util.ExponentialBackoff;
import statepump.util.FiberOnly;
import statepump.util.FiberSupplier;
import statepump.util.PumpFutures;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static statepump.interfaces.log.SequentialEntryIterable.SequentialEntryIterator;
import static statepump.interfaces.replication.ReplicaEvent.EventType;

/**
 * Maintains the in-memory replica of one partition: resumes from the latest snapshot, applies from the
 * archive whatever the live log has already expired, then tails the live log, applying each event exactly
 * once and in order.
 * <p>
 * All work happens on the engine's own fiber, which is the only writer of the replica's state and of its
 * cursor ({@link #nextSeqNum}). Each applied event publishes a new immutable state through a single
 * volatile reference, which readers on any thread may read without locking.
 * <p>
 * Disconnects, timeouts and other I/O errors are retried forever with bounded exponential backoff; each
 * retry repeats the retention floor check, so a floor that advanced meanwhile is bridged from the archive.
 * A gap in the live stream, a range missing from the archive, a corrupt snapshot, or (unless configured
 * to skip them) an undecodable event fail the replica permanently; its last good state remains readable.
 *
 * @param <S> State type
 * @param <P> Event payload type
 */
public class ReplicationEngine<S extends ReplicaState, P> implements Replica<S> {
  private static final Logger LOG = LoggerFactory.getLogger(ReplicationEngine.class);

  private final String partitionKey;
  private final Fiber fiber;
  private final SnapshotStore snapshotStore;
  private final ArchiveReader archiveReader;
  private final LiveLogReader liveLogReader;
  private final StateCodec<S> stateCodec;
  private final PayloadCodec<P> payloadCodec;
  private final StateReducer<S, P> reducer;
  private final ReplicaClock clock;
  private final MalformedEventPolicy malformedEventPolicy;
  private final long transportTimeoutMillis;

  private final MemoryChannel<ReplicaEvent> eventChannel = new MemoryChannel<>();
  private final SettableFuture<S> startFuture = SettableFuture.create();
  private final SettableFuture<Void> stopFuture = SettableFuture.create();
  private final AtomicBoolean startRequested = new AtomicBoolean(false);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  private final AtomicLong appliedCount = new AtomicLong(0);
  private final AtomicLong duplicateCount = new AtomicLong(0);
  private final AtomicLong malformedSkippedCount = new AtomicLong(0);
  private final AtomicLong reconnectCount = new AtomicLong(0);

  private volatile S currentState;
  private volatile ReplicaPhase phase = ReplicaPhase.BOOTSTRAPPING;
  private volatile Throwable failureCause = null;
  private volatile boolean stopping = false;

  // Fiber-only state
  private final ExponentialBackoff backoff;
  private long nextSeqNum;
  private boolean bootstrapped = false;
  private long requestGeneration = 0;
  private Disposable subscription = null;
  private Disposable pendingRetry = null;

  public ReplicationEngine(String partitionKey,
                           FiberSupplier fiberSupplier,
                           SnapshotStore snapshotStore,
                           ArchiveReader archiveReader,
                           LiveLogReader liveLogReader,
                           StateCodec<S> stateCodec,
                           PayloadCodec<P> payloadCodec,
                           StateReducer<S, P> reducer,
                           ReplicaConfiguration configuration) {
    this.partitionKey = partitionKey;
    this.snapshotStore = snapshotStore;
    this.archiveReader = archiveReader;
    this.liveLogReader = liveLogReader;
    this.stateCodec = stateCodec;
    this.payloadCodec = payloadCodec;
    this.reducer = reducer;
    this.clock = configuration.getClock();
    this.malformedEventPolicy = configuration.getMalformedEventPolicy();
    this.transportTimeoutMillis = configuration.getTransportTimeoutMillis();
    this.backoff = new ExponentialBackoff(configuration.getBackoffBaseMillis(), configuration.getBackoffMaxMillis());

    this.currentState = stateCodec.emptyState();
    this.nextSeqNum = currentState.getSeqNum() + 1;
    this.fiber = fiberSupplier.getFiber(this::failReplica);
  }

  /**
   * public API
   */

  @Override
  public String getPartitionKey() {
    return partitionKey;
  }

  @Override
  public ListenableFuture<S> start() {
    if (startRequested.compareAndSet(false, true)) {
      fiber.execute(this::bootstrap);
      fiber.start();
    }
    return startFuture;
  }

  /**
   * Before the replica has loaded its snapshot, this is the empty state.
   */
  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public ListenableFuture<Void> stop() {
    if (stopRequested.compareAndSet(false, true)) {
      stopping = true;
      if (startRequested.compareAndSet(false, true)) {
        // Never started: there is no fiber work to wait for
        fiber.execute(this::shutdown);
        fiber.start();
      } else {
        fiber.execute(this::shutdown);
      }
    }
    return stopFuture;
  }

  @Override
  public ReplicaPhase getPhase() {
    return phase;
  }

  @Override
  public boolean isHealthy() {
    return phase != ReplicaPhase.FAILED && phase != ReplicaPhase.STOPPED;
  }

  @Nullable
  @Override
  public Throwable getFailureCause() {
    return failureCause;
  }

  @Override
  public Subscriber<ReplicaEvent> getEventChannel() {
    return eventChannel;
  }

  @Override
  public long getAppliedCount() {
    return appliedCount.get();
  }

  @Override
  public long getDuplicateCount() {
    return duplicateCount.get();
  }

  @Override
  public long getMalformedSkippedCount() {
    return malformedSkippedCount.get();
  }

  @Override
  public long getReconnectCount() {
    return reconnectCount.get();
  }

  @Override
  public String toString() {
    return "ReplicationEngine{" +
        "partitionKey='" + partitionKey + '\'' +
        ", phase=" + phase +
        ", seqNum=" + currentState.getSeqNum() +
        '}';
  }

  /**
   * Bootstrapping
   */

  @FiberOnly
  private void bootstrap() {
    if (stopping) {
      return;
    }
    setPhase(ReplicaPhase.BOOTSTRAPPING);
    publishEvent(EventType.STARTED, null);

    final S loadedState;
    try {
      loadedState = loadLatestSnapshot();
    } catch (IOException e) {
      handleFailure(e);
      return;
    }

    currentState = loadedState;
    nextSeqNum = loadedState.getSeqNum() + 1;
    bootstrapped = true;
    LOG.info("Partition {} resuming at {}", partitionKey, nextSeqNum);

    catchUp();
  }

  @FiberOnly
  private S loadLatestSnapshot() throws IOException {
    final StoredSnapshot snapshot = snapshotStore.getLatest(partitionKey);
    if (snapshot == null) {
      LOG.info("Partition {} has no snapshot; starting from the empty state", partitionKey);
      return stateCodec.emptyState();
    }

    final S state = stateCodec.decode(snapshot.getState());
    if (state.getSeqNum() != snapshot.getSeqNum()) {
      throw new CorruptSnapshotException("Snapshot of partition " + partitionKey + " at " + snapshot.getSeqNum()
          + " holds a state at " + state.getSeqNum());
    }
    LOG.info("Partition {} loaded snapshot at {}", partitionKey, snapshot.getSeqNum());
    return state;
  }

  /**
   * Archive catch-up
   */

  @FiberOnly
  private void catchUp() {
    if (stopping || phase == ReplicaPhase.FAILED) {
      return;
    }
    if (phase != ReplicaPhase.ARCHIVE_CATCH_UP) {
      setPhase(ReplicaPhase.ARCHIVE_CATCH_UP);
      publishEvent(EventType.CATCH_UP_STARTED, null);
    }

    awaitOnFiber(liveLogReader.getOldestAvailableSeqNum(partitionKey), this::onRetentionFloor, (ignore) -> {
    });
  }

  @FiberOnly
  private void onRetentionFloor(long liveFloor) {
    // The floor is the first record still available live, so nextSeqNum == liveFloor needs no archive
    if (nextSeqNum >= liveFloor) {
      subscribe();
      return;
    }

    LOG.info("Partition {} reading [{}, {}) from the archive", partitionKey, nextSeqNum, liveFloor);
    try {
      applyFromArchive(liveFloor);
    } catch (IOException e) {
      handleFailure(e);
      return;
    }

    // The floor may have moved on while the archive was read
    catchUp();
  }

  @FiberOnly
  private void applyFromArchive(long toSeqNum) throws IOException {
    try (SequentialEntryIterator<LogRecord> records = archiveReader.readRange(partitionKey, nextSeqNum, toSeqNum)) {
      while (records.hasNext()) {
        if (stopping) {
          LOG.info("Partition {} abandoning archive read at {} to stop", partitionKey, nextSeqNum);
          return;
        }

        final LogRecord record = records.next();
        if (record.getSeqNum() != nextSeqNum) {
          throw new RangeUnavailableException(partitionKey, nextSeqNum,
              "Archive of partition " + partitionKey + " returned record " + record.getSeqNum()
                  + " in place of " + nextSeqNum);
        }
        applyRecord(record);
      }
    }

    if (nextSeqNum < toSeqNum && !stopping) {
      throw new RangeUnavailableException(partitionKey, nextSeqNum,
          "Archive of partition " + partitionKey + " ended before record " + nextSeqNum);
    }
  }

  /**
   * Live streaming
   */

  @FiberOnly
  private void subscribe() {
    final long subscriptionGeneration = requestGeneration + 1;
    final long fromSeqNum = nextSeqNum;
    final LiveLogListener listener = new LiveLogListener() {
      @Override
      public void onRecord(LogRecord record) {
        if (isCurrent(subscriptionGeneration)) {
          onLiveRecord(record);
        }
      }

      @Override
      public void onDisconnect(Throwable cause) {
        if (isCurrent(subscriptionGeneration)) {
          onLiveDisconnect(cause);
        }
      }
    };

    awaitOnFiber(liveLogReader.subscribe(partitionKey, fromSeqNum, fiber, listener),
        (newSubscription) -> onSubscribed(newSubscription, fromSeqNum),
        Disposable::dispose);
  }

  /**
   * @param fromSeqNum The first record the subscription was opened for. Retained records from there on
   *                   may already have been applied by the time this runs.
   */
  @FiberOnly
  private void onSubscribed(Disposable newSubscription, long fromSeqNum) {
    subscription = newSubscription;
    backoff.reset();
    setPhase(ReplicaPhase.LIVE_STREAMING);
    publishEvent(EventType.LIVE, null);
    LOG.info("Partition {} streaming live from {}, now at {}", partitionKey, fromSeqNum, currentState.getSeqNum());

    startFuture.set(currentState);
  }

  @FiberOnly
  private void onLiveRecord(LogRecord record) {
    if (record.getSeqNum() < nextSeqNum) {
      duplicateCount.incrementAndGet();
      LOG.debug("Partition {} discarding duplicate record {} (expecting {})",
          partitionKey, record.getSeqNum(), nextSeqNum);
      return;
    }
    if (record.getSeqNum() > nextSeqNum) {
      failReplica(new SequenceGapException(partitionKey, nextSeqNum, record.getSeqNum()));
      return;
    }

    try {
      applyRecord(record);
    } catch (MalformedEventException e) {
      failReplica(e);
    }
  }

  @FiberOnly
  private void onLiveDisconnect(Throwable cause) {
    LOG.warn("Partition {} lost its live subscription at {}: {}", partitionKey, nextSeqNum, cause.toString());
    disposeSubscription();
    publishEvent(EventType.DISCONNECTED, cause);
    if (cause instanceof IOException) {
      handleFailure(cause);
    } else {
      handleFailure(new TransientTransportException("Live subscription of partition " + partitionKey + " lost", cause));
    }
  }

  /**
   * Applying events
   */

  @FiberOnly
  private void applyRecord(LogRecord record) throws MalformedEventException {
    final P payload;
    try {
      payload = payloadCodec.decode(record.getBody());
    } catch (MalformedEventException e) {
      if (malformedEventPolicy == MalformedEventPolicy.FAIL_FAST) {
        throw e;
      }
      LOG.warn("Partition {} skipping malformed record {}: {}", partitionKey, record.getSeqNum(), e.getMessage());
      malformedSkippedCount.incrementAndGet();
      publishState(reducer.skip(currentState, record.getSeqNum()));
      return;
    }

    final Event<P> event = new Event<>(partitionKey, record.getSeqNum(), record.getEnqueuedAt(), payload);
    publishState(reducer.apply(currentState, event));
    appliedCount.incrementAndGet();
  }

  @FiberOnly
  private void publishState(S newState) {
    if (newState.getSeqNum() != nextSeqNum) {
      throw new IllegalStateException("Reducer produced state at " + newState.getSeqNum()
          + " when applying record " + nextSeqNum);
    }
    currentState = newState;
    nextSeqNum++;
  }

  /**
   * Failure, retry and shutdown
   */

  @FiberOnly
  private void handleFailure(Throwable cause) {
    if (stopping || phase == ReplicaPhase.FAILED) {
      return;
    }
    if (isFatal(cause)) {
      failReplica(cause);
      return;
    }

    final long delay = backoff.nextDelayMillis();
    reconnectCount.incrementAndGet();
    LOG.warn("Partition {} retrying in {} ms after: {}", partitionKey, delay, cause.toString());

    requestGeneration++;
    disposeSubscription();
    pendingRetry = fiber.schedule(() -> {
      pendingRetry = null;
      if (bootstrapped) {
        catchUp();
      } else {
        bootstrap();
      }
    }, delay, TimeUnit.MILLISECONDS);
  }

  private static boolean isFatal(Throwable cause) {
    if (cause instanceof RangeUnavailableException
        || cause instanceof CorruptSnapshotException
        || cause instanceof MalformedEventException) {
      return true;
    }
    return !(cause instanceof IOException);
  }

  @FiberOnly
  private void failReplica(Throwable cause) {
    if (phase == ReplicaPhase.FAILED || phase == ReplicaPhase.STOPPED) {
      return;
    }
    LOG.error("Partition {} replica failed at {}; serving its last state from now on",
        partitionKey, currentState.getSeqNum(), cause);

    failureCause = cause;
    requestGeneration++;
    disposeSubscription();
    cancelPendingRetry();
    setPhase(ReplicaPhase.FAILED);
    publishEvent(EventType.FAILED, cause);

    startFuture.setException(cause);
  }

  @FiberOnly
  private void shutdown() {
    requestGeneration++;
    disposeSubscription();
    cancelPendingRetry();

    if (phase != ReplicaPhase.FAILED) {
      setPhase(ReplicaPhase.STOPPED);
    }
    publishEvent(EventType.STOPPED, null);
    LOG.info("Partition {} replica stopped at {}", partitionKey, currentState.getSeqNum());

    startFuture.cancel(false);
    stopFuture.set(null);
    fiber.dispose();
  }

  @FiberOnly
  private void disposeSubscription() {
    if (subscription != null) {
      subscription.dispose();
      subscription = null;
    }
  }

  @FiberOnly
  private void cancelPendingRetry() {
    if (pendingRetry != null) {
      pendingRetry.dispose();
      pendingRetry = null;
    }
  }

  /**
   * Run onSuccess on the fiber when the request completes, unless it fails, times out, or is overtaken by a
   * later request, retry, failure or stop. A result that arrives after being overtaken is passed to onStale.
   */
  @FiberOnly
  private <V> void awaitOnFiber(ListenableFuture<V> request, Consumer<V> onSuccess, Consumer<V> onStale) {
    final long generation = ++requestGeneration;

    final Disposable timeout = fiber.schedule(() -> {
      if (isCurrent(generation)) {
        handleFailure(new TransientTransportException("No reply from the log service for partition "
            + partitionKey + " within " + transportTimeoutMillis + " ms"));
      }
    }, transportTimeoutMillis, TimeUnit.MILLISECONDS);

    PumpFutures.addCallback(request,
        (V result) -> {
          timeout.dispose();
          if (isCurrent(generation)) {
            onSuccess.accept(result);
          } else {
            onStale.accept(result);
          }
        },
        (Throwable t) -> {
          timeout.dispose();
          if (isCurrent(generation)) {
            handleFailure(t);
          }
        },
        fiber);
  }

  private boolean isCurrent(long generation) {
    return generation == requestGeneration && !stopping && phase != ReplicaPhase.FAILED;
  }

  private void setPhase(ReplicaPhase newPhase) {
    phase = newPhase;
  }

  private void publishEvent(EventType eventType, @Nullable Throwable error) {
    eventChannel.publish(new ReplicaEvent(eventType, partitionKey, currentState.getSeqNum(),
        clock.currentTimeMillis(), error));
  }
}
