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

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.log.ArchiveReader;
import statepump.interfaces.log.LiveLogReader;
import statepump.interfaces.replication.PayloadCodec;
import statepump.interfaces.replication.Replica;
import statepump.interfaces.replication.ReplicaEvent;
import statepump.interfaces.replication.ReplicaState;
import statepump.interfaces.replication.StateCodec;
import statepump.interfaces.replication.StateReducer;
import statepump.interfaces.snapshot.SnapshotStore;
import statepump.util.FiberSupplier;
import statepump.util.PumpFutures;
import statepump.util.ThreadFiberSupplier;

import java.util.ArrayList;
import java.util.List;

import static statepump.ReplicaConstants.REPLICA_THREAD_NAME_PREFIX;

/**
 * Hosts one {@link ReplicationEngine} and one {@link SnapshotScheduler} for each configured partition.
 * The service is running once every replica has caught up to its live log; it fails if any replica fails
 * to start. A replica that fails afterwards is logged and keeps serving its last state; the others are
 * unaffected.
 *
 * @param <S> State type
 * @param <P> Event payload type
 */
public class ReplicaService<S extends ReplicaState, P> extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(ReplicaService.class);

  private final FiberSupplier fiberSupplier;
  private final ImmutableMap<String, ReplicationEngine<S, P>> replicas;
  private final ImmutableMap<String, SnapshotScheduler<S>> snapshotSchedulers;

  private Fiber fiber;

  public ReplicaService(FiberSupplier fiberSupplier,
                        SnapshotStore snapshotStore,
                        ArchiveReader archiveReader,
                        LiveLogReader liveLogReader,
                        StateCodec<S> stateCodec,
                        PayloadCodec<P> payloadCodec,
                        StateReducer<S, P> reducer,
                        ReplicaConfiguration configuration) {
    this.fiberSupplier = fiberSupplier;

    final ImmutableMap.Builder<String, ReplicationEngine<S, P>> replicaBuilder = ImmutableMap.builder();
    final ImmutableMap.Builder<String, SnapshotScheduler<S>> schedulerBuilder = ImmutableMap.builder();
    for (String partitionKey : configuration.getPartitionKeys()) {
      final ReplicationEngine<S, P> engine = new ReplicationEngine<>(partitionKey, fiberSupplier, snapshotStore,
          archiveReader, liveLogReader, stateCodec, payloadCodec, reducer, configuration);
      replicaBuilder.put(partitionKey, engine);
      schedulerBuilder.put(partitionKey, new SnapshotScheduler<>(partitionKey, engine::getCurrentState,
          stateCodec, snapshotStore, fiberSupplier, configuration));
    }
    this.replicas = replicaBuilder.build();
    this.snapshotSchedulers = schedulerBuilder.build();
  }

  public ReplicaService(SnapshotStore snapshotStore,
                        ArchiveReader archiveReader,
                        LiveLogReader liveLogReader,
                        StateCodec<S> stateCodec,
                        PayloadCodec<P> payloadCodec,
                        StateReducer<S, P> reducer,
                        ReplicaConfiguration configuration) {
    this(new ThreadFiberSupplier(REPLICA_THREAD_NAME_PREFIX), snapshotStore, archiveReader, liveLogReader,
        stateCodec, payloadCodec, reducer, configuration);
  }

  @Nullable
  public Replica<S> getReplica(String partitionKey) {
    return replicas.get(partitionKey);
  }

  @Nullable
  public SnapshotScheduler<S> getSnapshotScheduler(String partitionKey) {
    return snapshotSchedulers.get(partitionKey);
  }

  /**
   * ********** Service startup and shutdown **************
   */
  @Override
  protected void doStart() {
    fiber = fiberSupplier.getFiber(this::failModule);
    setupEventChannelSubscriptions();
    fiber.start();

    final List<ListenableFuture<S>> startFutures = new ArrayList<>();
    replicas.values().forEach((replica) -> startFutures.add(replica.start()));

    PumpFutures.addCallback(Futures.allAsList(startFutures),
        (ignore) -> {
          snapshotSchedulers.values().forEach(SnapshotScheduler::start);
          LOG.info("All {} replicas are live", replicas.size());
          notifyStarted();
        },
        (Throwable t) -> {
          LOG.error("ReplicaService unable to start all replicas", t);
          failModule(t);
        }, fiber);
  }

  protected void failModule(Throwable t) {
    LOG.error("ReplicaService failure, stopping all replicas", t);
    try {
      snapshotSchedulers.values().forEach(SnapshotScheduler::stop);
      replicas.values().forEach(ReplicationEngine::stop);
      fiber.dispose();
    } finally {
      notifyFailed(t);
    }
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      snapshotSchedulers.values().forEach(SnapshotScheduler::stop);

      final List<ListenableFuture<Void>> stopFutures = new ArrayList<>();
      replicas.values().forEach((replica) -> stopFutures.add(replica.stop()));

      PumpFutures.addCallback(Futures.allAsList(stopFutures),
          (ignore) -> {
            fiber.dispose();
            notifyStopped();
          },
          this::failModule, fiber);
    });
  }

  private void setupEventChannelSubscriptions() {
    replicas.values().forEach((replica) -> replica.getEventChannel().subscribe(fiber, message -> {
      if (message.eventType == ReplicaEvent.EventType.FAILED) {
        LOG.error("Replica of partition {} failed at {}; it keeps serving that state. Error {}",
            message.partitionKey, message.seqNum, message.error);
      } else {
        LOG.debug("Replica indicates state change {}", message);
      }
    }));
  }
}
