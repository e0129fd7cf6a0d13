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

package statepump.interfaces.replication;

import com.google.common.util.concurrent.ListenableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Subscriber;

/**
 * The read API of one partition's in-memory replica, and its lifecycle.
 *
 * @param <S> State type
 */
public interface Replica<S extends ReplicaState> {
  String getPartitionKey();

  /**
   * Resume from the latest snapshot and catch up to the live log.
   *
   * @return A future completing with the first state published while streaming live, or failing
   * with the cause of an unrecoverable startup error.
   */
  ListenableFuture<S> start();

  /**
   * Non-blocking. Returns the most recently published state; after a failure, the last good one.
   */
  S getCurrentState();

  /**
   * Close the subscription and release resources. Idempotent.
   *
   * @return A future completing once the replica has stopped.
   */
  ListenableFuture<Void> stop();

  ReplicaPhase getPhase();

  /**
   * @return False once the replica has failed; its state no longer advances.
   */
  boolean isHealthy();

  @Nullable
  Throwable getFailureCause();

  Subscriber<ReplicaEvent> getEventChannel();

  long getAppliedCount();

  long getDuplicateCount();

  long getMalformedSkippedCount();

  long getReconnectCount();
}
