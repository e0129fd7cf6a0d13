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

import com.google.common.collect.ImmutableList;
import statepump.interfaces.replication.MalformedEventPolicy;

/**
 * Settings of a {@link ReplicaService} and of the engines and snapshot schedulers it hosts.
 */
public interface ReplicaConfiguration {
  /**
   * The partitions to replicate, one engine each.
   */
  ImmutableList<String> getPartitionKeys();

  /**
   * How long to wait for the log service to answer a request before treating it as disconnected.
   */
  long getTransportTimeoutMillis();

  long getBackoffBaseMillis();

  long getBackoffMaxMillis();

  MalformedEventPolicy getMalformedEventPolicy();

  /**
   * Wall-clock time between snapshots; 0 disables time-based snapshots.
   */
  long getSnapshotIntervalMillis();

  /**
   * Number of events after which to snapshot; 0 disables count-based snapshots.
   */
  long getSnapshotEventCountThreshold();

  /**
   * How often the snapshot scheduler checks whether a snapshot is due.
   */
  long getSnapshotPollIntervalMillis();

  /**
   * Number of snapshots kept per partition after each write; 0 keeps all of them.
   */
  int getSnapshotsRetained();

  ReplicaClock getClock();
}
