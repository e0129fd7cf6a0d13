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

import static statepump.ReplicaConstants.REPLICA_DEFAULT_BACKOFF_BASE_MILLISECONDS;
import static statepump.ReplicaConstants.REPLICA_DEFAULT_BACKOFF_MAX_MILLISECONDS;
import static statepump.ReplicaConstants.REPLICA_DEFAULT_MALFORMED_EVENT_POLICY;
import static statepump.ReplicaConstants.REPLICA_DEFAULT_TRANSPORT_TIMEOUT_MILLISECONDS;
import static statepump.ReplicaConstants.SNAPSHOT_DEFAULT_EVENT_COUNT_THRESHOLD;
import static statepump.ReplicaConstants.SNAPSHOT_DEFAULT_INTERVAL_MILLISECONDS;
import static statepump.ReplicaConstants.SNAPSHOT_DEFAULT_POLL_INTERVAL_MILLISECONDS;
import static statepump.ReplicaConstants.SNAPSHOT_DEFAULT_RETAINED;

/**
 * The default settings, for the given partitions.
 */
public class DefaultReplicaConfiguration implements ReplicaConfiguration {
  private final ImmutableList<String> partitionKeys;
  private final ReplicaClock clock = new DefaultSystemTimeReplicaClock();

  public DefaultReplicaConfiguration(ImmutableList<String> partitionKeys) {
    this.partitionKeys = partitionKeys;
  }

  public DefaultReplicaConfiguration(String... partitionKeys) {
    this(ImmutableList.copyOf(partitionKeys));
  }

  @Override
  public ImmutableList<String> getPartitionKeys() {
    return partitionKeys;
  }

  @Override
  public long getTransportTimeoutMillis() {
    return REPLICA_DEFAULT_TRANSPORT_TIMEOUT_MILLISECONDS;
  }

  @Override
  public long getBackoffBaseMillis() {
    return REPLICA_DEFAULT_BACKOFF_BASE_MILLISECONDS;
  }

  @Override
  public long getBackoffMaxMillis() {
    return REPLICA_DEFAULT_BACKOFF_MAX_MILLISECONDS;
  }

  @Override
  public MalformedEventPolicy getMalformedEventPolicy() {
    return REPLICA_DEFAULT_MALFORMED_EVENT_POLICY;
  }

  @Override
  public long getSnapshotIntervalMillis() {
    return SNAPSHOT_DEFAULT_INTERVAL_MILLISECONDS;
  }

  @Override
  public long getSnapshotEventCountThreshold() {
    return SNAPSHOT_DEFAULT_EVENT_COUNT_THRESHOLD;
  }

  @Override
  public long getSnapshotPollIntervalMillis() {
    return SNAPSHOT_DEFAULT_POLL_INTERVAL_MILLISECONDS;
  }

  @Override
  public int getSnapshotsRetained() {
    return SNAPSHOT_DEFAULT_RETAINED;
  }

  @Override
  public ReplicaClock getClock() {
    return clock;
  }
}
