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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import statepump.interfaces.replication.MalformedEventPolicy;

import java.util.Properties;

/**
 * Settings read from statepump.* properties; any absent property takes its default.
 */
public class PropertiesReplicaConfiguration extends DefaultReplicaConfiguration {
  public static final String PARTITIONS = "statepump.partitions";
  public static final String TRANSPORT_TIMEOUT_MS = "statepump.transport.timeout.ms";
  public static final String BACKOFF_BASE_MS = "statepump.backoff.base.ms";
  public static final String BACKOFF_MAX_MS = "statepump.backoff.max.ms";
  public static final String MALFORMED_EVENT_POLICY = "statepump.malformed.policy";
  public static final String SNAPSHOT_INTERVAL_MS = "statepump.snapshot.interval.ms";
  public static final String SNAPSHOT_EVENT_THRESHOLD = "statepump.snapshot.event.threshold";
  public static final String SNAPSHOT_POLL_MS = "statepump.snapshot.poll.ms";
  public static final String SNAPSHOTS_RETAINED = "statepump.snapshot.retained";

  private final Properties properties;

  public PropertiesReplicaConfiguration(Properties properties) {
    super(ImmutableList.copyOf(Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .split(properties.getProperty(PARTITIONS, ""))));
    this.properties = properties;

    if (getPartitionKeys().isEmpty()) {
      throw new IllegalArgumentException("No partitions configured; set " + PARTITIONS);
    }
    if (getBackoffBaseMillis() <= 0 || getBackoffMaxMillis() < getBackoffBaseMillis()) {
      throw new IllegalArgumentException(BACKOFF_BASE_MS + " must be positive and at most " + BACKOFF_MAX_MS);
    }
    if (getTransportTimeoutMillis() <= 0 || getSnapshotPollIntervalMillis() <= 0) {
      throw new IllegalArgumentException(TRANSPORT_TIMEOUT_MS + " and " + SNAPSHOT_POLL_MS + " must be positive");
    }
  }

  @Override
  public long getTransportTimeoutMillis() {
    return getLong(TRANSPORT_TIMEOUT_MS, super.getTransportTimeoutMillis());
  }

  @Override
  public long getBackoffBaseMillis() {
    return getLong(BACKOFF_BASE_MS, super.getBackoffBaseMillis());
  }

  @Override
  public long getBackoffMaxMillis() {
    return getLong(BACKOFF_MAX_MS, super.getBackoffMaxMillis());
  }

  @Override
  public MalformedEventPolicy getMalformedEventPolicy() {
    final String value = properties.getProperty(MALFORMED_EVENT_POLICY);
    if (value == null) {
      return super.getMalformedEventPolicy();
    }
    try {
      return MalformedEventPolicy.valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + MALFORMED_EVENT_POLICY + ": " + value, e);
    }
  }

  @Override
  public long getSnapshotIntervalMillis() {
    return getLong(SNAPSHOT_INTERVAL_MS, super.getSnapshotIntervalMillis());
  }

  @Override
  public long getSnapshotEventCountThreshold() {
    return getLong(SNAPSHOT_EVENT_THRESHOLD, super.getSnapshotEventCountThreshold());
  }

  @Override
  public long getSnapshotPollIntervalMillis() {
    return getLong(SNAPSHOT_POLL_MS, super.getSnapshotPollIntervalMillis());
  }

  @Override
  public int getSnapshotsRetained() {
    return (int) getLong(SNAPSHOTS_RETAINED, super.getSnapshotsRetained());
  }

  private long getLong(String key, long defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      final long parsed = Long.parseLong(value.trim());
      if (parsed < 0) {
        throw new IllegalArgumentException("Negative " + key + ": " + value);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
    }
  }
}
