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

package statepump;

import statepump.interfaces.replication.MalformedEventPolicy;

public class ReplicaConstants {
  public static final long REPLICA_DEFAULT_TRANSPORT_TIMEOUT_MILLISECONDS = 10_000;
  public static final long REPLICA_DEFAULT_BACKOFF_BASE_MILLISECONDS = 100;
  public static final long REPLICA_DEFAULT_BACKOFF_MAX_MILLISECONDS = 30_000;
  public static final MalformedEventPolicy REPLICA_DEFAULT_MALFORMED_EVENT_POLICY = MalformedEventPolicy.FAIL_FAST;

  public static final long SNAPSHOT_DEFAULT_INTERVAL_MILLISECONDS = 5 * 60 * 1000;
  public static final long SNAPSHOT_DEFAULT_EVENT_COUNT_THRESHOLD = 10_000;
  public static final long SNAPSHOT_DEFAULT_POLL_INTERVAL_MILLISECONDS = 1000;
  public static final int SNAPSHOT_DEFAULT_RETAINED = 5;

  public static final String REPLICA_THREAD_NAME_PREFIX = "replica";
}
