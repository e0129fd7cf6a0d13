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

package statepump.interfaces.snapshot;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Reads and writes the snapshots of replica states. The latest snapshot of a partition is always the
 * one with the highest sequence number.
 */
public interface SnapshotStore {
  /**
   * @return The snapshot with the highest sequence number for the partition, or null if none exists.
   * @throws CorruptSnapshotException if that snapshot fails its integrity checks.
   */
  @Nullable
  StoredSnapshot getLatest(String partitionKey) throws IOException;

  /**
   * Store a snapshot, unless one with an equal or higher sequence number is already stored.
   *
   * @return True if the snapshot was written; false if it was rejected as not newer than the latest.
   */
  boolean write(String partitionKey, long seqNum, ByteBuffer serializedState) throws IOException;

  /**
   * Delete all but the newest snapshots of a partition.
   *
   * @return The number of snapshots deleted.
   */
  int retainLatest(String partitionKey, int count) throws IOException;
}
