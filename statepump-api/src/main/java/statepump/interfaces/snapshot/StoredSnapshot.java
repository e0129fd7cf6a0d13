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

import java.nio.ByteBuffer;

/**
 * A durable serialization of a replica state, tagged with the sequence number it reflects.
 */
public final class StoredSnapshot {
  private final String partitionKey;
  private final long seqNum;
  private final long createdAt;
  private final ByteBuffer state;

  public StoredSnapshot(String partitionKey, long seqNum, long createdAt, ByteBuffer state) {
    this.partitionKey = partitionKey;
    this.seqNum = seqNum;
    this.createdAt = createdAt;
    this.state = state.asReadOnlyBuffer();
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public long getSeqNum() {
    return seqNum;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public ByteBuffer getState() {
    return state.duplicate();
  }

  @Override
  public String toString() {
    return "StoredSnapshot{" +
        "partitionKey='" + partitionKey + '\'' +
        ", seqNum=" + seqNum +
        ", createdAt=" + createdAt +
        ", stateLength=" + state.remaining() +
        '}';
  }
}
