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

package statepump.interfaces.log;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * An event as it is held by the partitioned log and by the capture archive: a sequence number
 * and the metadata assigned on enqueue, plus the still-encoded body. The body is decoded into
 * a domain payload only by the replica that applies it.
 */
public final class LogRecord extends SequentialEntry {
  private final String partitionKey;
  private final long enqueuedAt;
  private final ByteBuffer body;

  public LogRecord(String partitionKey, long seqNum, long enqueuedAt, ByteBuffer body) {
    super(seqNum);

    assert partitionKey != null;
    assert body != null;

    this.partitionKey = partitionKey;
    this.enqueuedAt = enqueuedAt;
    this.body = body.asReadOnlyBuffer();
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  /**
   * Milliseconds since the epoch at which the log service accepted the record. Informational only.
   */
  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  /**
   * @return A new read-only view of the body, positioned at its start.
   */
  public ByteBuffer getBody() {
    return body.duplicate();
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    LogRecord that = (LogRecord) o;
    return this.seqNum == that.seqNum
        && this.enqueuedAt == that.enqueuedAt
        && this.partitionKey.equals(that.partitionKey)
        && this.body.equals(that.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partitionKey, seqNum, enqueuedAt, body);
  }

  @Override
  public String toString() {
    return "LogRecord{" +
        "partitionKey='" + partitionKey + '\'' +
        ", seqNum=" + seqNum +
        ", enqueuedAt=" + enqueuedAt +
        ", bodyLength=" + body.remaining() +
        '}';
  }
}
