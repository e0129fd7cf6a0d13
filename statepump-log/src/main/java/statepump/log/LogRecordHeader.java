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

package statepump.log;

import io.protostuff.Tag;

/**
 * Serialized header of a log record. Tag numbers are never reused.
 */
public class LogRecordHeader {
  @Tag(1)
  private long seqNum;
  @Tag(2)
  private String partitionKey;
  @Tag(3)
  private long enqueuedAt;
  @Tag(4)
  private int contentLength;

  public LogRecordHeader() {
  }

  public LogRecordHeader(long seqNum, String partitionKey, long enqueuedAt, int contentLength) {
    this.seqNum = seqNum;
    this.partitionKey = partitionKey;
    this.enqueuedAt = enqueuedAt;
    this.contentLength = contentLength;
  }

  public long getSeqNum() {
    return seqNum;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  public int getContentLength() {
    return contentLength;
  }

  @Override
  public String toString() {
    return "LogRecordHeader{" +
        "seqNum=" + seqNum +
        ", partitionKey='" + partitionKey + '\'' +
        ", enqueuedAt=" + enqueuedAt +
        ", contentLength=" + contentLength +
        '}';
  }
}
