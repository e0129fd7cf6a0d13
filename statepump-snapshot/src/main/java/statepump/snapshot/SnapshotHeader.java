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

package statepump.snapshot;

import io.protostuff.Tag;

/**
 * Serialized header of a snapshot blob. Tag numbers are never reused.
 */
public class SnapshotHeader {
  @Tag(1)
  private long seqNum;
  @Tag(2)
  private long createdAt;
  @Tag(3)
  private int formatVersion;
  @Tag(4)
  private int contentLength;
  @Tag(5)
  private String partitionKey;

  public SnapshotHeader() {
  }

  public SnapshotHeader(String partitionKey, long seqNum, long createdAt, int formatVersion, int contentLength) {
    this.partitionKey = partitionKey;
    this.seqNum = seqNum;
    this.createdAt = createdAt;
    this.formatVersion = formatVersion;
    this.contentLength = contentLength;
  }

  public long getSeqNum() {
    return seqNum;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public int getFormatVersion() {
    return formatVersion;
  }

  public int getContentLength() {
    return contentLength;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  @Override
  public String toString() {
    return "SnapshotHeader{" +
        "partitionKey='" + partitionKey + '\'' +
        ", seqNum=" + seqNum +
        ", createdAt=" + createdAt +
        ", formatVersion=" + formatVersion +
        ", contentLength=" + contentLength +
        '}';
  }
}
