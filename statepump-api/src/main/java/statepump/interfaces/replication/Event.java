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

import statepump.interfaces.log.SequentialEntry;

import java.util.Objects;

/**
 * An immutable domain fact, decoded from a {@link statepump.interfaces.log.LogRecord}.
 *
 * @param <P> Domain payload type
 */
public final class Event<P> extends SequentialEntry {
  private final String partitionKey;
  private final long enqueuedAt;
  private final P payload;

  public Event(String partitionKey, long seqNum, long enqueuedAt, P payload) {
    super(seqNum);

    assert partitionKey != null;
    assert payload != null;

    this.partitionKey = partitionKey;
    this.enqueuedAt = enqueuedAt;
    this.payload = payload;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  public P getPayload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    Event<?> that = (Event<?>) o;
    return this.seqNum == that.seqNum
        && this.enqueuedAt == that.enqueuedAt
        && this.partitionKey.equals(that.partitionKey)
        && this.payload.equals(that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partitionKey, seqNum, enqueuedAt, payload);
  }

  @Override
  public String toString() {
    return "Event{" +
        "partitionKey='" + partitionKey + '\'' +
        ", seqNum=" + seqNum +
        ", payload=" + payload +
        '}';
  }
}
