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

import org.jetbrains.annotations.Nullable;

/**
 * A lifecycle notice published by a replica on its event channel.
 */
public class ReplicaEvent {

  public enum EventType {
    STARTED,
    CATCH_UP_STARTED,
    LIVE,
    DISCONNECTED,
    FAILED,
    STOPPED,
  }

  public final EventType eventType;
  public final String partitionKey;
  public final long seqNum;
  public final long eventTime;
  public final Throwable error;

  public ReplicaEvent(EventType eventType,
                      String partitionKey,
                      long seqNum,
                      long eventTime,
                      @Nullable Throwable error) {
    this.eventType = eventType;
    this.partitionKey = partitionKey;
    this.seqNum = seqNum;
    this.eventTime = eventTime;
    this.error = error;
  }

  @Override
  public String toString() {
    return "ReplicaEvent{" +
        "eventType=" + eventType +
        ", partitionKey='" + partitionKey + '\'' +
        ", seqNum=" + seqNum +
        ", eventTime=" + eventTime +
        ", error=" + error +
        '}';
  }
}
