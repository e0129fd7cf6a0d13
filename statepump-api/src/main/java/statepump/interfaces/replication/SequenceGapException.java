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

/**
 * The live log delivered a record beyond the one expected: some record was missed or expired.
 */
public class SequenceGapException extends Exception {
  private final long expectedSeqNum;
  private final long receivedSeqNum;

  public SequenceGapException(String partitionKey, long expectedSeqNum, long receivedSeqNum) {
    super("Partition " + partitionKey + ": expected record " + expectedSeqNum
        + " but received " + receivedSeqNum);
    this.expectedSeqNum = expectedSeqNum;
    this.receivedSeqNum = receivedSeqNum;
  }

  public long getExpectedSeqNum() {
    return expectedSeqNum;
  }

  public long getReceivedSeqNum() {
    return receivedSeqNum;
  }
}
