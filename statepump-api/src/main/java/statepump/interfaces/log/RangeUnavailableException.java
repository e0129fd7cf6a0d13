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

import java.io.IOException;

/**
 * The archive cannot supply a contiguous range of records that was requested of it.
 */
public class RangeUnavailableException extends IOException {
  private final String partitionKey;
  private final long missingSeqNum;

  public RangeUnavailableException(String partitionKey, long missingSeqNum, String message) {
    super(message);
    this.partitionKey = partitionKey;
    this.missingSeqNum = missingSeqNum;
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  /**
   * @return The first sequence number of the requested range that the archive does not hold.
   */
  public long getMissingSeqNum() {
    return missingSeqNum;
  }
}
