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

import static statepump.interfaces.log.SequentialEntryIterable.SequentialEntryIterator;

/**
 * Read-only access to the cold archive holding records already expired from the live log.
 */
public interface ArchiveReader {
  /**
   * Return a lazy iterator over exactly the records with sequence numbers in [fromSeqNum, toSeqNum),
   * in ascending order. A range that cannot be satisfied in full is never returned partially: if any
   * record in the range is absent the call, or a later call on the iterator, throws
   * RangeUnavailableException. The method may be called again after a failure, with the same or a
   * later start.
   *
   * @throws RangeUnavailableException if the archive does not hold the whole range.
   * @throws IOException               for any other failure reading the archive.
   */
  SequentialEntryIterator<LogRecord> readRange(String partitionKey, long fromSeqNum, long toSeqNum)
      throws IOException;
}
