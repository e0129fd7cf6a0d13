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

import statepump.interfaces.log.LogRecord;

import java.io.IOException;
import java.util.List;

/**
 * Receives records as they expire from the live log, so that they can be kept in the archive.
 */
public interface RecordCaptureSink {
  /**
   * @param records Consecutive records of one partition, in ascending order; never empty.
   * @throws IOException if the records could not be stored; the caller must then not expire them.
   */
  void capture(String partitionKey, List<LogRecord> records) throws IOException;
}
