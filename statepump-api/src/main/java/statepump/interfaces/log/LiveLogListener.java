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

import statepump.util.FiberOnly;

/**
 * Receives the records of one live subscription. Both methods are invoked on the fiber passed to
 * {@link LiveLogReader#subscribe}, one invocation per arrival.
 */
public interface LiveLogListener {
  @FiberOnly
  void onRecord(LogRecord record);

  /**
   * The subscription's connection was lost; no further records will arrive on it. The cause is
   * normally a {@link TransientTransportException}.
   */
  @FiberOnly
  void onDisconnect(Throwable cause);
}
