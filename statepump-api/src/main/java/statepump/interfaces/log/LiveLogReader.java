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

import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;

/**
 * Client of a partitioned, retention-bounded log service. Each partition holds records with
 * contiguous sequence numbers starting at 0; records older than the retention floor have been
 * expired and can only be found in the capture archive.
 */
public interface LiveLogReader {
  /**
   * Find the oldest sequence number still retained in the partition. The floor may advance at any
   * time. If the partition has never held a record, or has expired all of them, the floor is the
   * sequence number the next appended record will receive.
   *
   * @return A future completing with the floor, or failing with {@link TransientTransportException}.
   */
  ListenableFuture<Long> getOldestAvailableSeqNum(String partitionKey);

  /**
   * Open a tailing subscription. Records with sequence numbers from fromSeqNum onwards are passed to
   * the listener on the given fiber, in order, as they become available. Delivery is at-least-once: a
   * record may be delivered more than once, and the subscription may start before fromSeqNum. A lost
   * connection is reported through {@link LiveLogListener#onDisconnect}, never by falling silent.
   *
   * @return A future completing, once the subscription is established, with a Disposable that cancels
   * it; or failing with {@link TransientTransportException}.
   */
  ListenableFuture<Disposable> subscribe(String partitionKey, long fromSeqNum, Fiber fiber,
                                         LiveLogListener listener);
}
