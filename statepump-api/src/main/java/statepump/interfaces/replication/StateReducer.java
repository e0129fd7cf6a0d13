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
 * Domain semantics of a replica: folds events into states.
 * <p>
 * Implementations must be pure and deterministic, and must not throw for any event whose payload
 * decoded successfully. The returned state may share unmodified substructure with the input, but
 * the input must remain valid and unchanged.
 *
 * @param <S> State type
 * @param <P> Payload type
 */
public interface StateReducer<S extends ReplicaState, P> {
  /**
   * @return The state after the event; its sequence number is the event's.
   */
  S apply(S state, Event<P> event);

  /**
   * Advance the state past an event that could not be decoded, without otherwise changing it.
   *
   * @return A state equal in content to the input, whose sequence number is seqNum.
   */
  S skip(S state, long seqNum);
}
