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

import statepump.interfaces.snapshot.CorruptSnapshotException;

import java.nio.ByteBuffer;

/**
 * Serializes full states for snapshotting.
 */
public interface StateCodec<S extends ReplicaState> {
  /**
   * @return The state preceding the first event of a partition; its sequence number is -1.
   */
  S emptyState();

  ByteBuffer encode(S state);

  /**
   * @throws CorruptSnapshotException if the bytes do not hold a state this codec can read.
   */
  S decode(ByteBuffer serialized) throws CorruptSnapshotException;
}
