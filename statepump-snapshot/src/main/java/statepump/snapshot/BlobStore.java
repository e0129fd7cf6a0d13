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

package statepump.snapshot;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * A key to blob store. Keys are '/'-separated paths. A blob, once put, is replaced only as a whole,
 * so a reader sees either the old blob or the new one.
 */
public interface BlobStore {
  void put(String key, ByteBuffer[] content) throws IOException;

  /**
   * @return A stream over the blob's content, which the caller must close; or null if there is no such blob.
   */
  @Nullable
  InputStream get(String key) throws IOException;

  /**
   * @return The keys beginning with the prefix, in ascending lexicographic order.
   */
  ImmutableList<String> list(String prefix) throws IOException;

  /**
   * @return True if the blob existed.
   */
  boolean delete(String key) throws IOException;
}
