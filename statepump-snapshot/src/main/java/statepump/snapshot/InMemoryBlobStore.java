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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentSkipListMap;

import static statepump.log.EntryEncodingUtil.toByteArray;

/**
 * BlobStore held in memory, for tests and for embedding without durable snapshots.
 */
public class InMemoryBlobStore implements BlobStore {
  private final ConcurrentSkipListMap<String, byte[]> blobs = new ConcurrentSkipListMap<>();

  @Override
  public void put(String key, ByteBuffer[] content) {
    blobs.put(key, toByteArray(content));
  }

  @Nullable
  @Override
  public InputStream get(String key) {
    final byte[] blob = blobs.get(key);
    return blob == null ? null : new ByteArrayInputStream(blob);
  }

  @Override
  public ImmutableList<String> list(String prefix) {
    return ImmutableList.copyOf(blobs.tailMap(prefix).keySet().stream()
        .filter((key) -> key.startsWith(prefix))
        .iterator());
  }

  @Override
  public boolean delete(String key) {
    return blobs.remove(key) != null;
  }
}
