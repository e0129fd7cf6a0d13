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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.snapshot.CorruptSnapshotException;
import statepump.interfaces.snapshot.SnapshotStore;
import statepump.interfaces.snapshot.StoredSnapshot;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import static statepump.log.EntryEncodingUtil.CrcError;
import static statepump.log.EntryEncodingUtil.appendCrcToBufferList;
import static statepump.log.EntryEncodingUtil.decodeAndCheckCrc;
import static statepump.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static statepump.log.EntryEncodingUtil.getAndCheckContent;
import static statepump.snapshot.SnapshotConstants.SNAPSHOT_FORMAT_VERSION;
import static statepump.snapshot.SnapshotConstants.SNAPSHOT_KEY_PREFIX;
import static statepump.snapshot.SnapshotConstants.SNAPSHOT_LATEST_LOOKUP_ATTEMPTS;
import static statepump.snapshot.SnapshotConstants.SNAPSHOT_SEQNUM_DIGITS;

/**
 * SnapshotStore keeping each snapshot as a blob keyed by partition and zero-padded sequence number, so
 * that the lexicographically greatest key of a partition is its latest snapshot. A blob holds a header
 * and its CRC, followed by the serialized state and its CRC.
 * <p>
 * Writes for one partition are serialized, which makes the newer-than-latest check and the write atomic
 * with respect to other writers using this client.
 */
public class BlobSnapshotStore implements SnapshotStore {
  private static final Logger LOG = LoggerFactory.getLogger(BlobSnapshotStore.class);
  private static final Schema<SnapshotHeader> SCHEMA = RuntimeSchema.getSchema(SnapshotHeader.class);

  private final BlobStore blobStore;
  private final LongSupplier clock;
  private final ConcurrentHashMap<String, Object> partitionLocks = new ConcurrentHashMap<>();

  public BlobSnapshotStore(BlobStore blobStore, LongSupplier clock) {
    this.blobStore = blobStore;
    this.clock = clock;
  }

  public BlobSnapshotStore(BlobStore blobStore) {
    this(blobStore, System::currentTimeMillis);
  }

  @Nullable
  @Override
  public StoredSnapshot getLatest(String partitionKey) throws IOException {
    for (int attempt = 1; attempt <= SNAPSHOT_LATEST_LOOKUP_ATTEMPTS; attempt++) {
      final ImmutableList<String> keys = snapshotKeys(partitionKey);
      if (keys.isEmpty()) {
        return null;
      }

      for (String key : keys.reverse()) {
        try (InputStream blob = blobStore.get(key)) {
          if (blob == null) {
            LOG.info("Snapshot {} was deleted while being located; trying the next newest", key);
            continue;
          }
          return decode(partitionKey, key, blob);
        }
      }
    }

    LOG.warn("Snapshots of partition {} kept disappearing during {} lookups; proceeding without one",
        partitionKey, SNAPSHOT_LATEST_LOOKUP_ATTEMPTS);
    return null;
  }

  @Override
  public boolean write(String partitionKey, long seqNum, ByteBuffer serializedState) throws IOException {
    if (seqNum < 0) {
      throw new IllegalArgumentException("BlobSnapshotStore#write: no snapshot of the empty state");
    }

    synchronized (lockFor(partitionKey)) {
      final long latestSeqNum = latestSeqNum(partitionKey);
      if (seqNum <= latestSeqNum) {
        LOG.info("Rejecting snapshot of partition {} at {}: snapshot at {} already stored",
            partitionKey, seqNum, latestSeqNum);
        return false;
      }

      final ByteBuffer content = serializedState.duplicate();
      final SnapshotHeader header = new SnapshotHeader(partitionKey, seqNum, clock.getAsLong(),
          SNAPSHOT_FORMAT_VERSION, content.remaining());

      final List<ByteBuffer> blobBufs = encodeWithLengthAndCrc(SCHEMA, header);
      blobBufs.addAll(appendCrcToBufferList(Collections.singletonList(content)));
      blobStore.put(keyFor(partitionKey, seqNum), blobBufs.toArray(new ByteBuffer[blobBufs.size()]));

      LOG.info("Wrote snapshot of partition {} at {}", partitionKey, seqNum);
      return true;
    }
  }

  @Override
  public int retainLatest(String partitionKey, int count) throws IOException {
    if (count < 1) {
      throw new IllegalArgumentException("BlobSnapshotStore#retainLatest: must retain at least one snapshot");
    }

    synchronized (lockFor(partitionKey)) {
      final ImmutableList<String> keys = snapshotKeys(partitionKey);
      int deleted = 0;
      for (String key : keys.subList(0, Math.max(0, keys.size() - count))) {
        if (blobStore.delete(key)) {
          deleted++;
        }
      }
      if (deleted > 0) {
        LOG.debug("Pruned {} snapshots of partition {}", deleted, partitionKey);
      }
      return deleted;
    }
  }

  /**
   * @return The sequence number of the latest snapshot of the partition, or -1 if there is none.
   */
  public long latestSeqNum(String partitionKey) throws IOException {
    final ImmutableList<String> keys = snapshotKeys(partitionKey);
    if (keys.isEmpty()) {
      return -1;
    }
    return seqNumOfKey(keys.get(keys.size() - 1));
  }

  static String keyFor(String partitionKey, long seqNum) {
    return partitionPrefix(partitionKey) + Strings.padStart(Long.toString(seqNum), SNAPSHOT_SEQNUM_DIGITS, '0');
  }

  private StoredSnapshot decode(String partitionKey, String key, InputStream blob) throws IOException {
    final SnapshotHeader header;
    final ByteBuffer state;
    try {
      header = decodeAndCheckCrc(blob, SCHEMA);
      if (header.getFormatVersion() > SNAPSHOT_FORMAT_VERSION) {
        throw new CorruptSnapshotException("Snapshot " + key + " has format version " + header.getFormatVersion()
            + "; the newest readable is " + SNAPSHOT_FORMAT_VERSION);
      }
      state = getAndCheckContent(blob, header.getContentLength());
    } catch (CrcError e) {
      throw new CorruptSnapshotException("Snapshot " + key + " failed its CRC check", e);
    } catch (EOFException e) {
      throw new CorruptSnapshotException("Snapshot " + key + " is truncated", e);
    }

    if (header.getSeqNum() != seqNumOfKey(key) || !partitionKey.equals(header.getPartitionKey())) {
      throw new CorruptSnapshotException("Snapshot " + key + " holds " + header);
    }

    return new StoredSnapshot(partitionKey, header.getSeqNum(), header.getCreatedAt(), state);
  }

  private ImmutableList<String> snapshotKeys(String partitionKey) throws IOException {
    final String prefix = partitionPrefix(partitionKey);
    final ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (String key : blobStore.list(prefix)) {
      if (isSnapshotKey(prefix, key)) {
        keys.add(key);
      }
    }
    return keys.build();
  }

  private Object lockFor(String partitionKey) {
    return partitionLocks.computeIfAbsent(partitionKey, (k) -> new Object());
  }

  private static boolean isSnapshotKey(String prefix, String key) {
    final String seqNumPart = key.substring(prefix.length());
    if (seqNumPart.length() != SNAPSHOT_SEQNUM_DIGITS) {
      return false;
    }
    for (int i = 0; i < seqNumPart.length(); i++) {
      if (!Character.isDigit(seqNumPart.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static long seqNumOfKey(String key) {
    return Long.parseLong(key.substring(key.lastIndexOf('/') + 1));
  }

  private static String partitionPrefix(String partitionKey) {
    return SNAPSHOT_KEY_PREFIX + partitionKey + "/";
  }
}
