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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.SequentialEntryCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Writes batches of expired records into the capture archive, one file per batch.
 */
public class CaptureWriter implements RecordCaptureSink {
  private static final Logger LOG = LoggerFactory.getLogger(CaptureWriter.class);

  private final CaptureFileService captureFileService;
  private final SequentialEntryCodec<LogRecord> codec = new LogRecordCodec();

  public CaptureWriter(CaptureFileService captureFileService) {
    this.captureFileService = captureFileService;
  }

  @Override
  public void capture(String partitionKey, List<LogRecord> records) throws IOException {
    if (records.isEmpty()) {
      throw new IllegalArgumentException("CaptureWriter#capture: empty batch");
    }
    final long firstSeqNum = records.get(0).getSeqNum();
    ensureConsecutive(firstSeqNum, records);
    final long endSeqNum = firstSeqNum + records.size();

    final Path tempFile = captureFileService.createTempFile(partitionKey);
    try {
      try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
        for (LogRecord record : records) {
          writeFully(channel, codec.encode(record));
        }
        channel.force(true);
      }
      final Path captured = captureFileService.commit(partitionKey, tempFile, firstSeqNum, endSeqNum);
      LOG.debug("Captured records [{}, {}) of partition {} to {}", firstSeqNum, endSeqNum, partitionKey, captured);
    } catch (IOException e) {
      Files.deleteIfExists(tempFile);
      throw e;
    }
  }

  private static void ensureConsecutive(long firstSeqNum, List<LogRecord> records) {
    long expected = firstSeqNum;
    for (LogRecord record : records) {
      if (record.getSeqNum() != expected) {
        throw new IllegalArgumentException("CaptureWriter#capture: batch is not consecutive at " + expected);
      }
      expected++;
    }
  }

  private static void writeFully(FileChannel channel, ByteBuffer[] buffers) throws IOException {
    for (ByteBuffer buffer : buffers) {
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
    }
  }
}
