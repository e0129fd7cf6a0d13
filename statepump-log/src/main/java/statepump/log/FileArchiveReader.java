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

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statepump.interfaces.log.ArchiveReader;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.RangeUnavailableException;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;

import static statepump.interfaces.log.SequentialEntryIterable.SequentialEntryIterator;
import static statepump.log.CaptureFileService.CaptureFile;
import static statepump.log.LogConstants.ARCHIVE_READ_BUFFER_SIZE;

/**
 * ArchiveReader over the capture files laid out by {@link CaptureFileService}. Before returning, a read
 * checks that the files' declared ranges cover the request without a hole; while iterating, it checks
 * that each file actually contains the records its name declares.
 */
public class FileArchiveReader implements ArchiveReader {
  private static final Logger LOG = LoggerFactory.getLogger(FileArchiveReader.class);

  private final CaptureFileService captureFileService;

  public FileArchiveReader(CaptureFileService captureFileService) {
    this.captureFileService = captureFileService;
  }

  @Override
  public SequentialEntryIterator<LogRecord> readRange(String partitionKey, long fromSeqNum, long toSeqNum)
      throws IOException {
    if (fromSeqNum < 0 || toSeqNum < fromSeqNum) {
      throw new IllegalArgumentException("FileArchiveReader#readRange: invalid range [" + fromSeqNum
          + ", " + toSeqNum + ")");
    }

    final ImmutableList<CaptureFile> files = coveringFiles(partitionKey, fromSeqNum, toSeqNum);
    LOG.debug("Reading records [{}, {}) of partition {} from {}", fromSeqNum, toSeqNum, partitionKey, files);
    return new ArchiveRangeIterator(partitionKey, files.iterator(), fromSeqNum, toSeqNum);
  }

  private ImmutableList<CaptureFile> coveringFiles(String partitionKey, long fromSeqNum, long toSeqNum)
      throws RangeUnavailableException {
    final NavigableMap<Long, CaptureFile> captureFiles = captureFileService.getCaptureFiles(partitionKey);
    final ImmutableList.Builder<CaptureFile> covering = ImmutableList.builder();

    long cursor = fromSeqNum;
    while (cursor < toSeqNum) {
      final CaptureFile file = bestFileContaining(captureFiles, cursor);
      if (file == null) {
        throw new RangeUnavailableException(partitionKey, cursor,
            "Archive of partition " + partitionKey + " has no record " + cursor
                + " of requested range [" + fromSeqNum + ", " + toSeqNum + ")");
      }
      covering.add(file);
      cursor = file.endSeqNum;
    }

    return covering.build();
  }

  /**
   * Of the files containing seqNum, the one reaching furthest; or null if none does.
   */
  private static CaptureFile bestFileContaining(NavigableMap<Long, CaptureFile> captureFiles, long seqNum) {
    CaptureFile best = null;
    for (Map.Entry<Long, CaptureFile> entry : captureFiles.headMap(seqNum, true).entrySet()) {
      final CaptureFile file = entry.getValue();
      if (file.contains(seqNum) && (best == null || file.endSeqNum > best.endSeqNum)) {
        best = file;
      }
    }
    return best;
  }

  /**
   * Opens each file only when iteration reaches it.
   */
  private static class ArchiveRangeIterator implements SequentialEntryIterator<LogRecord> {
    private final String partitionKey;
    private final Iterator<CaptureFile> files;
    private final long toSeqNum;
    private final LogRecordCodec codec = new LogRecordCodec();

    private long expectedSeqNum;
    private CaptureFile currentFile;
    private EncodedSequentialEntryIterator<LogRecord> currentIterator;
    private LogRecord nextRecord;
    private boolean fetched = false;

    ArchiveRangeIterator(String partitionKey, Iterator<CaptureFile> files, long fromSeqNum, long toSeqNum) {
      this.partitionKey = partitionKey;
      this.files = files;
      this.expectedSeqNum = fromSeqNum;
      this.toSeqNum = toSeqNum;
    }

    @Override
    public boolean hasNext() throws IOException {
      if (!fetched) {
        nextRecord = fetchNext();
        fetched = true;
      }
      return nextRecord != null;
    }

    @Override
    public LogRecord next() throws IOException {
      if (!hasNext()) {
        throw new IllegalStateException("ArchiveRangeIterator#next: no more records");
      }
      fetched = false;
      expectedSeqNum++;
      return nextRecord;
    }

    @Override
    public void close() throws IOException {
      if (currentIterator != null) {
        currentIterator.close();
        currentIterator = null;
      }
    }

    private LogRecord fetchNext() throws IOException {
      while (expectedSeqNum < toSeqNum) {
        if (currentIterator == null) {
          openNextFile();
        }

        if (!currentIterator.hasNext()) {
          close();
          if (expectedSeqNum < currentFile.endSeqNum) {
            throw unavailable("ends before record " + expectedSeqNum);
          }
          continue;
        }

        final LogRecord record = currentIterator.next();
        if (record.getSeqNum() != expectedSeqNum) {
          throw unavailable("skips from record " + expectedSeqNum + " to " + record.getSeqNum());
        }
        return record;
      }

      close();
      return null;
    }

    private void openNextFile() throws IOException {
      if (!files.hasNext()) {
        throw unavailable("has no file for record " + expectedSeqNum);
      }
      currentFile = files.next();
      final InputStream in =
          new BufferedInputStream(Files.newInputStream(currentFile.path), ARCHIVE_READ_BUFFER_SIZE);
      try {
        skipRecordsBefore(expectedSeqNum, in);
        currentIterator = new EncodedSequentialEntryIterator<>(in, codec);
      } catch (IOException | RuntimeException e) {
        in.close();
        throw e;
      }
    }

    /**
     * Advance past the file's records preceding seqNum, reading only their headers.
     */
    private void skipRecordsBefore(long seqNum, InputStream in) throws IOException {
      for (long skipping = currentFile.firstSeqNum; skipping < seqNum; skipping++) {
        final long skippedSeqNum;
        try {
          skippedSeqNum = codec.skipEntryAndReturnSeqNum(in);
        } catch (EOFException e) {
          throw unavailable("ends before record " + skipping);
        }
        if (skippedSeqNum != skipping) {
          throw unavailable("holds record " + skippedSeqNum + " where " + skipping + " belongs");
        }
      }
    }

    private RangeUnavailableException unavailable(String detail) {
      return new RangeUnavailableException(partitionKey, expectedSeqNum,
          "Archive of partition " + partitionKey + " " + detail
              + (currentFile == null ? "" : " (" + currentFile + ")"));
    }
  }
}
