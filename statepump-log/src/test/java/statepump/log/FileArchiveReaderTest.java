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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import statepump.CommonTestUtil;
import statepump.interfaces.log.ArchiveReader;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.RangeUnavailableException;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.WRITE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static statepump.interfaces.log.SequentialEntryIterable.SequentialEntryIterator;
import static statepump.log.EntryEncodingUtil.CrcError;
import static statepump.log.EntryEncodingUtil.toByteArray;
import static statepump.log.LogTestUtil.PARTITION;
import static statepump.log.LogTestUtil.drain;
import static statepump.log.LogTestUtil.makeRecord;
import static statepump.log.LogTestUtil.seqNumsOf;
import static statepump.log.LogTestUtil.someConsecutiveRecords;

public class FileArchiveReaderTest {
  private final CommonTestUtil testUtil = new CommonTestUtil();
  private CaptureFileService captureFileService;
  private CaptureWriter captureWriter;
  private ArchiveReader archiveReader;

  @Before
  public void createArchive() throws Exception {
    captureFileService = new CaptureFileService(testUtil.getDataTestDir("archive"));
    captureWriter = new CaptureWriter(captureFileService);
    archiveReader = new FileArchiveReader(captureFileService);
  }

  @After
  public void removeArchive() throws Exception {
    testUtil.cleanupTestDir();
  }

  @Test
  public void readsExactlyTheRequestedRangeAcrossSeveralCaptureFiles() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(0, 5));
    captureWriter.capture(PARTITION, someConsecutiveRecords(5, 9));
    captureWriter.capture(PARTITION, someConsecutiveRecords(9, 20));

    List<LogRecord> records = drain(archiveReader.readRange(PARTITION, 3, 12));

    assertThat(seqNumsOf(records), contains(3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L));
    assertThat(records.get(0), is(equalTo(makeRecord(3, "record-3"))));
  }

  @Test
  public void returnsAnEmptySequenceForAnEmptyRange() throws Exception {
    assertThat(drain(archiveReader.readRange(PARTITION, 410, 410)), is(empty()));
  }

  @Test
  public void rejectsTheWholeRangeWhenARecordWithinItIsMissing() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(400, 411));

    try {
      archiveReader.readRange(PARTITION, 410, 412);
      fail("expected RangeUnavailableException");
    } catch (RangeUnavailableException e) {
      assertThat(e.getMissingSeqNum(), is(equalTo(411L)));
    }
  }

  @Test(expected = RangeUnavailableException.class)
  public void rejectsARangeStartingBeforeTheOldestCapturedRecord() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(10, 20));

    archiveReader.readRange(PARTITION, 5, 15);
  }

  @Test(expected = RangeUnavailableException.class)
  public void rejectsARangeWithAHoleBetweenCaptureFiles() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(0, 5));
    captureWriter.capture(PARTITION, someConsecutiveRecords(6, 10));

    archiveReader.readRange(PARTITION, 0, 10);
  }

  @Test
  public void readsAcrossOverlappingCaptureFiles() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(0, 6));
    captureWriter.capture(PARTITION, someConsecutiveRecords(4, 10));

    assertThat(seqNumsOf(drain(archiveReader.readRange(PARTITION, 2, 10))),
        contains(2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L));
  }

  @Test
  public void failsDuringIterationIfACaptureFileHoldsFewerRecordsThanItsNameDeclares() throws Exception {
    havingWrittenCaptureFileDeclaringRange(0, 5, someConsecutiveRecords(0, 3));

    SequentialEntryIterator<LogRecord> iterator = archiveReader.readRange(PARTITION, 0, 5);
    try {
      drain(iterator);
      fail("expected RangeUnavailableException");
    } catch (RangeUnavailableException e) {
      assertThat(e.getMissingSeqNum(), is(equalTo(3L)));
    }
  }

  @Test
  public void canBeCalledAgainAfterAFailureOnceTheArchiveIsRepaired() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(0, 5));

    try {
      archiveReader.readRange(PARTITION, 0, 8);
      fail("expected RangeUnavailableException");
    } catch (RangeUnavailableException ignore) {
    }

    captureWriter.capture(PARTITION, someConsecutiveRecords(5, 8));
    assertThat(drain(archiveReader.readRange(PARTITION, 0, 8)).size(), is(equalTo(8)));
  }

  @Test
  public void keepsPartitionsSeparate() throws Exception {
    captureWriter.capture(PARTITION, someConsecutiveRecords(0, 5));

    assertThat(drain(archiveReader.readRange(PARTITION, 0, 5)).size(), is(equalTo(5)));
    try {
      archiveReader.readRange("another-partition", 0, 5);
      fail("expected RangeUnavailableException");
    } catch (RangeUnavailableException e) {
      assertThat(e.getPartitionKey(), is(equalTo("another-partition")));
    }
  }

  @Test
  public void passesOverTheBodiesOfRecordsBeforeTheRequestedRangeWithoutReadingThem() throws Exception {
    final LogRecordCodec codec = new LogRecordCodec();
    final List<LogRecord> records = someConsecutiveRecords(0, 5);
    final byte[] corruptRecord = toByteArray(codec.encode(records.get(1)));
    corruptRecord[corruptRecord.length - 5] ^= 0x01;

    final Path tempFile = captureFileService.createTempFile(PARTITION);
    try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
      for (LogRecord record : records) {
        if (record.getSeqNum() == 1) {
          channel.write(ByteBuffer.wrap(corruptRecord));
        } else {
          for (ByteBuffer buffer : codec.encode(record)) {
            channel.write(buffer);
          }
        }
      }
    }
    captureFileService.commit(PARTITION, tempFile, 0, 5);

    assertThat(seqNumsOf(drain(archiveReader.readRange(PARTITION, 3, 5))), contains(3L, 4L));

    try {
      drain(archiveReader.readRange(PARTITION, 0, 5));
      fail("expected CrcError");
    } catch (CrcError ignore) {
    }
  }

  @Test
  public void failsIfACaptureFileEndsAmongTheRecordsPrecedingTheRequestedRange() throws Exception {
    havingWrittenCaptureFileDeclaringRange(0, 10, someConsecutiveRecords(0, 3));

    SequentialEntryIterator<LogRecord> iterator = archiveReader.readRange(PARTITION, 6, 10);
    try {
      drain(iterator);
      fail("expected RangeUnavailableException");
    } catch (RangeUnavailableException e) {
      assertThat(e.getMissingSeqNum(), is(equalTo(6L)));
    }
  }

  private void havingWrittenCaptureFileDeclaringRange(long first, long end, List<LogRecord> actualRecords)
      throws Exception {
    final LogRecordCodec codec = new LogRecordCodec();
    final Path tempFile = captureFileService.createTempFile(PARTITION);
    try (FileChannel channel = FileChannel.open(tempFile, WRITE)) {
      for (LogRecord record : actualRecords) {
        for (ByteBuffer buffer : codec.encode(record)) {
          channel.write(buffer);
        }
      }
    }
    captureFileService.commit(PARTITION, tempFile, first, end);
  }
}
