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

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.SequentialEntryCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;

import static com.google.common.math.IntMath.checkedAdd;
import static statepump.log.EntryEncodingUtil.CRC_BYTES;
import static statepump.log.EntryEncodingUtil.CrcError;
import static statepump.log.EntryEncodingUtil.appendCrcToBufferList;
import static statepump.log.EntryEncodingUtil.decodeAndCheckCrc;
import static statepump.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static statepump.log.EntryEncodingUtil.getAndCheckContent;
import static statepump.log.EntryEncodingUtil.skip;

/**
 * Framing of a {@link LogRecord}: its header, then the header's CRC, then the record body, then the
 * body's CRC. Capture files are sequences of records framed this way.
 */
public class LogRecordCodec implements SequentialEntryCodec<LogRecord> {
  private static final Schema<LogRecordHeader> SCHEMA = RuntimeSchema.getSchema(LogRecordHeader.class);

  @Override
  public ByteBuffer[] encode(LogRecord record) {
    final ByteBuffer body = record.getBody();
    final LogRecordHeader header = new LogRecordHeader(
        record.getSeqNum(),
        record.getPartitionKey(),
        record.getEnqueuedAt(),
        body.remaining());

    final List<ByteBuffer> entryBufs = encodeWithLengthAndCrc(SCHEMA, header);
    entryBufs.addAll(appendCrcToBufferList(Collections.singletonList(body)));

    return entryBufs.toArray(new ByteBuffer[entryBufs.size()]);
  }

  @Override
  public LogRecord decode(InputStream inputStream) throws IOException, CrcError {
    final LogRecordHeader header = decodeAndCheckCrc(inputStream, SCHEMA);
    final ByteBuffer body = getAndCheckContent(inputStream, header.getContentLength());

    return new LogRecord(
        header.getPartitionKey(),
        header.getSeqNum(),
        header.getEnqueuedAt(),
        body);
  }

  @Override
  public long skipEntryAndReturnSeqNum(InputStream inputStream) throws IOException {
    final LogRecordHeader header = decodeAndCheckCrc(inputStream, SCHEMA);
    skip(inputStream, checkedAdd(header.getContentLength(), CRC_BYTES));
    return header.getSeqNum();
  }
}
