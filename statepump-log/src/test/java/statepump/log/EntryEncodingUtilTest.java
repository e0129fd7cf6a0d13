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

import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static statepump.log.EntryEncodingUtil.CrcError;
import static statepump.log.EntryEncodingUtil.decodeAndCheckCrc;
import static statepump.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static statepump.log.EntryEncodingUtil.toByteArray;

public class EntryEncodingUtilTest {
  private static final Schema<LogRecordHeader> SCHEMA = RuntimeSchema.getSchema(LogRecordHeader.class);
  private static final LogRecordHeader TEST_HEADER =
      new LogRecordHeader(Long.MAX_VALUE, "partition", Long.MAX_VALUE, Integer.MAX_VALUE);

  private final PipedOutputStream pipedOutputStream = new PipedOutputStream();

  @Test
  public void decodesProtostuffMessagesItEncodes() throws IOException {
    final InputStream readFromMe = new PipedInputStream(pipedOutputStream);
    final WritableByteChannel writeToMe = Channels.newChannel(pipedOutputStream);

    final List<ByteBuffer> serialized = encodeWithLengthAndCrc(SCHEMA, TEST_HEADER);
    writeAllToChannel(serialized, writeToMe);

    final LogRecordHeader decodedMessage = decodeAndCheckCrc(readFromMe, SCHEMA);

    assertThat(decodedMessage, is(theSameMessageAs(TEST_HEADER)));
  }

  @Test(expected = CrcError.class)
  public void throwsCrcErrorWhenTheEncodedMessageHasBeenAltered() throws IOException {
    final byte[] bytes = encodedTestHeader();
    bytes[bytes.length - 6] ^= 0x10;

    decodeAndCheckCrc(new ByteArrayInputStream(bytes), SCHEMA);
  }

  @Test(expected = EOFException.class)
  public void throwsEofExceptionWhenTheStreamHasNoMoreMessages() throws IOException {
    decodeAndCheckCrc(new ByteArrayInputStream(new byte[0]), SCHEMA);
  }

  @Test(expected = EOFException.class)
  public void throwsEofExceptionWhenTheStreamEndsPartWayThroughAMessage() throws IOException {
    final byte[] bytes = encodedTestHeader();
    final byte[] truncated = new byte[bytes.length - 3];
    System.arraycopy(bytes, 0, truncated, 0, truncated.length);

    decodeAndCheckCrc(new ByteArrayInputStream(truncated), SCHEMA);
  }

  @Test(expected = EOFException.class)
  public void throwsEofExceptionWhenTheStreamEndsWithinTheLengthPrefix() throws IOException {
    final byte[] continuationByteOnly = {(byte) 0x80};

    decodeAndCheckCrc(new ByteArrayInputStream(continuationByteOnly), SCHEMA);
  }

  @Test
  public void writesTheSameDelimitedFormAsProtostuff() throws IOException {
    final byte[] bytes = encodedTestHeader();
    final LogRecordHeader decodedMessage = SCHEMA.newMessage();

    ProtostuffIOUtil.mergeDelimitedFrom(new ByteArrayInputStream(bytes), decodedMessage, SCHEMA);

    assertThat(decodedMessage, is(theSameMessageAs(TEST_HEADER)));
  }

  @Test
  public void decodesAHeaderWhoseLengthPrefixSpansSeveralBytes() throws IOException {
    final StringBuilder longKey = new StringBuilder();
    for (int i = 0; i < 20000; i++) {
      longKey.append('k');
    }
    final LogRecordHeader header = new LogRecordHeader(7, longKey.toString(), 8, 9);
    final List<ByteBuffer> serialized = encodeWithLengthAndCrc(SCHEMA, header);

    final LogRecordHeader decodedMessage = decodeAndCheckCrc(
        new ByteArrayInputStream(toByteArray(serialized.toArray(new ByteBuffer[serialized.size()]))), SCHEMA);

    assertThat(decodedMessage, is(theSameMessageAs(header)));
  }

  private static byte[] encodedTestHeader() {
    final List<ByteBuffer> serialized = encodeWithLengthAndCrc(SCHEMA, TEST_HEADER);
    return toByteArray(serialized.toArray(new ByteBuffer[serialized.size()]));
  }

  private static Matcher<LogRecordHeader> theSameMessageAs(LogRecordHeader message) {
    return new TypeSafeMatcher<LogRecordHeader>() {
      @Override
      public boolean matchesSafely(LogRecordHeader item) {
        return message.getSeqNum() == item.getSeqNum()
            && message.getPartitionKey().equals(item.getPartitionKey())
            && message.getEnqueuedAt() == item.getEnqueuedAt()
            && message.getContentLength() == item.getContentLength();
      }

      @Override
      public void describeTo(Description description) {
        description.appendValue(message);
      }
    };
  }

  private static void writeAllToChannel(List<ByteBuffer> buffers, WritableByteChannel channel) throws IOException {
    for (ByteBuffer buffer : buffers) {
      channel.write(buffer);
    }
  }
}
