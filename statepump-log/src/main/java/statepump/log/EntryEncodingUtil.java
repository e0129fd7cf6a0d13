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

import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;
import io.protostuff.CodedInput;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtobufException;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.zip.Adler32;
import java.util.zip.CheckedInputStream;

/**
 * Contains methods used for encoding and decoding log records, capture files, and snapshot blobs.
 * Every encoded item is a length-prefixed protostuff header and its CRC, optionally followed by
 * content and the content's CRC. CRCs are Adler32, stored as 4 bytes.
 */
public class EntryEncodingUtil {
  public static final int CRC_BYTES = 4;

  // Protects against a corrupt length prefix causing a huge allocation
  private static final int MAX_HEADER_LENGTH = 1 << 20;

  /**
   * Exception indicating that a CRC has been read which does not match up with
   * the CRC computed from the associated data.
   */
  public static class CrcError extends RuntimeException {
    public CrcError(String s) {
      super(s);
    }
  }

  /**
   * Serialize a protostuff message object, prefixed with message length, and suffixed with a 4-byte CRC.
   *
   * @param schema  Protostuff message schema
   * @param message Object to serialize
   * @param <T>     Message type
   * @return A list of ByteBuffers containing a varInt length, followed by the message, followed by a 4-byte CRC.
   */
  public static <T> List<ByteBuffer> encodeWithLengthAndCrc(Schema<T> schema, T message) {
    final ByteArrayOutputStream delimited = new ByteArrayOutputStream();

    try {
      ProtostuffIOUtil.writeDelimitedTo(delimited, message, schema, LinkedBuffer.allocate());

      return appendCrcToBufferList(
          Lists.newArrayList(ByteBuffer.wrap(delimited.toByteArray())));
    } catch (IOException e) {
      // Writing to a byte array performs no IO, so this should not actually be possible.
      throw new RuntimeException(e);
    }
  }

  /**
   * Decode a message from the passed input stream, and compute and verify its CRC. This method reads
   * data written by the method {@link EntryEncodingUtil#encodeWithLengthAndCrc}.
   *
   * @param inputStream Input stream, opened for reading and positioned just before the length-prepended header
   * @return The deserialized, constructed, validated message
   * @throws EOFException               if the stream ends before or part way through the length prefix
   * @throws IOException                if a problem is encountered while reading or parsing
   * @throws EntryEncodingUtil.CrcError if the recorded CRC of the message does not match its computed CRC.
   */
  public static <T> T decodeAndCheckCrc(InputStream inputStream, Schema<T> schema)
      throws IOException, CrcError {
    final CheckedInputStream crcStream = new CheckedInputStream(inputStream, new Adler32());
    final int length = readLength(crcStream);
    if (length < 0 || length > MAX_HEADER_LENGTH) {
      throw new IOException("Implausible header length " + length);
    }

    final byte[] messageBytes = new byte[length];
    new DataInputStream(crcStream).readFully(messageBytes);

    final long computedCrc = crcStream.getChecksum().getValue();
    final long diskCrc = readCrc(inputStream);
    if (diskCrc != computedCrc) {
      throw new CrcError("CRC mismatch on message of length " + length);
    }

    final T message = schema.newMessage();
    ProtostuffIOUtil.mergeFrom(new ByteArrayInputStream(messageBytes), message, schema);
    return message;
  }

  /**
   * Given a list of ByteBuffers, compute the combined CRC and then append it to the list as an
   * additional ByteBuffer. Return the entire resulting collection as a new list, including the original
   * ByteBuffers.
   *
   * @param content non-null list of ByteBuffers; no mutation will be performed on them.
   * @return New list of ByteBuffers, with the CRC appended to the original ByteBuffers
   */
  public static List<ByteBuffer> appendCrcToBufferList(List<ByteBuffer> content) {
    assert content != null;

    final Adler32 crc = new Adler32();
    content.forEach((ByteBuffer buffer) -> crc.update(buffer.duplicate()));

    final List<ByteBuffer> withCrc = Lists.newArrayList(content);
    withCrc.add(crcBuffer(crc.getValue()));
    return withCrc;
  }

  /**
   * Read a specified number of bytes from the input stream (the "content"), then read its CRC and
   * check the validity of the data.
   *
   * @param inputStream   Input stream, opened for reading and positioned just before the content
   * @param contentLength Length of data to read from inputStream, not including the trailing CRC
   * @return The read content, as a ByteBuffer.
   * @throws IOException
   */
  public static ByteBuffer getAndCheckContent(InputStream inputStream, int contentLength)
      throws IOException, CrcError {
    final CheckedInputStream crcStream = new CheckedInputStream(inputStream, new Adler32());
    final byte[] content = new byte[contentLength];
    new DataInputStream(crcStream).readFully(content);

    final long computedCrc = crcStream.getChecksum().getValue();
    final long diskCrc = readCrc(inputStream);
    if (diskCrc != computedCrc) {
      throw new CrcError("CRC mismatch on entry contents");
    }

    return ByteBuffer.wrap(content);
  }

  public static void skip(InputStream inputStream, int numBytes) throws IOException {
    int remaining = numBytes;
    while (remaining > 0) {
      long skipped = inputStream.skip(remaining);
      if (skipped <= 0) {
        if (inputStream.read() == -1) {
          throw new EOFException("Unable to skip requested number of bytes");
        }
        skipped = 1;
      }
      remaining -= skipped;
    }
  }

  /**
   * Copy the remaining bytes of the buffers into a single array, without mutating them.
   */
  public static byte[] toByteArray(ByteBuffer[] buffers) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (ByteBuffer b : buffers) {
      final ByteBuffer dup = b.duplicate();
      final byte[] bytes = new byte[dup.remaining()];
      dup.get(bytes);
      out.write(bytes, 0, bytes.length);
    }
    return out.toByteArray();
  }

  /**
   * Write a CRC to a new 4-byte buffer. The CRC is a 4-byte unsigned integer stored in a long; to store it
   * in an int, subtract to convert it from unsigned to signed.
   */
  private static ByteBuffer crcBuffer(long crc) {
    final ByteBuffer buf = ByteBuffer.allocate(CRC_BYTES);
    buf.putInt(Ints.checkedCast(crc + Integer.MIN_VALUE));
    buf.flip();
    return buf;
  }

  private static long readCrc(InputStream inputStream) throws IOException {
    int shiftedCrc = (new DataInputStream(inputStream)).readInt();
    return ((long) shiftedCrc) - Integer.MIN_VALUE;
  }

  /**
   * Read the varint length prefix written by {@link ProtostuffIOUtil#writeDelimitedTo}. A stream which
   * ends anywhere inside the prefix holds no further whole message.
   */
  private static int readLength(InputStream inputStream) throws IOException {
    final int firstByte = inputStream.read();
    if (firstByte == -1) {
      throw new EOFException();
    }

    try {
      return CodedInput.readRawVarint32(inputStream, firstByte);
    } catch (ProtobufException e) {
      final EOFException eof = new EOFException("Truncated or malformed length prefix");
      eof.initCause(e);
      throw eof;
    }
  }
}
