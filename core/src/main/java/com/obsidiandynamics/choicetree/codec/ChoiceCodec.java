package com.obsidiandynamics.choicetree.codec;

import com.obsidiandynamics.choicetree.*;
import com.obsidiandynamics.choicetree.util.*;

import java.io.*;
import java.math.*;
import java.nio.*;
import java.nio.charset.*;
import java.util.*;

/**
 *  Compact binary form of a list of choice values, for persisting interesting examples.<p>
 *
 *  Each value starts with a header byte: a 3-bit type tag in the high bits and a 5-bit size in the low
 *  bits. A size of 31 means the real size follows as an unsigned LEB128 varint. The payload follows.
 *  <ul>
 *    <li>Boolean (tag 0): the size is the value itself; no payload.</li>
 *    <li>Float (tag 1): 8 bytes of IEEE 754 bits, big-endian.</li>
 *    <li>Integer (tag 2): minimal two's complement, big-endian.</li>
 *    <li>Bytes (tag 3): the raw bytes.</li>
 *    <li>String (tag 4): UTF-8. Strings containing lone surrogates cannot be encoded.</li>
 *  </ul>
 */
public final class ChoiceCodec {
  private static final int TAG_BOOLEAN = 0;
  private static final int TAG_FLOAT = 1;
  private static final int TAG_INTEGER = 2;
  private static final int TAG_BYTES = 3;
  private static final int TAG_STRING = 4;

  private static final int SIZE_ESCAPE = 31;

  private ChoiceCodec() {}

  /**
   *  Encodes a list of values. Each value must be a {@link Boolean}, {@link Double}, {@link Long},
   *  {@code byte[]} or {@link String}.
   *
   *  @param values The values.
   *  @return The encoded bytes.
   *  @throws IllegalArgumentException If a value is of an unsupported type, or is a string that is not
   *          well-formed UTF-16.
   */
  public static byte[] serialize(List<?> values) {
    final var out = new ByteArrayOutputStream();
    for (var value : values) {
      if (value instanceof Boolean) {
        writeHeader(out, TAG_BOOLEAN, (Boolean) value ? 1 : 0);
      } else if (value instanceof Double) {
        writeHeader(out, TAG_FLOAT, Double.BYTES);
        out.writeBytes(ByteBuffer.allocate(Double.BYTES).putDouble((Double) value).array());
      } else if (value instanceof Long) {
        final var bytes = BigInteger.valueOf((Long) value).toByteArray();
        writeHeader(out, TAG_INTEGER, bytes.length);
        out.writeBytes(bytes);
      } else if (value instanceof byte[]) {
        final var bytes = (byte[]) value;
        writeHeader(out, TAG_BYTES, bytes.length);
        out.writeBytes(bytes);
      } else if (value instanceof String) {
        final var bytes = encodeUtf8((String) value);
        writeHeader(out, TAG_STRING, bytes.length);
        out.writeBytes(bytes);
      } else {
        throw new IllegalArgumentException("Unsupported choice value " + Choices.toString(value));
      }
    }
    return out.toByteArray();
  }

  private static byte[] encodeUtf8(String str) {
    final var encoder = StandardCharsets.UTF_8.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      final var buffer = encoder.encode(CharBuffer.wrap(str));
      return Arrays.copyOf(buffer.array(), buffer.limit());
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("String " + Choices.toString(str) + " is not well-formed UTF-16", e);
    }
  }

  private static void writeHeader(ByteArrayOutputStream out, int tag, int size) {
    if (size < SIZE_ESCAPE) {
      out.write(tag << 5 | size);
    } else {
      out.write(tag << 5 | SIZE_ESCAPE);
      var remaining = size;
      while ((remaining & ~0x7F) != 0) {
        out.write(remaining & 0x7F | 0x80);
        remaining >>>= 7;
      }
      out.write(remaining);
    }
  }

  /**
   *  Decodes the output of {@link #serialize(List)}.
   *
   *  @param bytes The encoded bytes.
   *  @return The values, in order.
   *  @throws MalformedChoicesException If the input is truncated, carries an unknown tag, or holds a
   *          payload that is invalid for its type.
   */
  public static List<Object> deserialize(byte[] bytes) throws MalformedChoicesException {
    final var reader = new Reader(bytes);
    final var values = new ArrayList<>();
    while (reader.hasRemaining()) {
      final var start = reader.position;
      final var header = reader.next();
      final var tag = header >>> 5;
      var size = header & SIZE_ESCAPE;
      if (size == SIZE_ESCAPE) {
        size = reader.readVarint();
      }

      switch (tag) {
        case TAG_BOOLEAN -> {
          if (size > 1) throw new MalformedChoicesException(start, "Invalid boolean " + size);
          values.add(size == 1);
        }
        case TAG_FLOAT -> {
          if (size != Double.BYTES) throw new MalformedChoicesException(start, "Invalid float size " + size);
          values.add(ByteBuffer.wrap(reader.read(size)).getDouble());
        }
        case TAG_INTEGER -> {
          if (size == 0) {
            values.add(0L);
          } else {
            final var integer = new BigInteger(reader.read(size));
            if (integer.bitLength() > 63) throw new MalformedChoicesException(start, "Integer " + integer + " exceeds 64 bits");
            values.add(integer.longValue());
          }
        }
        case TAG_BYTES -> values.add(reader.read(size));
        case TAG_STRING -> values.add(decodeUtf8(reader.read(size), start));
        default -> throw new MalformedChoicesException(start, "Unknown tag " + tag);
      }
    }
    return values;
  }

  private static String decodeUtf8(byte[] bytes, int offset) throws MalformedChoicesException {
    final var decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      throw new MalformedChoicesException(offset, "Invalid UTF-8", e);
    }
  }

  private static final class Reader {
    private final byte[] bytes;

    private int position;

    Reader(byte[] bytes) {
      this.bytes = bytes;
    }

    boolean hasRemaining() {
      return position < bytes.length;
    }

    int next() throws MalformedChoicesException {
      if (! hasRemaining()) throw new MalformedChoicesException(position, "Unexpected end of input");
      return Byte.toUnsignedInt(bytes[position++]);
    }

    byte[] read(int length) throws MalformedChoicesException {
      if (length > bytes.length - position) {
        throw new MalformedChoicesException(position, "Payload of " + length + " bytes overruns input");
      }
      final var slice = Arrays.copyOfRange(bytes, position, position + length);
      position += length;
      return slice;
    }

    int readVarint() throws MalformedChoicesException {
      final var start = position;
      var result = 0L;
      var shift = 0;
      while (true) {
        final var b = next();
        result |= (long) (b & 0x7F) << shift;
        if (result > Integer.MAX_VALUE) throw new MalformedChoicesException(start, "Size exceeds " + Integer.MAX_VALUE);
        if ((b & 0x80) == 0) return (int) result;
        shift += 7;
        if (shift > 28) throw new MalformedChoicesException(start, "Size varint too long");
      }
    }
  }
}
