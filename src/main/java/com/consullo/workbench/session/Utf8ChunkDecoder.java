package com.consullo.workbench.session;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.Validate;

/**
 * Decodes a byte stream chunk by chunk, holding back an incomplete trailing UTF-8 sequence until the next chunk.
 * Malformed input becomes U+FFFD. Not thread safe; one instance per pump.
 */
final class Utf8ChunkDecoder {

  private final int maxChunk;
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPLACE)
      .onUnmappableCharacter(CodingErrorAction.REPLACE);
  private final ByteBuffer pending;
  private final CharBuffer chars;

  Utf8ChunkDecoder(final int maxChunk) {
    Validate.isTrue(maxChunk > 0, "maxChunk must be positive");
    this.maxChunk = maxChunk;
    // room for a carried partial sequence in front of a full chunk
    this.pending = ByteBuffer.allocate(maxChunk + 8);
    this.chars = CharBuffer.allocate(maxChunk + 8);
  }

  String decode(final byte[] bytes, final int length) {
    Validate.isTrue(length >= 0 && length <= maxChunk, "length out of range: %s", length);
    pending.put(bytes, 0, length);
    pending.flip();
    chars.clear();
    decoder.decode(pending, chars, false);
    pending.compact();
    chars.flip();
    return chars.toString();
  }

  /**
   * Flushes whatever is held back, as replacement characters.
   *
   * @return remaining text, possibly empty
   */
  String finish() {
    pending.flip();
    chars.clear();
    decoder.decode(pending, chars, true);
    decoder.flush(chars);
    pending.clear();
    decoder.reset();
    chars.flip();
    return chars.toString();
  }
}
