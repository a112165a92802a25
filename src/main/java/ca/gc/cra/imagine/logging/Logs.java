package ca.gc.cra.imagine.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log rendering helpers for call arguments and override values.
 * <p><strong>Why:</strong> Arguments and imagined values are arbitrary objects; their {@code toString()} may be huge.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates transient buffers proportional to {@code maxBytes}.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders {@code value} with {@link String#valueOf(Object)} and truncates it to {@code maxBytes} UTF-8 bytes.
   *
   * @param value object to render; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return rendered text, shortened when needed
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String render(Object value, int maxBytes) {
    return truncate(value == null ? null : String.valueOf(value), maxBytes);
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }
}
