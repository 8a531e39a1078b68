package ca.gc.cra.snapline.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep snapshot bodies from flooding test logs.
 * <p><strong>Why:</strong> Rendered snapshots can be arbitrarily large; log lines should stay readable.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the assertion coordinator and the store.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to snapshot bodies in DEBUG output. */
  public static final int DEFAULT_BODY_BYTES = 512;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxBytes} UTF-8 bytes, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original value when it fits, otherwise a prefix tagged {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Truncates with {@link #DEFAULT_BODY_BYTES}.
   *
   * @param body snapshot body
   * @return loggable body
   */
  public static String body(String body) {
    return truncate(body, DEFAULT_BODY_BYTES);
  }
}
