package ca.gc.cra.proxyrow.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers for page markup.
 * <p><strong>Why:</strong> Skipped rows are logged with their markup; listing rows can be large and span many lines.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates transient buffers proportional to {@code maxBytes}.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private Logs() {
    // Utility
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
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Collapses whitespace runs of a markup fragment to single spaces and truncates the result.
   *
   * @param markup markup to render on one log line; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of UTF-8 bytes to retain; must be positive
   * @return single-line, length-bounded rendering of {@code markup}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String snippet(String markup, int maxBytes) {
    if (markup == null) {
      return truncate(null, maxBytes);
    }
    return truncate(WHITESPACE_RUN.matcher(markup.strip()).replaceAll(" "), maxBytes);
  }
}
