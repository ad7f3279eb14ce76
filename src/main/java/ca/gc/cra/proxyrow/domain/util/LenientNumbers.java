package ca.gc.cra.proxyrow.domain.util;

/**
 * <strong>What:</strong> Permissive text-to-integer conversion for listing cells and attributes.
 * <p><strong>Why:</strong> Listing markup is inconsistent; a garbled port or latency must degrade to {@code 0}
 * rather than abort the whole row.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LenientNumbers {
  private LenientNumbers() {}

  /**
   * Parses the leading integer of {@code text}.
   *
   * <p>Leading and trailing whitespace is ignored, an optional {@code +} or {@code -} sign is honoured, and parsing
   * stops at the first non-digit: {@code "3129 "} gives {@code 3129}, {@code "80abc"} gives {@code 80},
   * {@code "abc"} gives {@code 0}. Values outside the {@code int} range are clamped.</p>
   *
   * @param text candidate text; may be {@code null}
   * @return parsed value, or {@code 0} when no leading digits exist
   */
  public static int toInt(String text) {
    if (text == null) {
      return 0;
    }
    String trimmed = text.strip();
    int index = 0;
    boolean negative = false;
    if (index < trimmed.length() && (trimmed.charAt(index) == '+' || trimmed.charAt(index) == '-')) {
      negative = trimmed.charAt(index) == '-';
      index++;
    }
    long value = 0L;
    boolean overflow = false;
    while (index < trimmed.length()) {
      char c = trimmed.charAt(index);
      if (c < '0' || c > '9') {
        break;
      }
      if (!overflow) {
        value = value * 10 + (c - '0');
        overflow = value > Integer.MAX_VALUE + 1L;
      }
      index++;
    }
    if (overflow) {
      return negative ? Integer.MIN_VALUE : Integer.MAX_VALUE;
    }
    long signed = negative ? -value : value;
    return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, signed));
  }

  /**
   * Parses the leading non-negative integer of {@code text}.
   *
   * <p>Behaves like {@link #toInt(String)} except that a leading {@code -} makes the text non-numeric, so
   * {@code "-80"} gives {@code 0}. Used for ports and latencies, which cannot be negative.</p>
   *
   * @param text candidate text; may be {@code null}
   * @return parsed value in {@code [0, Integer.MAX_VALUE]}
   */
  public static int toNonNegativeInt(String text) {
    if (text == null || text.strip().startsWith("-")) {
      return 0;
    }
    return toInt(text);
  }
}
