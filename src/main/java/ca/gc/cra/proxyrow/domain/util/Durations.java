package ca.gc.cra.proxyrow.domain.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Converts free-text ages such as {@code "1 min 30 sec"} or {@code "2h 5min"} to seconds.
 * <p><strong>Why:</strong> Listing pages print the time since the last check in mixed units; records store seconds.</p>
 * <p><strong>Role:</strong> Domain support class used by the row decoder for the first column.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single pass over whitespace-separated tokens.</p>
 *
 * @implNote Units are detected by substring presence, checked in the order {@code sec}, {@code min}, {@code h},
 * {@code d}, so {@code "seconds"} is never read as days and {@code "minutes"} never as hours.
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private static final long SECOND = 1L;
  private static final long MINUTE = 60L;
  private static final long HOUR = 3_600L;
  private static final long DAY = 86_400L;

  private Durations() {}

  /**
   * Sums every unit-bearing token of {@code text} as seconds.
   *
   * <p>A unit token carries its magnitude as its first run of digits ({@code "30sec"}). When it has no digits
   * ({@code "sec"}), the digits-only token right before it supplies the magnitude, so {@code "1 min"} equals
   * {@code "1min"}. Tokens without a unit add nothing.</p>
   *
   * @param text age text from the listing; may be {@code null}
   * @return total seconds; {@code 0} when the text is blank or has no unit token
   */
  public static long toSeconds(String text) {
    if (text == null || text.isBlank()) {
      return 0L;
    }
    long total = 0L;
    String pendingMagnitude = null;
    for (String token : WHITESPACE.split(text.strip())) {
      long factor = unitFactor(token);
      if (factor == 0L) {
        pendingMagnitude = DIGITS.matcher(token).matches() ? token : null;
        continue;
      }
      String digits = firstDigits(token);
      if (digits == null) {
        digits = pendingMagnitude;
      }
      pendingMagnitude = null;
      total = saturatingAdd(total, saturatingMultiply(magnitude(digits), factor));
    }
    return total;
  }

  private static long unitFactor(String token) {
    if (token.contains("sec")) {
      return SECOND;
    }
    if (token.contains("min")) {
      return MINUTE;
    }
    if (token.contains("h")) {
      return HOUR;
    }
    if (token.contains("d")) {
      return DAY;
    }
    return 0L;
  }

  private static String firstDigits(String token) {
    Matcher matcher = DIGITS.matcher(token);
    return matcher.find() ? matcher.group() : null;
  }

  private static long magnitude(String digits) {
    if (digits == null) {
      return 0L;
    }
    // 18 digits always fit in a long
    if (digits.length() > 18) {
      return Long.MAX_VALUE;
    }
    return Long.parseLong(digits);
  }

  private static long saturatingMultiply(long value, long factor) {
    if (value > Long.MAX_VALUE / factor) {
      return Long.MAX_VALUE;
    }
    return value * factor;
  }

  private static long saturatingAdd(long a, long b) {
    long sum = a + b;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }
}
