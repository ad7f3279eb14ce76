package ca.gc.cra.proxyrow.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by decode configuration parsing.
 * <p><strong>Why:</strong> Rejects worker counts outside the supported bounds before a pool is allocated.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation fails.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a configuration value as an integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value from configuration; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String label = name == null || name.isBlank() ? "value" : name;
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    final int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be numeric (was " + raw + ")", ex);
    }
    return (int) requireRange(label, parsed, min, max);
  }
}
