package ca.gc.cra.proxyrow.config;

import ca.gc.cra.proxyrow.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings of the batch decode pipeline.
 * <p><strong>Role:</strong> Configuration value consumed by {@code RowDecodeUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param parallelism number of decoding workers; {@code 1} decodes on the calling thread
 * @param dropInvalid whether records whose address fails the dotted-quad check are left out of reports
 * @since 0.1.0
 */
public record DecodeConfig(int parallelism, boolean dropInvalid) {
  public static final int MAX_PARALLELISM = 64;

  static final String PARALLELISM_KEY = "parallelism";
  static final String DROP_INVALID_KEY = "dropInvalid";

  /**
   * Validates the settings.
   *
   * @throws IllegalArgumentException if {@code parallelism} is outside {@code 1..64}
   */
  public DecodeConfig {
    Numbers.requireRange(PARALLELISM_KEY, parallelism, 1, MAX_PARALLELISM);
  }

  /**
   * Returns the defaults: sequential decoding, invalid addresses kept.
   *
   * @return default configuration
   */
  public static DecodeConfig defaults() {
    return new DecodeConfig(1, false);
  }

  /**
   * Builds a configuration from flat key/value pairs, falling back to {@link #defaults()} for absent keys.
   *
   * @param values flat configuration map, e.g. produced by {@link YamlConfigLoader}; must not be {@code null}
   * @return configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static DecodeConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    DecodeConfig defaults = defaults();
    int parallelism = defaults.parallelism();
    String rawParallelism = values.get(PARALLELISM_KEY);
    if (rawParallelism != null && !rawParallelism.isBlank()) {
      parallelism = Numbers.parseIntInRange(PARALLELISM_KEY, rawParallelism, 1, MAX_PARALLELISM);
    }
    boolean dropInvalid = defaults.dropInvalid();
    String rawDrop = values.get(DROP_INVALID_KEY);
    if (rawDrop != null && !rawDrop.isBlank()) {
      dropInvalid = parseBoolean(DROP_INVALID_KEY, rawDrop);
    }
    return new DecodeConfig(parallelism, dropInvalid);
  }

  private static boolean parseBoolean(String name, String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes" -> true;
      case "false", "no" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }
}
