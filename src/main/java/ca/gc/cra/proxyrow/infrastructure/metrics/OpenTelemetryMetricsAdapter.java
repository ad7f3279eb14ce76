package ca.gc.cra.proxyrow.infrastructure.metrics;

import ca.gc.cra.proxyrow.application.port.MetricsPort;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards decode counters and latency observations to OpenTelemetry.
 *
 * <p>Each key maps to one cached instrument. Instrument names are the lower-cased key with characters outside
 * {@code [a-z0-9._-]} replaced by {@code _}; the raw key is attached as the {@code proxyrow.metric.key}
 * attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);

  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.proxyrow";
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("proxyrow.metric.key");
  private static final String FALLBACK_METRIC_NAME = "proxyrow.metric";

  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter on the globally registered OpenTelemetry instance.
   *
   * <p>Without a registered SDK the global meter is a no-op and every update is discarded.</p>
   */
  public OpenTelemetryMetricsAdapter() {
    this(GlobalOpenTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  /**
   * Creates an adapter on an explicit meter.
   *
   * @param meter meter that builds the instruments; must not be {@code null}
   */
  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("proxyrow counter for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("proxyrow observation for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key.strip().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
