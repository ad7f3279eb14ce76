package ca.gc.cra.proxyrow.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.proxyrow.application.port.MetricsPort;
import ca.gc.cra.proxyrow.application.port.RowDecoder;
import ca.gc.cra.proxyrow.config.DecodeConfig;
import ca.gc.cra.proxyrow.domain.proxy.ProxyRecord;
import ca.gc.cra.proxyrow.domain.row.Column;
import ca.gc.cra.proxyrow.infrastructure.html.HtmlRowDecoder;
import ca.gc.cra.proxyrow.testutil.RowFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RowDecodeUseCaseTest {
  private final RowDecoder decoder = new HtmlRowDecoder();

  @Test
  void skipsRowsWithMissingCellsAndKeepsTheRest() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    RowDecodeUseCase useCase = new RowDecodeUseCase(decoder, DecodeConfig.defaults(), metrics);
    List<Element> rows = List.of(
        RowFixtures.plainRow("1.1.1.1", 80),
        RowFixtures.row("<td>1 min</td>", "<td>2.2.2.2</td>", "<td>81</td>"),
        RowFixtures.plainRow("3.3.3.3", 82));

    DecodeReport report = useCase.decodeAll(rows);

    assertEquals(List.of("1.1.1.1", "3.3.3.3"), ips(report));
    assertEquals(List.of(new DecodeReport.SkippedRow(1, Column.COUNTRY)), report.skipped());
    assertEquals(0, report.invalidCount());
    assertEquals(2L, metrics.counter("decode.rows.decoded"));
    assertEquals(1L, metrics.counter("decode.rows.skipped"));
    assertTrue(metrics.observed("decode.batch.latencyNanos"));
  }

  @Test
  void logsSkippedRowsAtWarn() throws Exception {
    RowDecodeUseCase useCase = new RowDecodeUseCase(decoder, DecodeConfig.defaults(), MetricsPort.NO_OP);

    Logger logger = (Logger) LoggerFactory.getLogger(RowDecodeUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      useCase.decodeAll(List.of(RowFixtures.row("<td>only one cell</td>")));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    ILoggingEvent warning = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .findFirst()
        .orElseThrow();
    String message = warning.getFormattedMessage();
    assertTrue(message.startsWith("Skipping row 0: row is missing cell 2 (IP_ADDRESS)"));
    assertTrue(message.contains("<td>only one cell</td>"));
  }

  @Test
  void keepsInvalidAddressesByDefault() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    RowDecodeUseCase useCase = new RowDecodeUseCase(decoder, DecodeConfig.defaults(), metrics);

    DecodeReport report = useCase.decodeAll(List.of(
        RowFixtures.plainRow("1.2.3", 80),
        RowFixtures.plainRow("1.2.3.4", 80)));

    assertEquals(List.of("1.2.3", "1.2.3.4"), ips(report));
    assertEquals(1, report.invalidCount());
    assertEquals(1L, metrics.counter("decode.rows.invalidIp"));
  }

  @Test
  void dropsInvalidAddressesWhenConfigured() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    RowDecodeUseCase useCase = new RowDecodeUseCase(decoder, new DecodeConfig(1, true), metrics);

    DecodeReport report = useCase.decodeAll(List.of(
        RowFixtures.plainRow("1..3.4", 80),
        RowFixtures.plainRow("1.2.3.4", 80)));

    assertEquals(List.of("1.2.3.4"), ips(report));
    assertEquals(1, report.invalidCount());
    assertEquals(1L, metrics.counter("decode.rows.decoded"));
  }

  @Test
  void parallelDecodingKeepsInputOrder() throws Exception {
    List<Element> rows = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      if (i % 10 == 7) {
        rows.add(RowFixtures.row("<td>broken</td>"));
      } else {
        rows.add(RowFixtures.plainRow("10.0.0." + i, 1000 + i));
      }
    }
    RecordingMetrics metrics = new RecordingMetrics();
    RowDecodeUseCase useCase = new RowDecodeUseCase(decoder, new DecodeConfig(4, false), metrics);

    DecodeReport report = useCase.decodeAll(rows);

    List<Integer> expectedPorts = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      if (i % 10 != 7) {
        expectedPorts.add(1000 + i);
      }
    }
    List<Integer> ports = new ArrayList<>();
    for (ProxyRecord record : report.records()) {
      ports.add(record.port());
    }
    assertEquals(expectedPorts, ports);
    assertEquals(5, report.skipped().size());
    assertEquals(7, report.skipped().get(0).rowIndex());
    assertEquals(45L, metrics.counter("decode.rows.decoded"));
  }

  @Test
  void parallelAndSequentialReportsMatch() throws Exception {
    List<Element> rows = List.of(
        RowFixtures.proxyRow("1 min 30 sec", "3129", "HTTPS", "High"),
        RowFixtures.proxyRow("2 h", "1080", "socks4", "Anonymous"),
        RowFixtures.plainRow("8.8.8.8", 53));

    DecodeReport sequential =
        new RowDecodeUseCase(decoder, DecodeConfig.defaults(), MetricsPort.NO_OP).decodeAll(rows);
    DecodeReport parallel =
        new RowDecodeUseCase(decoder, new DecodeConfig(3, false), MetricsPort.NO_OP).decodeAll(rows);

    assertEquals(sequential, parallel);
  }

  @Test
  void unexpectedDecoderFailurePropagates() {
    RowDecoder failing = row -> {
      throw new IllegalStateException("boom");
    };
    RowDecodeUseCase useCase = new RowDecodeUseCase(failing, new DecodeConfig(2, false), MetricsPort.NO_OP);

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> useCase.decodeAll(List.of(RowFixtures.plainRow("1.1.1.1", 1), RowFixtures.plainRow("2.2.2.2", 2))));
    assertEquals("boom", ex.getMessage());
  }

  @Test
  void workerFailureIsLoggedAtErrorWithCause() {
    RowDecoder failing = row -> {
      throw new IllegalStateException("boom");
    };
    RowDecodeUseCase useCase = new RowDecodeUseCase(failing, new DecodeConfig(2, false), MetricsPort.NO_OP);

    Logger logger = (Logger) LoggerFactory.getLogger(RowDecodeUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      assertThrows(IllegalStateException.class,
          () -> useCase.decodeAll(List.of(RowFixtures.plainRow("1.1.1.1", 1), RowFixtures.plainRow("2.2.2.2", 2))));

      List<ILoggingEvent> errors = new ArrayList<>();
      for (ILoggingEvent event : appender.list) {
        if (event.getLevel() == Level.ERROR) {
          errors.add(event);
        }
      }
      assertEquals(1, errors.size());
      assertEquals("Decode worker failed; abandoning batch", errors.get(0).getFormattedMessage());
      assertEquals("boom", errors.get(0).getThrowableProxy().getMessage());
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }
  }

  @Test
  void emptyBatchYieldsEmptyReport() throws Exception {
    DecodeReport report =
        new RowDecodeUseCase(decoder, new DecodeConfig(8, true), MetricsPort.NO_OP).decodeAll(List.of());

    assertTrue(report.records().isEmpty());
    assertTrue(report.skipped().isEmpty());
  }

  private static List<String> ips(DecodeReport report) {
    List<String> ips = new ArrayList<>();
    for (ProxyRecord record : report.records()) {
      ips.add(record.ip());
    }
    return ips;
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Map<String, Long> observations = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {
      observations.put(key, value);
    }

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }

    boolean observed(String key) {
      return observations.containsKey(key);
    }
  }
}
