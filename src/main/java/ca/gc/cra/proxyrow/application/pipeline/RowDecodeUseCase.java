package ca.gc.cra.proxyrow.application.pipeline;

import ca.gc.cra.proxyrow.application.port.MetricsPort;
import ca.gc.cra.proxyrow.application.port.RowDecoder;
import ca.gc.cra.proxyrow.config.DecodeConfig;
import ca.gc.cra.proxyrow.domain.proxy.ProxyRecord;
import ca.gc.cra.proxyrow.domain.row.MissingCellException;
import ca.gc.cra.proxyrow.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.proxyrow.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes a batch of already-located listing rows into proxy records.
 * <p><strong>Why:</strong> A single malformed row must not sink the batch; skipped rows are reported instead.</p>
 * <p><strong>Role:</strong> Application-layer use case driving the {@link RowDecoder} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode every row, sequentially or on a worker pool sized by {@link DecodeConfig#parallelism()}.</li>
 *   <li>Skip and report rows raising {@link MissingCellException}.</li>
 *   <li>Count, and optionally drop, records whose address is not a dotted quad.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to call concurrently; each call owns its worker pool.</p>
 * <p><strong>Performance:</strong> Rows share nothing, so parallel decoding needs no coordination beyond collecting
 * results in input order.</p>
 * <p><strong>Observability:</strong> Emits {@code decode.rows.decoded}, {@code decode.rows.skipped},
 * {@code decode.rows.invalidIp} and {@code decode.batch.latencyNanos}; logs skipped rows at WARN and an
 * unexpected worker failure at ERROR before rethrowing it.</p>
 *
 * @since 0.1.0
 */
public final class RowDecodeUseCase {
  private static final Logger log = LoggerFactory.getLogger(RowDecodeUseCase.class);

  private static final int MAX_LOGGED_ROW_BYTES = 256;
  private static final String WORKER_PREFIX = "proxyrow-decode";

  private final RowDecoder decoder;
  private final DecodeConfig config;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param decoder row decoder shared by all workers; must not be {@code null}
   * @param config batch settings; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public RowDecodeUseCase(RowDecoder decoder, DecodeConfig config, MetricsPort metrics) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decodes {@code rows} and reports the outcome.
   *
   * @param rows row elements in page order; must not be {@code null} nor contain {@code null}
   * @return report whose records keep the order of {@code rows}
   * @throws InterruptedException if interrupted while waiting for parallel workers
   * @throws NullPointerException if {@code rows} or one of its elements is {@code null}
   */
  public DecodeReport decodeAll(List<Element> rows) throws InterruptedException {
    Objects.requireNonNull(rows, "rows");
    long started = System.nanoTime();
    List<Outcome> outcomes = config.parallelism() > 1 && rows.size() > 1
        ? decodeParallel(rows)
        : decodeSequential(rows);

    List<ProxyRecord> records = new ArrayList<>(rows.size());
    List<DecodeReport.SkippedRow> skipped = new ArrayList<>();
    int invalid = 0;
    for (int i = 0; i < outcomes.size(); i++) {
      Outcome outcome = outcomes.get(i);
      if (outcome.failure != null) {
        MissingCellException failure = outcome.failure;
        skipped.add(new DecodeReport.SkippedRow(i, failure.column()));
        metrics.increment("decode.rows.skipped");
        log.warn("Skipping row {}: {} [{}]", i, failure.getMessage(),
            Logs.snippet(rows.get(i).outerHtml(), MAX_LOGGED_ROW_BYTES));
        continue;
      }
      ProxyRecord record = outcome.record;
      if (!record.valid()) {
        invalid++;
        metrics.increment("decode.rows.invalidIp");
        if (config.dropInvalid()) {
          log.debug("Dropping row {} with malformed address '{}'", i, record.ip());
          continue;
        }
      }
      records.add(record);
      metrics.increment("decode.rows.decoded");
    }

    metrics.observe("decode.batch.latencyNanos", System.nanoTime() - started);
    log.info("Decoded {} of {} rows ({} skipped, {} with malformed addresses)",
        records.size(), rows.size(), skipped.size(), invalid);
    return new DecodeReport(records, skipped, invalid);
  }

  private List<Outcome> decodeSequential(List<Element> rows) {
    List<Outcome> outcomes = new ArrayList<>(rows.size());
    for (Element row : rows) {
      outcomes.add(decodeOne(row));
    }
    return outcomes;
  }

  private List<Outcome> decodeParallel(List<Element> rows) throws InterruptedException {
    int workers = Math.min(config.parallelism(), rows.size());
    ExecutorService pool = ExecutorFactories.newDecodePool(workers, WORKER_PREFIX);
    try {
      List<Future<Outcome>> futures = new ArrayList<>(rows.size());
      for (Element row : rows) {
        Objects.requireNonNull(row, "row");
        futures.add(pool.submit(() -> decodeOne(row)));
      }
      List<Outcome> outcomes = new ArrayList<>(rows.size());
      for (Future<Outcome> future : futures) {
        outcomes.add(await(future));
      }
      return outcomes;
    } finally {
      pool.shutdownNow();
    }
  }

  private Outcome decodeOne(Element row) {
    try {
      return new Outcome(decoder.decode(row), null);
    } catch (MissingCellException ex) {
      return new Outcome(null, ex);
    }
  }

  private static Outcome await(Future<Outcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      log.error("Decode worker failed; abandoning batch", cause);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Row decoding failed", cause);
    }
  }

  private static final class Outcome {
    private final ProxyRecord record;
    private final MissingCellException failure;

    Outcome(ProxyRecord record, MissingCellException failure) {
      this.record = record;
      this.failure = failure;
    }
  }
}
