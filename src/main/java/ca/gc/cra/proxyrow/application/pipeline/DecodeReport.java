package ca.gc.cra.proxyrow.application.pipeline;

import ca.gc.cra.proxyrow.domain.proxy.ProxyRecord;
import ca.gc.cra.proxyrow.domain.row.Column;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of decoding a batch of rows.
 *
 * @param records decoded records in input order; excludes skipped rows and, when configured, invalid addresses
 * @param skipped rows that were not decoded because a cell was missing, in input order
 * @param invalidCount number of decoded records whose address failed the dotted-quad check, kept or dropped
 * @since 0.1.0
 */
public record DecodeReport(List<ProxyRecord> records, List<SkippedRow> skipped, int invalidCount) {

  public DecodeReport {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
  }

  /**
   * A row left out of the batch.
   *
   * @param rowIndex zero-based index of the row in the submitted list
   * @param column first column found missing
   */
  public record SkippedRow(int rowIndex, Column column) {
    public SkippedRow {
      Objects.requireNonNull(column, "column");
    }
  }
}
