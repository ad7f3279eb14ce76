package ca.gc.cra.proxyrow.domain.row;

import java.util.Objects;

/**
 * <strong>What:</strong> Signals that a row lacks one of its fixed cells.
 * <p><strong>Why:</strong> Turns an out-of-range positional lookup into an explicit, per-row failure so callers can
 * skip the row instead of receiving a partially populated record.</p>
 * <p><strong>Role:</strong> Domain exception raised by the cell locator and propagated by row decoders.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class MissingCellException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Column column;
  private final int cellCount;

  /**
   * Creates an exception for a missing cell.
   *
   * @param column column that could not be located; must not be {@code null}
   * @param cellCount number of cells the row actually carries
   */
  public MissingCellException(Column column, int cellCount) {
    super("row is missing cell " + Objects.requireNonNull(column, "column").position()
        + " (" + column + "); found " + cellCount + " cell(s)");
    this.column = column;
    this.cellCount = cellCount;
  }

  /**
   * Returns the column that was absent.
   *
   * @return missing column
   */
  public Column column() {
    return column;
  }

  /**
   * Returns how many cells the offending row carried.
   *
   * @return cell count observed on the row
   */
  public int cellCount() {
    return cellCount;
  }
}
