package ca.gc.cra.proxyrow.infrastructure.html;

import ca.gc.cra.proxyrow.domain.row.Column;
import ca.gc.cra.proxyrow.domain.row.MissingCellException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.nodes.Element;

/**
 * Positional access to the {@code <td>} cells of one listing row.
 *
 * <p>Only direct {@code <td>} children count; header cells and nested tables are ignored. Lookups beyond the last
 * cell raise {@link MissingCellException} instead of returning {@code null}.</p>
 */
public final class RowCells {
  private final List<Element> cells;

  /**
   * Indexes the cells of {@code row}.
   *
   * @param row table row element; must not be {@code null}
   */
  public RowCells(Element row) {
    Objects.requireNonNull(row, "row");
    List<Element> found = new ArrayList<>(Column.values().length);
    for (Element child : row.children()) {
      if ("td".equals(child.normalName())) {
        found.add(child);
      }
    }
    this.cells = List.copyOf(found);
  }

  /**
   * Returns the cell for {@code column}.
   *
   * @param column column to locate; must not be {@code null}
   * @return cell element
   * @throws MissingCellException if the row has fewer cells than {@code column.position()}
   */
  public Element cell(Column column) {
    int index = Objects.requireNonNull(column, "column").position() - 1;
    if (index >= cells.size()) {
      throw new MissingCellException(column, cells.size());
    }
    return cells.get(index);
  }

  /**
   * Returns the whitespace-normalized, trimmed text of the cell for {@code column}.
   *
   * @param column column to read; must not be {@code null}
   * @return cell text; empty when the cell has no text
   * @throws MissingCellException if the cell is absent
   */
  public String text(Column column) {
    return cell(column).text().strip();
  }

  /**
   * Returns the number of cells found on the row.
   *
   * @return cell count
   */
  public int size() {
    return cells.size();
  }
}
