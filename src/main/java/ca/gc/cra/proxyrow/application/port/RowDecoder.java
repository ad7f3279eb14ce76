package ca.gc.cra.proxyrow.application.port;

import ca.gc.cra.proxyrow.domain.proxy.ProxyRecord;
import ca.gc.cra.proxyrow.domain.row.MissingCellException;
import org.jsoup.nodes.Element;

/**
 * <strong>What:</strong> Port that turns one pre-parsed listing row into a {@link ProxyRecord}.
 * <p><strong>Why:</strong> Separates batch orchestration from the markup-specific decoding rules so each can be
 * tested on its own.</p>
 * <p><strong>Role:</strong> Application port implemented by markup adapters such as {@code HtmlRowDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must not keep per-row state between calls; a single instance is
 * shared by parallel decoding workers.</p>
 *
 * @since 0.1.0
 */
public interface RowDecoder {
  /**
   * Decodes a single row.
   *
   * @param row table row element whose {@code <td>} children follow the fixed column layout; must not be
   *     {@code null}
   * @return fully populated record; never {@code null}
   * @throws MissingCellException if a required cell is absent; no partial record is produced
   * @throws NullPointerException if {@code row} is {@code null}
   */
  ProxyRecord decode(Element row);
}
