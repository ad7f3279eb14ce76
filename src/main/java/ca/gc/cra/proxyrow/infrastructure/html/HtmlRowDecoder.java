package ca.gc.cra.proxyrow.infrastructure.html;

import ca.gc.cra.proxyrow.application.port.RowDecoder;
import ca.gc.cra.proxyrow.domain.proxy.ProxyRecord;
import ca.gc.cra.proxyrow.domain.row.Column;
import ca.gc.cra.proxyrow.domain.util.Durations;
import ca.gc.cra.proxyrow.domain.util.LenientNumbers;
import java.util.Locale;
import java.util.Objects;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jsoup-backed {@link RowDecoder} for the eight-column proxy listing.
 *
 * <p>Every cell is read before the record is built, so a missing cell aborts the row without a partial result.
 * The instance holds no per-row state and can be shared between threads.</p>
 */
public final class HtmlRowDecoder implements RowDecoder {
  private static final Logger log = LoggerFactory.getLogger(HtmlRowDecoder.class);

  static final int PROTOCOL_WIDTH = 5;
  private static final String VALUE_ATTRIBUTE = "value";

  private final IpDeobfuscator deobfuscator;

  /** Creates a decoder with the default address deobfuscator. */
  public HtmlRowDecoder() {
    this(new IpDeobfuscator());
  }

  /**
   * Creates a decoder with an explicit deobfuscator.
   *
   * @param deobfuscator address deobfuscator; must not be {@code null}
   */
  public HtmlRowDecoder(IpDeobfuscator deobfuscator) {
    this.deobfuscator = Objects.requireNonNull(deobfuscator, "deobfuscator");
  }

  @Override
  public ProxyRecord decode(Element row) {
    RowCells cells = new RowCells(Objects.requireNonNull(row, "row"));

    long lastSeen = Durations.toSeconds(cells.text(Column.LAST_CHECKED));
    String ip = deobfuscator.reveal(cells.cell(Column.IP_ADDRESS));
    int port = LenientNumbers.toNonNegativeInt(cells.text(Column.PORT));
    String country = lowerCase(cells.text(Column.COUNTRY));
    int speed = valueAttribute(cells.cell(Column.SPEED));
    int connectionTime = valueAttribute(cells.cell(Column.CONNECTION_TIME));
    String protocol = truncate(lowerCase(cells.text(Column.PROTOCOL)), PROTOCOL_WIDTH);
    String anonymity = lowerCase(cells.text(Column.ANONYMITY));

    ProxyRecord record =
        new ProxyRecord(lastSeen, ip, port, country, speed, connectionTime, protocol, anonymity);
    if (log.isDebugEnabled()) {
      log.debug("Decoded proxy row {} valid={} secure={}", record.url(), record.valid(), record.isSecure());
    }
    return record;
  }

  /**
   * Reads the numeric {@code value} attribute of the first {@code <div>} inside {@code cell}.
   *
   * @param cell latency cell
   * @return attribute value, or {@code 0} when the element or attribute is missing, negative or not numeric
   */
  static int valueAttribute(Element cell) {
    for (Element child : cell.children()) {
      if ("div".equals(child.normalName())) {
        return LenientNumbers.toNonNegativeInt(child.attr(VALUE_ATTRIBUTE));
      }
    }
    return 0;
  }

  private static String lowerCase(String text) {
    return text.toLowerCase(Locale.ROOT);
  }

  private static String truncate(String text, int width) {
    return text.length() <= width ? text : text.substring(0, width);
  }
}
