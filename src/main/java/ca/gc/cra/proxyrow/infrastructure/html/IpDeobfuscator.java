package ca.gc.cra.proxyrow.infrastructure.html;

import java.util.Objects;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * <strong>What:</strong> Rebuilds the proxy address hidden in the second column of a listing row.
 * <p><strong>Why:</strong> The listing scatters the address over sibling nodes and injects decoy digits that are
 * hidden by inline styles or by classes declared in an embedded {@code <style>} block. Reading the cell text
 * returns the decoys too.</p>
 * <p><strong>Role:</strong> Infrastructure helper of {@link HtmlRowDecoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the address container: the first {@code <span>} child of the cell, or the cell itself.</li>
 *   <li>Classify each child node of the container as genuine or decoy, in document order.</li>
 *   <li>Concatenate the trimmed text of the genuine nodes without separators.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; one instance may serve concurrent decoders.</p>
 * <p><strong>Performance:</strong> One pass over the container's children; the decoder table is parsed at most once
 * per call and only when an element without inline style is met.</p>
 *
 * @implNote Classification stops at the container's direct children; nested markup inside a genuine element is
 * not filtered. Never throws on malformed markup. The result may not be an address at all; callers check
 * {@code ProxyRecord.valid()}.
 * @since 0.1.0
 */
public final class IpDeobfuscator {
  private static final Pattern NUMERAL_CLASS = Pattern.compile("^\\d+$");
  private static final String VISIBLE_MARKER = "in";

  /**
   * Returns the address encoded under {@code cell}.
   *
   * @param cell second-column cell of a row; must not be {@code null}
   * @return genuine fragments joined in document order; empty when none is found
   */
  public String reveal(Element cell) {
    Element container = addressContainer(Objects.requireNonNull(cell, "cell"));
    LazyDecoderTable table = new LazyDecoderTable(container);
    StringBuilder address = new StringBuilder(16);
    for (Node node : container.childNodes()) {
      if (isGenuine(node, table)) {
        address.append(textOf(node));
      }
    }
    return address.toString();
  }

  static Element addressContainer(Element cell) {
    for (Element child : cell.children()) {
      if ("span".equals(child.normalName())) {
        return child;
      }
    }
    return cell;
  }

  static DecoderTable decoderTable(Element container) {
    for (Element child : container.children()) {
      if ("style".equals(child.normalName())) {
        return DecoderTable.parse(child.data());
      }
    }
    return DecoderTable.EMPTY;
  }

  private static boolean isGenuine(Node node, LazyDecoderTable table) {
    if (node instanceof TextNode) {
      return true;
    }
    if (!(node instanceof Element element)) {
      return false;
    }
    // inline style wins over any class rule
    if (element.hasAttr("style")) {
      return element.attr("style").contains(VISIBLE_MARKER);
    }
    if (!element.hasAttr("class")) {
      return false;
    }
    String className = element.attr("class");
    return table.get().contains(className) || NUMERAL_CLASS.matcher(className).matches();
  }

  // Only direct children are classified. A genuine element contributes all of its descendant text, hidden
  // nested spans included.
  private static String textOf(Node node) {
    if (node instanceof TextNode text) {
      return text.text().strip();
    }
    return ((Element) node).text().strip();
  }

  private static final class LazyDecoderTable {
    private final Element container;
    private DecoderTable table;

    LazyDecoderTable(Element container) {
      this.container = container;
    }

    DecoderTable get() {
      if (table == null) {
        table = decoderTable(container);
      }
      return table;
    }
  }
}
