package ca.gc.cra.proxyrow.infrastructure.html;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Set of CSS class names that mark genuine address fragments, read from the {@code <style>} block embedded next to
 * the obfuscated address.
 *
 * <p>The block lists one rule per whitespace-separated token, e.g. {@code .Hzpp{display:none}} and
 * {@code .SDYd{display:inline}}. Tokens mentioning {@code none} hide their class and are skipped. From every other
 * token the four characters after the leading selector punctuation (indices 1 to 4) form the class name, which is
 * how the page keeps its generated class names.</p>
 */
public final class DecoderTable {
  static final DecoderTable EMPTY = new DecoderTable(Set.of());

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String HIDDEN_MARKER = "none";
  private static final int NAME_START = 1;
  private static final int NAME_END = 5;

  private final Set<String> classNames;

  private DecoderTable(Set<String> classNames) {
    this.classNames = classNames;
  }

  /**
   * Parses the text of an embedded style block.
   *
   * @param css raw style text; {@code null} or blank yields an empty table
   * @return decoder table holding the visible class names
   */
  public static DecoderTable parse(String css) {
    if (css == null || css.isBlank()) {
      return EMPTY;
    }
    Set<String> names = new LinkedHashSet<>();
    for (String token : WHITESPACE.split(css.strip())) {
      if (token.contains(HIDDEN_MARKER)) {
        continue;
      }
      int start = Math.min(NAME_START, token.length());
      int end = Math.min(NAME_END, token.length());
      String name = token.substring(start, end);
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    return names.isEmpty() ? EMPTY : new DecoderTable(Set.copyOf(names));
  }

  /**
   * Reports whether {@code className} marks a genuine fragment.
   *
   * @param className full value of an element's {@code class} attribute
   * @return {@code true} when the table lists the class as visible
   */
  public boolean contains(String className) {
    return className != null && classNames.contains(className);
  }

  /**
   * Returns the visible class names.
   *
   * @return immutable set of class names
   */
  public Set<String> classNames() {
    return classNames;
  }
}
