package ca.gc.cra.proxyrow.domain.proxy;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable proxy-server entry decoded from one listing row.
 * <p><strong>Why:</strong> Gives callers normalized fields plus the derived protocol and anonymity predicates they
 * filter on, without re-reading markup.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@code RowDecoder} implementations.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Derived predicates are constant-time string checks on already-normalized fields.</p>
 *
 * @param lastSeenSeconds age of the last check in seconds; never negative
 * @param ip address rebuilt from obfuscated markup; may be malformed, see {@link #valid()}
 * @param port proxy port
 * @param country lower-cased country name
 * @param speedMs average response time in milliseconds
 * @param connectionTimeMs average connection time in milliseconds
 * @param protocol lower-cased protocol token, at most five characters ({@code http}, {@code https}, {@code socks})
 * @param anonymity lower-cased anonymity level
 * @since 0.1.0
 */
public record ProxyRecord(
    long lastSeenSeconds,
    String ip,
    int port,
    String country,
    int speedMs,
    int connectionTimeMs,
    String protocol,
    String anonymity) {

  /**
   * Creates a record, rejecting {@code null} text fields.
   *
   * @throws NullPointerException if any text field is {@code null}
   * @throws IllegalArgumentException if {@code lastSeenSeconds}, {@code port}, {@code speedMs} or
   *     {@code connectionTimeMs} is negative
   */
  public ProxyRecord {
    Objects.requireNonNull(ip, "ip");
    Objects.requireNonNull(country, "country");
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(anonymity, "anonymity");
    if (lastSeenSeconds < 0) {
      throw new IllegalArgumentException("lastSeenSeconds must not be negative (was " + lastSeenSeconds + ")");
    }
    requireNonNegative("port", port);
    requireNonNegative("speedMs", speedMs);
    requireNonNegative("connectionTimeMs", connectionTimeMs);
  }

  /**
   * Returns the proxy URL in {@code protocol://ip:port} form.
   *
   * @return canonical URL string
   */
  public String url() {
    return protocol + "://" + ip + ':' + port;
  }

  /**
   * Reports whether the rebuilt address has exactly four non-empty dot-separated segments.
   *
   * <p>Octet ranges and leading zeros are not checked: {@code 999.1.1.1} counts as valid.</p>
   *
   * @return {@code true} when {@link #ip()} has the dotted-quad shape
   */
  public boolean valid() {
    String[] segments = ip.split("\\.", -1);
    if (segments.length != 4) {
      return false;
    }
    for (String segment : segments) {
      if (segment.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  public boolean isHttp() {
    return "http".equals(protocol);
  }

  public boolean isHttps() {
    return "https".equals(protocol);
  }

  public boolean isSocks() {
    return protocol.startsWith("socks");
  }

  /**
   * Reports whether traffic through the proxy can be encrypted end to end.
   *
   * @return {@code true} for HTTPS and SOCKS proxies
   */
  public boolean supportsSsl() {
    return isHttps() || isSocks();
  }

  /**
   * Reports whether the anonymity level is high or better.
   *
   * @return {@code true} when {@link #anonymity()} starts with {@code high}
   */
  public boolean isAnonymous() {
    return anonymity.startsWith("high");
  }

  /**
   * Reports whether the proxy is both highly anonymous and SSL capable.
   *
   * @return {@code true} when {@link #isAnonymous()} and {@link #supportsSsl()} both hold
   */
  public boolean isSecure() {
    return isAnonymous() && supportsSsl();
  }

  @Override
  public String toString() {
    return "<ProxyRecord " + url() + '>';
  }

  private static void requireNonNegative(String name, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must not be negative (was " + value + ")");
    }
  }
}
