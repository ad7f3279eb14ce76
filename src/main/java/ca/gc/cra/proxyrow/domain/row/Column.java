package ca.gc.cra.proxyrow.domain.row;

/**
 * <strong>What:</strong> Fixed column layout of a proxy-listing table row.
 * <p><strong>Why:</strong> Gives every positional cell lookup a name so failures report which field was absent.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by the cell locator and {@link MissingCellException}.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum constants.</p>
 *
 * @since 0.1.0
 */
public enum Column {
  LAST_CHECKED(1),
  IP_ADDRESS(2),
  PORT(3),
  COUNTRY(4),
  SPEED(5),
  CONNECTION_TIME(6),
  PROTOCOL(7),
  ANONYMITY(8);

  private final int position;

  Column(int position) {
    this.position = position;
  }

  /**
   * Returns the 1-based cell position of this column within the row.
   *
   * @return position between 1 and 8
   */
  public int position() {
    return position;
  }
}
