package de.uni_passau.dbts.client.tsdb.rrdtool.tags;

import de.uni_passau.dbts.client.tsdb.TsdbException;

/**
 * Tag resolution error, e.g., a tag value that cannot be encoded into a file name or an operator
 * that cannot be evaluated against tags.
 */
public class RrdTagException extends TsdbException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   */
  public RrdTagException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   * @param cause The cause.
   */
  public RrdTagException(String message, Throwable cause) {
    super(message, cause);
  }
}
