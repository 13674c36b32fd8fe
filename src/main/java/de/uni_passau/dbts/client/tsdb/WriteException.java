package de.uni_passau.dbts.client.tsdb;

/**
 * Thrown when data points or schema changes could not be written to a database.
 */
public class WriteException extends TsdbException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   */
  public WriteException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   * @param cause The cause.
   */
  public WriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
