package de.uni_passau.dbts.client.tsdb;

/**
 * Signals a query that cannot be translated into the native language of a backend, e.g., a
 * percentile without a rank or an empty measurement.
 */
public class QueryException extends TsdbException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   */
  public QueryException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Error message.
   * @param cause The cause.
   */
  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
