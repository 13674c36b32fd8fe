package de.uni_passau.dbts.client.query;

/**
 * A query in the native language of a backend, ready to be executed by its transport.
 * Implementations are immutable.
 */
public interface RawQuery {

  /**
   * Returns the native query text.
   *
   * @return Query string.
   */
  String getRawQuery();
}
