package de.uni_passau.dbts.client.enums;

import java.util.Locale;

/**
 * Operators of filter conditions.
 */
public enum ComparisonOperator {
  EQUALS("="),
  SAME("=="),
  NOT_EQUALS("!="),
  NOT_EQUALS_ALT("<>"),
  GREATER_THAN(">"),
  GREATER_THAN_OR_EQUAL(">="),
  LESS_THAN("<"),
  LESS_THAN_OR_EQUAL("<="),
  LIKE("LIKE"),
  REGEX("REGEX"),
  NOT_REGEX("NOT REGEX"),
  IN("IN"),
  NOT_IN("NOT IN"),
  BETWEEN("BETWEEN");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Returns the textual representation, e.g., {@code >=} or {@code NOT IN}.
   *
   * @return Operator symbol.
   */
  public String getSymbol() {
    return symbol;
  }

  /**
   * Returns true if conditions using this operator carry a list of values.
   *
   * @return true for IN, NOT IN and BETWEEN.
   */
  public boolean requiresListValue() {
    switch (this) {
      case IN:
      case NOT_IN:
      case BETWEEN:
        return true;
      default:
        return false;
    }
  }

  /**
   * Maps the operator to its Flux counterpart.
   *
   * @return Flux operator.
   */
  public String toFluxOperator() {
    switch (this) {
      case EQUALS:
      case SAME:
        return "==";
      case NOT_EQUALS:
      case NOT_EQUALS_ALT:
        return "!=";
      case LIKE:
        return "=~";
      default:
        return symbol;
    }
  }

  /**
   * Parses an operator from its symbol or its constant name.
   *
   * @param symbol Symbol such as {@code !=}, {@code not in} or {@code NOT_IN}.
   * @return The operator.
   * @throws IllegalArgumentException if the symbol is unknown.
   */
  public static ComparisonOperator fromSymbol(String symbol) {
    if (symbol == null) {
      throw new IllegalArgumentException("Operator must not be null.");
    }
    String normalized = symbol.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    for (ComparisonOperator operator : values()) {
      if (operator.symbol.equals(normalized) || operator.name().equals(normalized)) {
        return operator;
      }
    }
    throw new IllegalArgumentException("Unknown operator " + symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
