package jdent;

/**
 * How {@link PrettyPrinter} renders number literals.
 */
public enum NumberMode {
    /** Print the parsed {@link Decimal} exactly. */
    DECIMAL,
    /** Round through {@code double}; {@code 0.10000000000000000001} prints as {@code 0.1}. */
    FLOAT
}
