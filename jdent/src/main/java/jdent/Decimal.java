package jdent;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * An exact JSON number: {@code mantissa × 10^exponent}.
 *
 * <p> This is what the parser produces for every number literal. No precision is lost whatever
 * the length of the literal; {@code 3.140} is kept as {@code (3140, -3)}. Conversion to a
 * floating point value is the separate, explicitly lossy {@link #toDouble()}.
 *
 * <p> Equality is structural, so {@code (3140, -3)} and {@code (314, -2)} are different records
 * that compare as equal through {@link #compareTo(Decimal)}; use {@link #normalize()} for a
 * canonical form.
 *
 * @param mantissa unscaled value, never {@code null}
 * @param exponent power of ten, {@code -Integer.MAX_VALUE} at least
 * @since 0.1.0
 */
public record Decimal(BigInteger mantissa, int exponent) implements Comparable<Decimal> {

    public static final Decimal ZERO = new Decimal(BigInteger.ZERO, 0);

    /** Upper bound on the decimal digits {@link #toBigIntegerExact()} will materialise. */
    public static final int MAX_INTEGER_DIGITS = 100_000;

    public Decimal {
        Objects.requireNonNull(mantissa, "mantissa");
        // BigDecimal's scale is the negated exponent
        if (exponent == Integer.MIN_VALUE) throw new IllegalArgumentException("exponent out of range: " + exponent);
    }

    public static Decimal of(long mantissa, int exponent) {
        return new Decimal(BigInteger.valueOf(mantissa), exponent);
    }

    public static Decimal valueOf(long value) {
        return of(value, 0);
    }

    public static Decimal valueOf(BigDecimal value) {
        return new Decimal(value.unscaledValue(), -value.scale());
    }

    /**
     * Parse a single JSON number literal.
     *
     * @throws JsonException.SyntaxException if {@code literal} is not exactly one JSON number
     */
    public static Decimal parse(String literal) {
        var cursor = Cursor.of(literal);
        var value = PushParser.parseNumber(cursor);
        cursor.expectEndOfInput();
        return value;
    }

    /**
     * @return the same value with trailing zeros moved from the mantissa into the exponent
     */
    public Decimal normalize() {
        if (mantissa.signum() == 0) return ZERO;
        BigInteger m = mantissa;
        long e = exponent;
        BigInteger[] qr = m.divideAndRemainder(BigInteger.TEN);
        while (qr[1].signum() == 0 && e < Integer.MAX_VALUE) {
            m = qr[0];
            e++;
            qr = m.divideAndRemainder(BigInteger.TEN);
        }
        return new Decimal(m, (int) e);
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(mantissa, -exponent);
    }

    /**
     * Lossy conversion to the nearest {@code double}; very large magnitudes become infinite.
     */
    public double toDouble() {
        return toBigDecimal().doubleValue();
    }

    /**
     * @throws ArithmeticException if the value has a fractional part or does not fit a {@code long}
     */
    public long longValueExact() {
        return toBigDecimal().longValueExact();
    }

    /**
     * @throws ArithmeticException if the value has a fractional part or does not fit an {@code int}
     */
    public int intValueExact() {
        return toBigDecimal().intValueExact();
    }

    /**
     * @throws ArithmeticException if the value has a fractional part or its integer form would
     *     have more than {@link #MAX_INTEGER_DIGITS} digits
     */
    public BigInteger toBigIntegerExact() {
        if (mantissa.signum() == 0) return BigInteger.ZERO;
        BigDecimal value = toBigDecimal();
        long integerDigits = (long) value.precision() + exponent;
        if (integerDigits <= 0) throw new ArithmeticException("Rounding necessary");
        if (integerDigits > MAX_INTEGER_DIGITS)
            throw new ArithmeticException("Integer part exceeds " + MAX_INTEGER_DIGITS + " digits");
        return value.toBigIntegerExact();
    }

    @Override
    public int compareTo(Decimal other) {
        return toBigDecimal().compareTo(other.toBigDecimal());
    }

    /**
     * A valid JSON number literal for this value, e.g. {@code 3.140}, {@code 42}, {@code 1E+5}.
     */
    @Override
    public String toString() {
        return toBigDecimal().toString();
    }
}
