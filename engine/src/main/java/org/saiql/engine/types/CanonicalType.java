package org.saiql.engine.types;

import java.util.Objects;

/**
 * A dialect-neutral column type.
 *
 * <p>Parameters follow the kind: DECIMAL uses precision and scale; CHAR,
 * VARCHAR and BINARY use length; TIME, TIMESTAMP and TIMESTAMP_TZ use
 * precision (fractional second digits). A null parameter means unbounded
 * or backend default.
 *
 * @param kind      type kind
 * @param precision DECIMAL precision or fractional-second digits
 * @param scale     DECIMAL scale
 * @param length    CHAR/VARCHAR/BINARY length
 * @param nullable  whether the column accepts NULL
 */
public record CanonicalType(TypeKind kind, Integer precision, Integer scale, Integer length, boolean nullable) {

    /** Fractional-second digits assumed when a temporal type declares none. */
    public static final int DEFAULT_FRACTIONAL_DIGITS = 6;

    public CanonicalType {
        Objects.requireNonNull(kind, "Type kind cannot be null");
        switch (kind.params()) {
            case PRECISION_SCALE -> {
                if (length != null) {
                    throw new IllegalArgumentException(kind + " does not take a length");
                }
                if (precision != null && precision < 1) {
                    throw new IllegalArgumentException("Precision must be positive: " + precision);
                }
                if (scale != null) {
                    if (precision == null) {
                        throw new IllegalArgumentException("Scale requires a precision");
                    }
                    if (scale < 0 || scale > precision) {
                        throw new IllegalArgumentException("Scale " + scale + " outside 0.." + precision);
                    }
                }
            }
            case LENGTH -> {
                if (precision != null || scale != null) {
                    throw new IllegalArgumentException(kind + " only takes a length");
                }
                if (length != null && length < 1) {
                    throw new IllegalArgumentException("Length must be positive: " + length);
                }
            }
            case PRECISION -> {
                if (scale != null || length != null) {
                    throw new IllegalArgumentException(kind + " only takes a precision");
                }
                if (precision != null && (precision < 0 || precision > 9)) {
                    throw new IllegalArgumentException("Fractional seconds must be 0..9: " + precision);
                }
            }
            case NONE -> {
                if (precision != null || scale != null || length != null) {
                    throw new IllegalArgumentException(kind + " takes no parameters");
                }
            }
        }
    }

    public static CanonicalType of(TypeKind kind) {
        return new CanonicalType(kind, null, null, null, true);
    }

    public static CanonicalType decimal(int precision, int scale) {
        return new CanonicalType(TypeKind.DECIMAL, precision, scale, null, true);
    }

    public static CanonicalType varchar(int length) {
        return new CanonicalType(TypeKind.VARCHAR, null, null, length, true);
    }

    public static CanonicalType fixedChar(int length) {
        return new CanonicalType(TypeKind.CHAR, null, null, length, true);
    }

    public static CanonicalType binary(int length) {
        return new CanonicalType(TypeKind.BINARY, null, null, length, true);
    }

    public static CanonicalType timestamp(int precision) {
        return new CanonicalType(TypeKind.TIMESTAMP, precision, null, null, true);
    }

    public static CanonicalType timestampTz(int precision) {
        return new CanonicalType(TypeKind.TIMESTAMP_TZ, precision, null, null, true);
    }

    public CanonicalType notNull() {
        return new CanonicalType(kind, precision, scale, length, false);
    }

    public CanonicalType withNullable(boolean value) {
        return new CanonicalType(kind, precision, scale, length, value);
    }

    /**
     * Fractional-second digits, substituting the default when undeclared.
     */
    public int fractionalDigits() {
        return precision != null ? precision : DEFAULT_FRACTIONAL_DIGITS;
    }

    /**
     * Type signature without nullability, e.g. {@code DECIMAL(20,4)}.
     */
    public String signature() {
        return switch (kind.params()) {
            case PRECISION_SCALE -> precision == null ? kind.name()
                    : kind.name() + "(" + precision + "," + (scale == null ? 0 : scale) + ")";
            case LENGTH -> length == null ? kind.name() : kind.name() + "(" + length + ")";
            case PRECISION -> precision == null ? kind.name() : kind.name() + "(" + precision + ")";
            case NONE -> kind.name();
        };
    }

    @Override
    public String toString() {
        return nullable ? signature() : signature() + " NOT NULL";
    }
}
