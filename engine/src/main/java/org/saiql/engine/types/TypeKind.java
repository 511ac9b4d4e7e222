package org.saiql.engine.types;

/**
 * Dialect-neutral type kinds. Every backend type maps into exactly one kind.
 */
public enum TypeKind {
    BOOLEAN(Family.BOOLEAN, Params.NONE),
    INTEGER16(Family.NUMERIC, Params.NONE),
    INTEGER32(Family.NUMERIC, Params.NONE),
    INTEGER64(Family.NUMERIC, Params.NONE),
    FLOAT32(Family.NUMERIC, Params.NONE),
    FLOAT64(Family.NUMERIC, Params.NONE),
    DECIMAL(Family.NUMERIC, Params.PRECISION_SCALE),
    CHAR(Family.CHARACTER, Params.LENGTH),
    VARCHAR(Family.CHARACTER, Params.LENGTH),
    TEXT(Family.CHARACTER, Params.NONE),
    BINARY(Family.BINARY, Params.LENGTH),
    DATE(Family.TEMPORAL, Params.NONE),
    TIME(Family.TEMPORAL, Params.PRECISION),
    TIMESTAMP(Family.TEMPORAL, Params.PRECISION),
    TIMESTAMP_TZ(Family.TEMPORAL, Params.PRECISION),
    UUID(Family.UUID, Params.NONE),
    JSON(Family.JSON, Params.NONE);

    /**
     * Groups of kinds that compare with each other and accept the same literals.
     */
    public enum Family {
        BOOLEAN, NUMERIC, CHARACTER, BINARY, TEMPORAL, UUID, JSON
    }

    /**
     * Which parameters a kind carries.
     */
    public enum Params {
        NONE, LENGTH, PRECISION, PRECISION_SCALE
    }

    private final Family family;
    private final Params params;

    TypeKind(Family family, Params params) {
        this.family = family;
        this.params = params;
    }

    public Family family() {
        return family;
    }

    public Params params() {
        return params;
    }

    public boolean isInteger() {
        return this == INTEGER16 || this == INTEGER32 || this == INTEGER64;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    /**
     * Decimal digits needed to hold every value of an integer kind.
     */
    int integerDigits() {
        return switch (this) {
            case INTEGER16 -> 5;
            case INTEGER32 -> 10;
            case INTEGER64 -> 19;
            default -> throw new IllegalStateException(this + " is not an integer kind");
        };
    }
}
