package org.saiql.engine.plan;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.store.Column;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.UUID;

/**
 * Converts literals as written into typed values for the column they meet.
 *
 * <p>Temporal, UUID and JSON literals are validated but kept as text; the
 * database casts the bound string.
 */
final class LiteralBinder {

    private LiteralBinder() {
    }

    /**
     * A literal with no column to take a type from, e.g. {@code 1 = 1}.
     */
    static Literal standalone(org.saiql.engine.lang.ast.Literal literal) {
        return switch (literal.kind()) {
            case STRING -> new Literal(literal.text(), CanonicalType.of(TypeKind.TEXT));
            case INTEGER -> new Literal(integerValue(literal.text()), CanonicalType.of(TypeKind.INTEGER64));
            case DECIMAL -> new Literal(new BigDecimal(literal.text()), CanonicalType.of(TypeKind.DECIMAL));
            case BOOLEAN -> new Literal(booleanValue(literal.text()), CanonicalType.of(TypeKind.BOOLEAN));
            case NULL -> throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "NULL is only allowed in IS [NOT] NULL tests and assignments");
        };
    }

    /**
     * A literal compared with a value of the given type.
     */
    static Literal forComparison(org.saiql.engine.lang.ast.Literal literal, CanonicalType target, String context) {
        if (literal.kind() == org.saiql.engine.lang.ast.Literal.Kind.NULL) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Comparison of " + context + " with NULL never matches; use IS NULL or IS NOT NULL");
        }
        return new Literal(convert(literal, target, context), target);
    }

    /**
     * A literal stored into a column by INSERT or UPDATE: also checks
     * nullability, integer range, decimal digits and character length.
     */
    static Literal forAssignment(org.saiql.engine.lang.ast.Literal literal, Column column, String tableName) {
        String context = tableName + "." + column.name();
        CanonicalType type = column.type();
        if (literal.kind() == org.saiql.engine.lang.ast.Literal.Kind.NULL) {
            if (!column.isNullable()) {
                throw new SemanticException(ErrorCode.TYPE_MISMATCH, "Column " + context + " is NOT NULL");
            }
            return new Literal(null, type);
        }
        Object value = convert(literal, type, context);
        TypeKind kind = type.kind();
        if (kind.isInteger()) {
            value = checkIntegerRange(value, kind, context);
        } else if (kind == TypeKind.DECIMAL && type.precision() != null) {
            checkDecimalDigits(toBigDecimal(value), type, context);
        } else if ((kind == TypeKind.CHAR || kind == TypeKind.VARCHAR) && type.length() != null) {
            String text = (String) value;
            int length = text.codePointCount(0, text.length());
            if (length > type.length()) {
                throw new SemanticException(ErrorCode.TYPE_MISMATCH, "Value of length " + length
                        + " exceeds " + type.signature() + " of column " + context);
            }
        }
        return new Literal(value, type);
    }

    private static Object convert(org.saiql.engine.lang.ast.Literal literal, CanonicalType target, String context) {
        String text = literal.text();
        return switch (target.kind().family()) {
            case NUMERIC -> switch (literal.kind()) {
                case INTEGER -> integerValue(text);
                case DECIMAL -> new BigDecimal(text);
                default -> throw mismatch(literal, target, context);
            };
            case CHARACTER, JSON -> {
                if (literal.kind() != org.saiql.engine.lang.ast.Literal.Kind.STRING) {
                    throw mismatch(literal, target, context);
                }
                yield text;
            }
            case BOOLEAN -> {
                if (literal.kind() != org.saiql.engine.lang.ast.Literal.Kind.BOOLEAN) {
                    throw mismatch(literal, target, context);
                }
                yield booleanValue(text);
            }
            case TEMPORAL -> {
                if (literal.kind() != org.saiql.engine.lang.ast.Literal.Kind.STRING || !isTemporal(text, target.kind())) {
                    throw mismatch(literal, target, context);
                }
                yield text;
            }
            case UUID -> {
                if (literal.kind() != org.saiql.engine.lang.ast.Literal.Kind.STRING || !isUuid(text)) {
                    throw mismatch(literal, target, context);
                }
                yield text;
            }
            case BINARY -> throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Binary column " + context + " cannot be compared with or assigned a literal");
        };
    }

    private static SemanticException mismatch(org.saiql.engine.lang.ast.Literal literal, CanonicalType target,
                                              String context) {
        String shown = literal.kind() == org.saiql.engine.lang.ast.Literal.Kind.STRING
                ? "'" + literal.text() + "'" : literal.text();
        return new SemanticException(ErrorCode.TYPE_MISMATCH, "Literal " + shown + " ("
                + literal.kind().name().toLowerCase(Locale.ROOT) + ") does not fit " + context
                + " of type " + target.signature());
    }

    private static Object integerValue(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // Beyond 64 bits; range checks reject it where it matters
            return new BigDecimal(text);
        }
    }

    private static Boolean booleanValue(String text) {
        return "true".equalsIgnoreCase(text);
    }

    private static boolean isTemporal(String text, TypeKind kind) {
        String iso = text.trim().replace(' ', 'T');
        try {
            switch (kind) {
                case DATE -> LocalDate.parse(text.trim());
                case TIME -> LocalTime.parse(text.trim());
                case TIMESTAMP -> parseDateTime(iso, false);
                case TIMESTAMP_TZ -> parseDateTime(iso, true);
                default -> throw new IllegalStateException("Not a temporal kind: " + kind);
            }
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static void parseDateTime(String iso, boolean offsetAllowed) {
        if (iso.length() == 10) {
            LocalDate.parse(iso);
        } else if (offsetAllowed && (iso.endsWith("Z") || iso.lastIndexOf('+') > 9 || iso.lastIndexOf('-') > 9)) {
            OffsetDateTime.parse(iso);
        } else {
            LocalDateTime.parse(iso);
        }
    }

    private static boolean isUuid(String text) {
        try {
            return UUID.fromString(text).toString().equalsIgnoreCase(text);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Object checkIntegerRange(Object value, TypeKind kind, String context) {
        BigDecimal decimal = toBigDecimal(value);
        if (decimal.stripTrailingZeros().scale() > 0) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Value " + decimal.toPlainString() + " has a fractional part but " + context + " is " + kind);
        }
        long min;
        long max;
        switch (kind) {
            case INTEGER16 -> {
                min = Short.MIN_VALUE;
                max = Short.MAX_VALUE;
            }
            case INTEGER32 -> {
                min = Integer.MIN_VALUE;
                max = Integer.MAX_VALUE;
            }
            default -> {
                min = Long.MIN_VALUE;
                max = Long.MAX_VALUE;
            }
        }
        if (decimal.compareTo(BigDecimal.valueOf(min)) < 0 || decimal.compareTo(BigDecimal.valueOf(max)) > 0) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH,
                    "Value " + decimal.toPlainString() + " is out of range for " + kind + " column " + context);
        }
        return decimal.longValueExact();
    }

    private static void checkDecimalDigits(BigDecimal value, CanonicalType type, String context) {
        int scale = type.scale() == null ? 0 : type.scale();
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() > scale) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH, "Value " + value.toPlainString()
                    + " has more than " + scale + " fractional digits for " + type.signature() + " column " + context);
        }
        int integerDigits = Math.max(normalized.precision() - normalized.scale(), 0);
        if (integerDigits > type.precision() - scale) {
            throw new SemanticException(ErrorCode.TYPE_MISMATCH, "Value " + value.toPlainString()
                    + " does not fit " + type.signature() + " column " + context);
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        return value instanceof Long l ? BigDecimal.valueOf(l) : (BigDecimal) value;
    }
}
