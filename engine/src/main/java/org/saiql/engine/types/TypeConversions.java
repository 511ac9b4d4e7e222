package org.saiql.engine.types;

import static org.saiql.engine.types.TypeKind.*;

/**
 * Dialect-neutral lossiness rules between canonical types.
 *
 * <p>Every dialect pair is covered by these rules: a dialect only decides
 * which canonical type it can hold, and this class decides whether moving a
 * value into it loses anything.
 */
public final class TypeConversions {

    private TypeConversions() {
    }

    public static Lossiness check(CanonicalType from, CanonicalType to) {
        if (from.kind() == to.kind()) {
            return sameKind(from, to);
        }
        if (to.kind().family() == Family.CHARACTER) {
            return toCharacter(from, to);
        }
        if (from.kind().isInteger()) {
            return fromInteger(from, to);
        }
        if (from.kind().isFloatingPoint()) {
            if (from.kind() == FLOAT32 && to.kind() == FLOAT64) {
                return Lossiness.NONE;
            }
            return Lossiness.lossy("approximate " + from.signature() + " to " + to.signature() + " rounds values");
        }
        if (from.kind() == DECIMAL) {
            return fromDecimal(from, to);
        }
        if (from.kind() == BOOLEAN && (to.kind().isInteger() || to.kind() == DECIMAL)) {
            return Lossiness.NONE;
        }
        if (from.kind() == UUID && to.kind() == BINARY) {
            return to.length() == null || to.length() >= 16
                    ? Lossiness.NONE
                    : Lossiness.lossy("UUID needs 16 bytes, " + to.signature() + " holds " + to.length());
        }
        if (from.kind().family() == Family.TEMPORAL && to.kind().family() == Family.TEMPORAL) {
            return temporal(from, to);
        }
        return Lossiness.lossy("no lossless conversion from " + from.signature() + " to " + to.signature());
    }

    private static Lossiness sameKind(CanonicalType from, CanonicalType to) {
        return switch (from.kind().params()) {
            case PRECISION_SCALE -> decimalToDecimal(from, to);
            case LENGTH -> length(from, to);
            case PRECISION -> fractionalSeconds(from, to);
            case NONE -> Lossiness.NONE;
        };
    }

    private static Lossiness decimalToDecimal(CanonicalType from, CanonicalType to) {
        if (to.precision() == null) {
            return Lossiness.NONE;
        }
        if (from.precision() == null) {
            return Lossiness.lossy("unbounded " + from.signature() + " narrowed to " + to.signature());
        }
        int fromScale = from.scale() == null ? 0 : from.scale();
        int toScale = to.scale() == null ? 0 : to.scale();
        boolean scaleLoss = toScale < fromScale;
        boolean digitLoss = (to.precision() - toScale) < (from.precision() - fromScale);
        if (scaleLoss || digitLoss) {
            return Lossiness.lossy("precision/scale reduced from " + from.signature() + " to " + to.signature());
        }
        return Lossiness.NONE;
    }

    private static Lossiness length(CanonicalType from, CanonicalType to) {
        if (to.length() == null) {
            return Lossiness.NONE;
        }
        if (from.length() == null || from.length() > to.length()) {
            return Lossiness.lossy("length reduced from " + from.signature() + " to " + to.signature()
                    + ", longer values are truncated");
        }
        return Lossiness.NONE;
    }

    private static Lossiness fractionalSeconds(CanonicalType from, CanonicalType to) {
        if (to.fractionalDigits() < from.fractionalDigits()) {
            return Lossiness.lossy("fractional seconds reduced from " + from.fractionalDigits()
                    + " to " + to.fractionalDigits() + " digits");
        }
        return Lossiness.NONE;
    }

    private static Lossiness toCharacter(CanonicalType from, CanonicalType to) {
        if (from.kind().family() == Family.CHARACTER) {
            if (to.kind() == TEXT) {
                return Lossiness.NONE;
            }
            if (from.kind() == TEXT) {
                return Lossiness.lossy("unbounded TEXT narrowed to " + to.signature() + ", longer values are truncated");
            }
            return length(new CanonicalType(to.kind(), null, null, from.length(), from.nullable()), to);
        }
        if (from.kind() == BINARY) {
            return Lossiness.lossy("binary data stored as " + to.signature());
        }
        if (to.kind() == TEXT) {
            return Lossiness.NONE;
        }
        Integer needed = textWidth(from);
        if (needed == null) {
            return Lossiness.lossy(from.signature() + " text form may exceed " + to.signature());
        }
        if (to.length() != null && to.length() < needed) {
            return Lossiness.lossy(from.signature() + " needs " + needed + " characters, "
                    + to.signature() + " holds " + to.length());
        }
        return Lossiness.NONE;
    }

    /**
     * Widest text rendering of a value, or null when unbounded.
     */
    private static Integer textWidth(CanonicalType type) {
        return switch (type.kind()) {
            case BOOLEAN -> 5;
            case INTEGER16 -> 6;
            case INTEGER32 -> 11;
            case INTEGER64 -> 20;
            case FLOAT32 -> 15;
            case FLOAT64 -> 24;
            case DECIMAL -> type.precision() == null ? null : type.precision() + 2;
            case DATE -> 10;
            case TIME -> 8 + fraction(type);
            case TIMESTAMP -> 19 + fraction(type);
            case TIMESTAMP_TZ -> 25 + fraction(type);
            case UUID -> 36;
            default -> null;
        };
    }

    private static int fraction(CanonicalType type) {
        int digits = type.fractionalDigits();
        return digits == 0 ? 0 : digits + 1;
    }

    private static Lossiness fromInteger(CanonicalType from, CanonicalType to) {
        TypeKind target = to.kind();
        if (target.isInteger()) {
            return target.ordinal() >= from.kind().ordinal()
                    ? Lossiness.NONE
                    : Lossiness.lossy(from.kind() + " narrowed to " + target + ", large values overflow");
        }
        if (target == DECIMAL) {
            int needed = from.kind().integerDigits();
            if (to.precision() == null) {
                return Lossiness.NONE;
            }
            int available = to.precision() - (to.scale() == null ? 0 : to.scale());
            return available >= needed
                    ? Lossiness.NONE
                    : Lossiness.lossy(from.kind() + " needs " + needed + " integer digits, "
                    + to.signature() + " has " + available);
        }
        if (target == FLOAT64) {
            return from.kind() == INTEGER64
                    ? Lossiness.lossy("INTEGER64 values beyond 2^53 are not exact in FLOAT64")
                    : Lossiness.NONE;
        }
        if (target == FLOAT32) {
            return from.kind() == INTEGER16
                    ? Lossiness.NONE
                    : Lossiness.lossy(from.kind() + " values beyond 2^24 are not exact in FLOAT32");
        }
        if (target == BOOLEAN) {
            return Lossiness.lossy(from.kind() + " collapsed to BOOLEAN");
        }
        return Lossiness.lossy("no lossless conversion from " + from.signature() + " to " + to.signature());
    }

    private static Lossiness fromDecimal(CanonicalType from, CanonicalType to) {
        TypeKind target = to.kind();
        if (target.isFloatingPoint()) {
            return Lossiness.lossy("exact " + from.signature() + " becomes approximate " + target);
        }
        if (target.isInteger()) {
            if (from.precision() == null || (from.scale() != null && from.scale() > 0)) {
                return Lossiness.lossy("fractional digits of " + from.signature() + " dropped in " + target);
            }
            return from.precision() < target.integerDigits()
                    ? Lossiness.NONE
                    : Lossiness.lossy(from.signature() + " may overflow " + target);
        }
        return Lossiness.lossy("no lossless conversion from " + from.signature() + " to " + to.signature());
    }

    private static Lossiness temporal(CanonicalType from, CanonicalType to) {
        TypeKind source = from.kind();
        TypeKind target = to.kind();
        if (source == DATE && (target == TIMESTAMP || target == TIMESTAMP_TZ)) {
            return Lossiness.NONE;
        }
        if (source == TIMESTAMP_TZ && target == TIMESTAMP) {
            return Lossiness.lossy("time zone offset dropped").and(fractionalSeconds(from, to));
        }
        if (source == TIMESTAMP && target == TIMESTAMP_TZ) {
            return fractionalSeconds(from, to);
        }
        if ((source == TIMESTAMP || source == TIMESTAMP_TZ) && target == DATE) {
            return Lossiness.lossy("time of day dropped");
        }
        return Lossiness.lossy("no lossless conversion from " + from.signature() + " to " + to.signature());
    }
}
