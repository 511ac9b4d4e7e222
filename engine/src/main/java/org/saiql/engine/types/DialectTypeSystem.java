package org.saiql.engine.types;

import org.saiql.engine.DialectId;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The type vocabulary of one backend.
 *
 * <p>Source rules read a backend type signature into a {@link CanonicalType};
 * target rules render a canonical type as the backend type that holds it.
 * Keeping both directions per dialect means N dialects need N tables, not
 * N&times;N.
 */
public final class DialectTypeSystem {

    private static final Pattern PARAMS = Pattern.compile("\\(\\s*(\\d+|max)\\s*(?:,\\s*(-?\\d+)\\s*)?\\)");

    /**
     * How a source rule obtains type parameters.
     */
    public enum ParamRule {
        /** Parameters are ignored. */
        NONE,
        /** Parameters are read from the signature. */
        EXTRACT,
        /** Parameters are fixed by the type name. */
        FIXED
    }

    /**
     * Reads one backend type name.
     *
     * @param kind       canonical kind
     * @param paramRule  how parameters are obtained
     * @param precision  fixed precision (DECIMAL, temporal) for {@link ParamRule#FIXED}
     * @param scale      fixed scale for {@link ParamRule#FIXED}
     */
    public record SourceRule(TypeKind kind, ParamRule paramRule, Integer precision, Integer scale) {
        public SourceRule {
            Objects.requireNonNull(kind, "Kind cannot be null");
            Objects.requireNonNull(paramRule, "Param rule cannot be null");
        }
    }

    /**
     * Renders one canonical kind.
     *
     * @param name           backend type name
     * @param heldAs         canonical kind the backend type actually holds
     * @param rendersParams  whether the canonical parameters are written after the name
     * @param maxParam       largest precision or length the backend accepts, or null
     * @param maxScale       largest DECIMAL scale, or null
     * @param fixedPrecision fractional-second digits the backend type always has, or null
     * @param unboundedName  name used when the canonical type has no length/precision, or null
     * @param overflow       rule used when the parameter exceeds {@code maxParam}; null clamps
     * @param note           backend behaviour that makes every mapping onto this rule lossy, or null
     */
    public record TargetRule(String name, TypeKind heldAs, boolean rendersParams, Integer maxParam, Integer maxScale,
                             Integer fixedPrecision, String unboundedName, TargetRule overflow, String note) {
        public TargetRule {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(heldAs, "Held-as kind cannot be null");
        }

        public static TargetRule plain(String name, TypeKind heldAs) {
            return new TargetRule(name, heldAs, false, null, null, null, null, null, null);
        }

        public static TargetRule parameterized(String name, TypeKind heldAs, Integer maxParam) {
            return new TargetRule(name, heldAs, true, maxParam, null, null, null, null, null);
        }

        public TargetRule withMaxScale(int value) {
            return new TargetRule(name, heldAs, rendersParams, maxParam, value, fixedPrecision, unboundedName, overflow, note);
        }

        public TargetRule withFixedPrecision(int value) {
            return new TargetRule(name, heldAs, rendersParams, maxParam, maxScale, value, unboundedName, overflow, note);
        }

        public TargetRule withUnboundedName(String value) {
            return new TargetRule(name, heldAs, rendersParams, maxParam, maxScale, fixedPrecision, value, overflow, note);
        }

        public TargetRule withOverflow(TargetRule value) {
            return new TargetRule(name, heldAs, rendersParams, maxParam, maxScale, fixedPrecision, unboundedName, value, note);
        }

        public TargetRule withNote(String value) {
            return new TargetRule(name, heldAs, rendersParams, maxParam, maxScale, fixedPrecision, unboundedName, overflow, value);
        }
    }

    /**
     * A canonical type rendered for this backend.
     *
     * @param signature DDL type signature
     * @param held      canonical type the backend column really holds
     * @param note      backend-specific loss, or null
     */
    public record RenderedType(String signature, CanonicalType held, String note) {
    }

    private final DialectId dialect;
    private final Map<String, SourceRule> sourceRules;
    private final Map<TypeKind, TargetRule> targetRules;

    private DialectTypeSystem(DialectId dialect, Map<String, SourceRule> sourceRules,
                              Map<TypeKind, TargetRule> targetRules) {
        this.dialect = dialect;
        this.sourceRules = Map.copyOf(sourceRules);
        this.targetRules = Map.copyOf(targetRules);
    }

    public static Builder builder(DialectId dialect) {
        return new Builder(dialect);
    }

    public DialectId dialect() {
        return dialect;
    }

    /**
     * Reads a backend type signature such as {@code numeric(20,4)},
     * {@code character varying(40)} or {@code timestamp(3) with time zone}.
     *
     * @throws TypeMappingException when no rule matches
     */
    public CanonicalType parse(String signature) {
        Objects.requireNonNull(signature, "Signature cannot be null");
        String normalized = signature.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        SourceRule exact = sourceRules.get(normalized.replace(" ", ""));
        if (exact != null && normalized.contains("(")) {
            return build(exact, null, null, signature);
        }

        Integer first = null;
        Integer second = null;
        Matcher matcher = PARAMS.matcher(normalized);
        String name = normalized;
        if (matcher.find()) {
            first = "max".equals(matcher.group(1)) ? null : Integer.valueOf(matcher.group(1));
            second = matcher.group(2) == null ? null : Integer.valueOf(matcher.group(2));
            name = (normalized.substring(0, matcher.start()) + " " + normalized.substring(matcher.end()))
                    .trim().replaceAll("\\s+", " ");
        }

        SourceRule rule = lookup(name)
                .orElseThrow(() -> new TypeMappingException(dialect, signature,
                        "Unsupported " + dialect.displayName() + " type '" + signature + "'"));
        return build(rule, first, second, signature);
    }

    private Optional<SourceRule> lookup(String name) {
        SourceRule rule = sourceRules.get(name);
        if (rule == null) {
            int space = name.indexOf(' ');
            if (space > 0) {
                // Trailing modifiers such as "unsigned" or "not null"
                rule = sourceRules.get(name.substring(0, space));
            }
        }
        return Optional.ofNullable(rule);
    }

    private CanonicalType build(SourceRule rule, Integer first, Integer second, String signature) {
        TypeKind kind = rule.kind();
        try {
            if (rule.paramRule() == ParamRule.FIXED) {
                return new CanonicalType(kind, rule.precision(), rule.scale(), null, true);
            }
            if (rule.paramRule() == ParamRule.NONE || first == null) {
                return CanonicalType.of(kind);
            }
            return switch (kind.params()) {
                case PRECISION_SCALE -> new CanonicalType(kind, first, second == null ? 0 : second, null, true);
                case LENGTH -> new CanonicalType(kind, null, null, first, true);
                case PRECISION -> new CanonicalType(kind, first, null, null, true);
                case NONE -> CanonicalType.of(kind);
            };
        } catch (IllegalArgumentException e) {
            throw new TypeMappingException(dialect, signature,
                    "Invalid " + dialect.displayName() + " type '" + signature + "': " + e.getMessage());
        }
    }

    public boolean canRepresent(TypeKind kind) {
        return targetRules.containsKey(kind) || (kind == TypeKind.VARCHAR && targetRules.containsKey(TypeKind.TEXT));
    }

    /**
     * Renders a canonical type for this backend.
     *
     * @throws TypeMappingException when the backend has no type for the kind
     */
    public RenderedType render(CanonicalType type) {
        CanonicalType effective = type;
        if (type.kind() == TypeKind.VARCHAR && type.length() == null) {
            effective = CanonicalType.of(TypeKind.TEXT).withNullable(type.nullable());
        }
        TargetRule rule = targetRules.get(effective.kind());
        if (rule == null) {
            throw new TypeMappingException(dialect, type.signature(),
                    "No " + dialect.displayName() + " type for " + type.signature());
        }
        return render(rule, effective);
    }

    private RenderedType render(TargetRule rule, CanonicalType type) {
        Integer param = switch (type.kind().params()) {
            case PRECISION_SCALE, PRECISION -> type.precision();
            case LENGTH -> type.length();
            case NONE -> null;
        };
        if (rule.overflow() != null && rule.maxParam() != null && (param == null || param > rule.maxParam())) {
            return render(rule.overflow(), type);
        }

        if (param == null && rule.rendersParams() && rule.unboundedName() == null && rule.maxParam() != null) {
            // No unbounded form: use the widest the backend allows
            param = rule.maxParam();
        }

        TypeKind held = rule.heldAs();
        CanonicalType heldType;
        String signature;
        if (rule.fixedPrecision() != null) {
            heldType = new CanonicalType(held, rule.fixedPrecision(), null, null, type.nullable());
            signature = rule.name();
        } else if (!rule.rendersParams() || held.params() == TypeKind.Params.NONE) {
            heldType = CanonicalType.of(held).withNullable(type.nullable());
            signature = rule.name();
        } else if (param == null) {
            heldType = CanonicalType.of(held).withNullable(type.nullable());
            signature = rule.unboundedName() != null ? rule.unboundedName() : rule.name();
        } else {
            int clamped = rule.maxParam() == null ? param : Math.min(param, rule.maxParam());
            switch (held.params()) {
                case PRECISION_SCALE -> {
                    int scale = type.scale() == null ? 0 : type.scale();
                    if (rule.maxScale() != null) {
                        scale = Math.min(scale, rule.maxScale());
                    }
                    scale = Math.min(scale, clamped);
                    heldType = new CanonicalType(held, clamped, scale, null, type.nullable());
                    signature = rule.name() + "(" + clamped + "," + scale + ")";
                }
                case LENGTH -> {
                    heldType = new CanonicalType(held, null, null, clamped, type.nullable());
                    signature = rule.name() + "(" + clamped + ")";
                }
                default -> {
                    heldType = new CanonicalType(held, clamped, null, null, type.nullable());
                    signature = withPrecision(rule.name(), clamped);
                }
            }
        }
        return new RenderedType(signature, heldType, rule.note());
    }

    /**
     * Inserts a precision after the first word: {@code TIMESTAMP WITH TIME ZONE}
     * becomes {@code TIMESTAMP(3) WITH TIME ZONE}.
     */
    private static String withPrecision(String name, int precision) {
        int space = name.indexOf(' ');
        if (space < 0) {
            return name + "(" + precision + ")";
        }
        return name.substring(0, space) + "(" + precision + ")" + name.substring(space);
    }

    public static final class Builder {
        private final DialectId dialect;
        private final Map<String, SourceRule> sourceRules = new LinkedHashMap<>();
        private final Map<TypeKind, TargetRule> targetRules = new EnumMap<>(TypeKind.class);

        private Builder(DialectId dialect) {
            this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        }

        /**
         * Maps backend names to a kind, reading parameters from the signature.
         */
        public Builder read(TypeKind kind, String... names) {
            for (String name : names) {
                sourceRules.put(name, new SourceRule(kind, ParamRule.EXTRACT, null, null));
            }
            return this;
        }

        /**
         * Maps a backend name to a kind with fixed parameters.
         */
        public Builder readFixed(String name, TypeKind kind, Integer precision, Integer scale) {
            sourceRules.put(name, new SourceRule(kind, ParamRule.FIXED, precision, scale));
            return this;
        }

        /**
         * Maps an exact signature, parameters included (e.g. {@code tinyint(1)}).
         */
        public Builder readExact(String signature, TypeKind kind) {
            sourceRules.put(signature.replace(" ", ""), new SourceRule(kind, ParamRule.NONE, null, null));
            return this;
        }

        public Builder write(TypeKind kind, TargetRule rule) {
            targetRules.put(kind, rule);
            return this;
        }

        public Builder write(TypeKind kind, String name) {
            return write(kind, TargetRule.plain(name, kind));
        }

        public DialectTypeSystem build() {
            return new DialectTypeSystem(dialect, sourceRules, targetRules);
        }
    }
}
