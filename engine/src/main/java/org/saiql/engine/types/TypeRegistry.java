package org.saiql.engine.types;

import org.saiql.engine.DialectId;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical type registry shared by the code generator and the migration
 * planner.
 *
 * <p>Every mapping goes source signature &rarr; canonical type &rarr; target
 * signature, with lossiness decided by {@link TypeConversions}. Instances are
 * immutable and safe to share.
 */
public final class TypeRegistry {

    private static final TypeRegistry STANDARD = new TypeRegistry(DialectTypeSystems.standard());

    private final Map<DialectId, DialectTypeSystem> systems;

    public TypeRegistry(Map<DialectId, DialectTypeSystem> systems) {
        Objects.requireNonNull(systems, "Type systems cannot be null");
        EnumMap<DialectId, DialectTypeSystem> copy = new EnumMap<>(DialectId.class);
        copy.putAll(systems);
        this.systems = copy;
    }

    /**
     * Registry with the built-in vocabularies of every {@link DialectId}.
     */
    public static TypeRegistry standard() {
        return STANDARD;
    }

    public DialectTypeSystem typeSystem(DialectId dialect) {
        DialectTypeSystem system = systems.get(dialect);
        if (system == null) {
            throw new TypeMappingException(dialect, "*", "No type system registered for " + dialect);
        }
        return system;
    }

    /**
     * Reads a backend type signature into its canonical type.
     */
    public CanonicalType parse(DialectId dialect, String signature) {
        return typeSystem(dialect).parse(signature);
    }

    /**
     * Maps a canonical type onto a target dialect.
     *
     * @throws TypeMappingException when the target has no type for it
     */
    public TypeMapping toTarget(CanonicalType canonical, DialectId target) {
        DialectTypeSystem.RenderedType rendered = typeSystem(target).render(canonical);
        Lossiness lossiness = TypeConversions.check(canonical, rendered.held());
        if (rendered.note() != null) {
            lossiness = lossiness.and(Lossiness.lossy(rendered.note()));
        }
        return new TypeMapping(null, canonical.signature(), canonical, target,
                rendered.signature(), rendered.held(), lossiness.lossy(), lossiness.reason());
    }

    /**
     * Maps a source column type onto the target dialect's closest type.
     */
    public TypeMapping mapType(DialectId source, String sourceSignature, DialectId target) {
        CanonicalType canonical = parse(source, sourceSignature);
        TypeMapping mapping = toTarget(canonical, target);
        return new TypeMapping(source, sourceSignature, canonical, target, mapping.targetSignature(),
                mapping.targetCanonical(), mapping.lossy(), mapping.reason());
    }

    /**
     * Maps a source column type onto an explicitly chosen target type.
     */
    public TypeMapping mapType(DialectId source, String sourceSignature, DialectId target, String targetSignature) {
        CanonicalType canonical = parse(source, sourceSignature);
        CanonicalType targetCanonical = parse(target, targetSignature);
        Lossiness lossiness = TypeConversions.check(canonical, targetCanonical);
        return new TypeMapping(source, sourceSignature, canonical, target, targetSignature,
                targetCanonical, lossiness.lossy(), lossiness.reason());
    }

    /**
     * Lossiness of moving a value between two canonical types.
     */
    public Lossiness conversion(CanonicalType from, CanonicalType to) {
        return TypeConversions.check(from, to);
    }

    public boolean isRepresentable(CanonicalType type, DialectId target) {
        return typeSystem(target).canRepresent(type.kind());
    }
}
