package com.mapobserver.core.spi;

import java.util.Objects;
import java.util.Optional;

/**
 * A typed predicate contributed to a {@link GeoObjectQuery}.
 *
 * <p>
 * Criteria that compare against values refer to them through a named
 * parameter, bound separately with
 * {@link GeoObjectQuery#setParameter(String, Object)}. {@link #toString()}
 * renders the criterion in query-language form, e.g.
 * {@code g.id IN (:allowedIds)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Criterion {

    /** The supported predicate shapes. */
    public enum Kind {
        /** Object belongs to the map bound to the parameter. */
        MAP_IS,
        /** Object is flagged active and not expired. */
        ACTIVE,
        /** Object id is contained in the collection bound to the parameter. */
        ID_IN,
        /** Owning side id is contained in the collection bound to the parameter. */
        SIDE_ID_IN,
        /** Always false. */
        NONE
    }

    private static final Criterion ACTIVE = new Criterion(Kind.ACTIVE, null);
    private static final Criterion NONE = new Criterion(Kind.NONE, null);

    private final Kind kind;
    private final String parameter;

    private Criterion(Kind kind, String parameter) {
        this.kind = kind;
        this.parameter = parameter;
    }

    public static Criterion mapIs(String parameter) {
        return new Criterion(Kind.MAP_IS, requireParameter(parameter));
    }

    public static Criterion active() {
        return ACTIVE;
    }

    public static Criterion idIn(String parameter) {
        return new Criterion(Kind.ID_IN, requireParameter(parameter));
    }

    /**
     * Restrict to objects owned by one of the bound sides. Implies a join to
     * the side relation; objects without a side never match.
     *
     * @param parameter name of the parameter holding the side ids
     * @return the criterion
     */
    public static Criterion sideIdIn(String parameter) {
        return new Criterion(Kind.SIDE_ID_IN, requireParameter(parameter));
    }

    public static Criterion none() {
        return NONE;
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<String> getParameter() {
        return Optional.ofNullable(parameter);
    }

    private static String requireParameter(String parameter) {
        Objects.requireNonNull(parameter, "Parameter name must not be null");
        if (parameter.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        return parameter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Criterion that))
            return false;
        return kind == that.kind && Objects.equals(parameter, that.parameter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parameter);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case MAP_IS -> "g.map = :" + parameter;
            case ACTIVE -> "g.isActive = true";
            case ID_IN -> "g.id IN (:" + parameter + ")";
            case SIDE_ID_IN -> "s.id IN (:" + parameter + ")";
            case NONE -> "1 = 0";
        };
    }
}
