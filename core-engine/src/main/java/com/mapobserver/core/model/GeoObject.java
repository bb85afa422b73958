package com.mapobserver.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A geo-tagged object placed on a map.
 *
 * <p>
 * Instances are owned by the surrounding CRUD application. The rule engine
 * only reads them; it never changes their state.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id} and {@code mapId} are required;
 * omitting either throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = GeoObject.Builder.class)
public final class GeoObject {

    private final long id;
    private final long mapId;

    /** Identifier of the owning side, {@code null} for unowned objects. */
    private final Long sideId;

    private final String name;
    private final boolean active;

    /** Instant after which the object is no longer shown, {@code null} = never. */
    private final Instant expiresAt;

    private GeoObject(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.mapId = Objects.requireNonNull(builder.mapId, "mapId must not be null");
        this.sideId = builder.sideId;
        this.name = builder.name;
        this.active = builder.active;
        this.expiresAt = builder.expiresAt;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public long getId() {
        return id;
    }

    public long getMapId() {
        return mapId;
    }

    public Optional<Long> getSideId() {
        return Optional.ofNullable(sideId);
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    /**
     * Whether the object is visible at the given instant: flagged active and
     * not yet expired.
     *
     * @param now the reference instant; must not be {@code null}
     * @return {@code true} if the object is active at {@code now}
     */
    public boolean isActiveAt(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    /**
     * Fluent builder for {@link GeoObject}. Also used by Jackson when objects
     * are read from JSON.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private Long id;
        private Long mapId;
        private Long sideId;
        private String name;
        private boolean active = true;
        private Instant expiresAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder mapId(long mapId) {
            this.mapId = mapId;
            return this;
        }

        public Builder sideId(Long sideId) {
            this.sideId = sideId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        /**
         * Build the object.
         *
         * @return a new {@link GeoObject}
         * @throws NullPointerException if {@code id} or {@code mapId} is missing
         */
        public GeoObject build() {
            return new GeoObject(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GeoObject that))
            return false;
        return id == that.id && mapId == that.mapId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, mapId);
    }

    @Override
    public String toString() {
        return "GeoObject{" +
                "id=" + id +
                ", mapId=" + mapId +
                ", sideId=" + sideId +
                ", name='" + name + '\'' +
                ", active=" + active +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
