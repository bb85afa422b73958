package com.mapobserver.memory;

import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryGeoObjectQuery}.
 */
class InMemoryGeoObjectQueryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryGeoObjectRepository repository;

    @BeforeEach
    void setUp() {
        repository = InMemoryGeoObjectRepository.fromClasspath("geo-objects.json", CLOCK);
    }

    @Test
    @DisplayName("Should combine criteria conjunctively")
    void shouldCombineCriteria() {
        GeoObjectQuery query = repository.createQuery()
                .where(Criterion.mapIs("map"))
                .andWhere(Criterion.active())
                .andWhere(Criterion.sideIdIn("sides"))
                .setParameter("map", 10L)
                .setParameter("sides", Set.of(100L));

        assertThat(query.execute()).extracting(GeoObject::getId).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should filter by id and match nothing for the false criterion")
    void shouldFilterByIdAndNone() {
        GeoObjectQuery byId = repository.createQuery()
                .where(Criterion.idIn("ids"))
                .setParameter("ids", Set.of(3L, 7L));
        GeoObjectQuery none = repository.createQuery()
                .where(Criterion.mapIs("map"))
                .andWhere(Criterion.none())
                .setParameter("map", 10L);

        assertThat(byId.execute()).extracting(GeoObject::getId).containsExactly(3L, 7L);
        assertThat(none.execute()).isEmpty();
    }

    @Test
    @DisplayName("Should replace earlier criteria on where")
    void shouldResetOnWhere() {
        InMemoryGeoObjectQuery query = (InMemoryGeoObjectQuery) repository.createQuery()
                .where(Criterion.none())
                .where(Criterion.active());

        assertThat(query.getCriteria()).containsExactly(Criterion.active());
        assertThat(query).hasToString("SELECT g FROM GeoObject g WHERE g.isActive = true");
    }

    @Test
    @DisplayName("Should fail on unbound or mistyped parameters")
    void shouldRejectUnboundParameter() {
        GeoObjectQuery unbound = repository.createQuery().where(Criterion.mapIs("map"));
        GeoObjectQuery mistyped = repository.createQuery()
                .where(Criterion.mapIs("map"))
                .setParameter("map", "ten");

        assertThatThrownBy(unbound::execute)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Parameter not bound: :map");
        assertThatThrownBy(mistyped::execute)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Expected a number");
    }
}
