package com.mapobserver.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.config.EngineConfig;
import com.mapobserver.core.config.RuleConfigurationLoader;
import com.mapobserver.core.engine.ObserverRuleEngine;
import com.mapobserver.core.engine.StatePersistenceException;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.Observer;
import com.mapobserver.core.model.RuleConfiguration;
import com.mapobserver.core.rule.RuleRegistry;
import com.mapobserver.core.validation.RuleConfigValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of {@link ObserverRuleEngine} over the in-memory store.
 */
class ObserverRuleEngineEndToEndTest {

    private static final Instant NOON = Instant.parse("2024-06-01T12:00:00Z");
    private static final long MAP_ID = 10;
    private static final long OBSERVER_ID = 1;

    private InMemoryObserverStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryObserverStore();
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Should return every active object of the map when no rules are configured")
        void shouldReturnDefaultForEmptyConfiguration() {
            ObserverRuleEngine engine = engineAt(NOON);

            assertThat(engine.getFilteredObjects(observer("{}"))).isEqualTo(defaultObjects());
            assertThat(engine.getFilteredObjects(new Observer(OBSERVER_ID, "watcher", MAP_ID, null)))
                    .isEqualTo(defaultObjects());
        }

        @Test
        @DisplayName("Should return the default result for a malformed rule name")
        void shouldReturnDefaultForMalformedName() {
            List<GeoObject> result = engineAt(NOON).getFilteredObjects(observer("{\"1bad\": [1], \"ObjectIdRule\": [1]}"));

            assertThat(result).isEqualTo(defaultObjects());
        }

        @Test
        @DisplayName("Should return the default result for a schema violation")
        void shouldReturnDefaultForSchemaViolation() {
            List<GeoObject> result = engineAt(NOON).getFilteredObjects(observer("{\"ObjectIdRule\": [0, 0]}"));

            assertThat(result).isEqualTo(defaultObjects());
        }
    }

    @Test
    @DisplayName("Should apply the valid rule next to an unknown one")
    void shouldSkipUnknownRule() {
        List<GeoObject> result = engineAt(NOON).getFilteredObjects(
                observer("{\"no_such_rule\": {}, \"ObjectIdRule\": [2, 3]}"));

        assertThat(result).extracting(GeoObject::getId).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Should combine allow-lists on ids and sides")
    void shouldCombineAllowLists() {
        List<GeoObject> result = engineAt(NOON).getFilteredObjects(
                observer("{\"SideIdRule\": [100], \"ObjectIdRule\": [1, 3, 4]}"));

        assertThat(result).extracting(GeoObject::getId).containsExactly(1L);
    }

    @Nested
    @DisplayName("Request-count budget")
    class RequestBudget {

        @Test
        @DisplayName("Should serve two requests with limit 2 and block the third")
        void shouldExhaustAfterLimit() {
            ObserverRuleEngine engine = engineAt(NOON);
            save(observer("{\"request_limit\": {\"limit\": 2}}"));

            List<GeoObject> first = engine.getFilteredObjects(load());
            long afterFirst = remaining();
            List<GeoObject> second = engine.getFilteredObjects(load());
            long afterSecond = remaining();
            List<GeoObject> third = engine.getFilteredObjects(load());

            assertThat(first).isEqualTo(defaultObjects());
            assertThat(afterFirst).isEqualTo(1);
            assertThat(second).isEqualTo(defaultObjects());
            assertThat(afterSecond).isZero();
            assertThat(third).isEmpty();
            assertThat(remaining()).isZero();
        }

        private long remaining() {
            return state("request_limit").get("remaining").asLong();
        }
    }

    @Nested
    @DisplayName("Elapsed-time budget")
    class TimeBudget {

        @Test
        @DisplayName("Should serve a request one second before expiry")
        void shouldServeBeforeExpiry() {
            save(observer(timeLimit(NOON.getEpochSecond() + 1)));

            List<GeoObject> result = engineAt(NOON).getFilteredObjects(load());

            assertThat(result).isEqualTo(defaultObjects());
            assertThat(state("time_limit").get("last_used_at").asLong()).isEqualTo(NOON.getEpochSecond());
        }

        @Test
        @DisplayName("Should block a request one second after expiry")
        void shouldBlockAfterExpiry() {
            save(observer(timeLimit(NOON.getEpochSecond() - 1)));

            List<GeoObject> result = engineAt(NOON).getFilteredObjects(load());

            assertThat(result).isEmpty();
            assertThat(state("time_limit").get("last_used_at").asLong()).isEqualTo(NOON.getEpochSecond());
        }

        @Test
        @DisplayName("Should block after expiry when the stored state holds integer strings")
        void shouldBlockAfterExpiryWithTextualState() {
            long expiresAt = NOON.getEpochSecond() - 1;
            save(observer("{\"time_limit\": {\"duration_seconds\": 60, \"_state\": {\"first_used_at\": \""
                    + (expiresAt - 60) + "\", \"expires_at\": \"" + expiresAt + "\"}}}"));

            assertThat(engineAt(NOON).getFilteredObjects(load())).isEmpty();
            assertThat(engineAt(NOON.plusSeconds(3600)).getFilteredObjects(load())).isEmpty();
            assertThat(state("time_limit").get("last_used_at").asLong()).isEqualTo(NOON.getEpochSecond() + 3600);
        }

        @Test
        @DisplayName("Should start the budget on first use")
        void shouldInitializeOnFirstUse() {
            save(observer("{\"time_limit\": {\"duration_seconds\": 60}}"));

            engineAt(NOON).getFilteredObjects(load());

            ObjectNode state = state("time_limit");
            assertThat(state.get("first_used_at").asLong()).isEqualTo(NOON.getEpochSecond());
            assertThat(state.get("expires_at").asLong()).isEqualTo(NOON.getEpochSecond() + 60);
        }

        private String timeLimit(long expiresAt) {
            return "{\"time_limit\": {\"duration_seconds\": 60, \"_state\": {\"first_used_at\": "
                    + (expiresAt - 60) + ", \"expires_at\": " + expiresAt + ", \"last_used_at\": null}}}";
        }
    }

    @Test
    @DisplayName("Should honour a window that spans midnight")
    void shouldHandleMidnightWindow() {
        String night = "{\"time_range\": {\"start_time\": \"22:00\", \"end_time\": \"06:00\"}}";

        assertThat(engineAt(Instant.parse("2024-06-01T23:30:00Z")).getFilteredObjects(observer(night))).isNotEmpty();
        assertThat(engineAt(Instant.parse("2024-06-01T02:00:00Z")).getFilteredObjects(observer(night))).isNotEmpty();
        assertThat(engineAt(NOON).getFilteredObjects(observer(night))).isEmpty();
    }

    @Test
    @DisplayName("Stateless rules should be idempotent, stateful rules should not")
    void shouldDistinguishIdempotentRules() {
        ObserverRuleEngine engine = engineAt(NOON);
        Observer stateless = observer("{\"ObjectIdRule\": [1, 2]}");

        assertThat(engine.getFilteredObjects(stateless)).isEqualTo(engine.getFilteredObjects(stateless));

        save(observer("{\"request_limit\": {\"limit\": 1}}"));
        List<GeoObject> first = engine.getFilteredObjects(load());
        List<GeoObject> second = engine.getFilteredObjects(load());

        assertThat(first).isNotEmpty();
        assertThat(second).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Should roll back and surface a concurrent update of the same observer")
    void shouldSurfaceConcurrentUpdate() {
        InMemoryObserverStore racing = new InMemoryObserverStore() {
            @Override
            public void refresh(Observer observer) {
                super.refresh(observer);
                // Another writer commits between refresh and commit
                save(find(observer.getId()).orElseThrow());
            }
        };
        store = racing;
        save(observer("{\"request_limit\": {\"limit\": 2}}"));

        assertThatThrownBy(() -> engineAt(NOON).getFilteredObjects(load()))
                .isInstanceOf(StatePersistenceException.class)
                .hasCauseInstanceOf(ConcurrentUpdateException.class);
        assertThat(racing.isTransactionActive()).isFalse();
        assertThat(racing.findRules(OBSERVER_ID).orElseThrow().get("request_limit").orElseThrow().hasState())
                .isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ObserverRuleEngine engineAt(Instant instant) {
        Clock clock = Clock.fixed(instant, ZoneOffset.UTC);
        InMemoryGeoObjectRepository repository = InMemoryGeoObjectRepository.fromClasspath("geo-objects.json", clock);
        RuleConfigValidator validator = new RuleConfigValidator();
        RuleRegistry registry = RuleRegistry.builtIn(EngineConfig.defaults(), clock, validator);
        return new ObserverRuleEngine(repository, store, registry, validator);
    }

    private static List<GeoObject> defaultObjects() {
        Clock clock = Clock.fixed(NOON, ZoneOffset.UTC);
        return InMemoryGeoObjectRepository.fromClasspath("geo-objects.json", clock).findActiveByMap(MAP_ID);
    }

    private static Observer observer(String rules) {
        RuleConfiguration configuration = RuleConfigurationLoader.fromJson(rules);
        return new Observer(OBSERVER_ID, "watcher", MAP_ID, configuration);
    }

    private void save(Observer observer) {
        store.save(observer);
    }

    private Observer load() {
        return store.find(OBSERVER_ID).orElseThrow();
    }

    private ObjectNode state(String ruleName) {
        return store.findRules(OBSERVER_ID).orElseThrow()
                .get(ruleName).orElseThrow()
                .getState().orElseThrow();
    }
}
