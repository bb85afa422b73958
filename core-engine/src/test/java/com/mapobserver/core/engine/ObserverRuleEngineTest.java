package com.mapobserver.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.config.EngineConfig;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.Observer;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.model.RuleConfiguration;
import com.mapobserver.core.rule.AbstractObserverRule;
import com.mapobserver.core.rule.ObjectIdRule;
import com.mapobserver.core.rule.ObserverRule;
import com.mapobserver.core.rule.RequestLimitRule;
import com.mapobserver.core.rule.RuleRegistry;
import com.mapobserver.core.rule.StatefulObserverRule;
import com.mapobserver.core.rule.TimeRangeRule;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;
import com.mapobserver.core.spi.GeoObjectSource;
import com.mapobserver.core.spi.RecordingQuery;
import com.mapobserver.core.validation.RuleConfigValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ObserverRuleEngine}.
 */
class ObserverRuleEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);
    private static final long MAP_ID = 42;

    private static final List<GeoObject> ACTIVE = List.of(object(1), object(2), object(3));
    private static final List<GeoObject> QUERY_RESULT = List.of(object(1), object(2), object(3), object(4));

    private FakeObjectSource source;
    private FakeObserverStore store;
    private CountingValidator validator;
    private ObserverRuleEngine engine;

    @BeforeEach
    void setUp() {
        source = new FakeObjectSource();
        store = new FakeObserverStore();
        validator = new CountingValidator();
        engine = engineWith(EngineConfig.defaults(),
                new TimeRangeRule(CLOCK, ZoneOffset.UTC),
                new RequestLimitRule(CLOCK),
                new ObjectIdRule());
    }

    @Test
    @DisplayName("Should return the default objects without touching rules when nothing is configured")
    void shouldFallBackWhenNoRules() {
        List<GeoObject> result = engine.getFilteredObjects(observer(RuleConfiguration.empty()));

        assertThat(result).isEqualTo(ACTIVE);
        assertThat(validator.calls).isZero();
        assertThat(source.queries).isEmpty();
        assertThat(store.calls).isEmpty();
    }

    @Test
    @DisplayName("Should return the default objects for a malformed rule name")
    void shouldFallBackOnStructuralError() {
        List<GeoObject> result = engine.getFilteredObjects(observer(configuration("{'1bad': [1], 'ObjectIdRule': [1]}")));

        assertThat(result).isEqualTo(ACTIVE);
        assertThat(source.queries).isEmpty();
        assertThat(store.calls).isEmpty();
    }

    @Test
    @DisplayName("Should scope the query to the map and active objects, then add rules by priority")
    void shouldBuildQueryInPriorityOrder() {
        engine.getFilteredObjects(observer(configuration(
                "{'ObjectIdRule': [2, 3], 'time_range': {'start_time': '13:00', 'end_time': '14:00'}}")));

        RecordingQuery query = source.queries.get(0);
        assertThat(query.getCriteria()).containsExactly(
                Criterion.mapIs("map"),
                Criterion.active(),
                Criterion.none(),
                Criterion.idIn("allowedIds"));
        assertThat(query.getParameters()).containsEntry("map", MAP_ID);
        assertThat(query.getExecutions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip an unknown rule and still apply the valid one")
    void shouldSkipUnknownRule() {
        List<GeoObject> result = engine.getFilteredObjects(observer(configuration(
                "{'no_such_rule': {'x': 1}, 'ObjectIdRule': [2]}")));

        assertThat(result).extracting(GeoObject::getId).containsExactly(2L);
    }

    @Test
    @DisplayName("Should skip a rule whose slice violates its schema")
    void shouldSkipInvalidSlice() {
        List<GeoObject> result = engine.getFilteredObjects(observer(configuration(
                "{'ObjectIdRule': [2, 2], 'time_range': {'start_time': '00:00', 'end_time': '23:59'}}")));

        assertThat(result).isEqualTo(QUERY_RESULT);
        assertThat(source.queries.get(0).getCriteria()).doesNotContain(Criterion.idIn("allowedIds"));
    }

    @Test
    @DisplayName("Should initialize, advance and persist budget state")
    void shouldPersistStateChanges() {
        Observer observer = observer(configuration("{'request_limit': {'limit': 2}}"));
        store.stored.put(observer.getId(), observer.getRules());

        List<GeoObject> result = engine.getFilteredObjects(observer);

        assertThat(result).isEqualTo(QUERY_RESULT);
        assertThat(store.calls).containsExactly("begin", "refresh", "replace", "commit");
        ObjectNode state = store.stored.get(observer.getId()).get("request_limit").orElseThrow()
                .getState().orElseThrow();
        assertThat(state.get("remaining").asInt()).isEqualTo(1);
        assertThat(state.get("last_used_at").asLong()).isEqualTo(CLOCK.instant().getEpochSecond());
        assertThat(observer.getRules()).isEqualTo(store.stored.get(observer.getId()));
    }

    @Test
    @DisplayName("Should not write state for a slice that fails validation")
    void shouldDiscardStateOfInvalidSlice() {
        Observer observer = observer(configuration("{'request_limit': {'limit': 0}}"));

        engine.getFilteredObjects(observer);

        assertThat(store.calls).isEmpty();
    }

    @Test
    @DisplayName("Should not bring back a rule removed before the state was written")
    void shouldApplyStateOntoRefreshedConfiguration() {
        Observer observer = observer(configuration("{'request_limit': {'limit': 2}, 'ObjectIdRule': [1]}"));
        store.stored.put(observer.getId(), configuration("{'ObjectIdRule': [1]}"));

        engine.getFilteredObjects(observer);

        assertThat(store.stored.get(observer.getId()).getRuleNames()).containsExactly("ObjectIdRule");
    }

    @Test
    @DisplayName("Should roll back and rethrow when state cannot be persisted")
    void shouldRollBackOnPersistenceFailure() {
        Observer observer = observer(configuration("{'request_limit': {'limit': 2}}"));
        store.stored.put(observer.getId(), observer.getRules());
        store.failOnCommit = new IllegalStateException("disk full");
        store.failOnRollback = new IllegalStateException("connection lost");

        assertThatThrownBy(() -> engine.getFilteredObjects(observer))
                .isInstanceOf(StatePersistenceException.class)
                .hasMessageContaining("observer 7")
                .cause()
                .hasMessage("disk full")
                .satisfies(cause -> assertThat(cause.getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("connection lost"));
        assertThat(store.calls).containsExactly("begin", "refresh", "replace", "commit", "rollback");
        assertThat(source.queries).isEmpty();
    }

    @Test
    @DisplayName("Should skip a rule that throws and keep the others")
    void shouldIsolateFailingRule() {
        ObserverRuleEngine isolating = engineWith(EngineConfig.defaults(), new ExplodingRule(), new ObjectIdRule());

        List<GeoObject> result = isolating.getFilteredObjects(observer(configuration(
                "{'ExplodingRule': {}, 'ObjectIdRule': [3]}")));

        assertThat(result).extracting(GeoObject::getId).containsExactly(3L);
        assertThat(store.calls).isEmpty();
    }

    @Test
    @DisplayName("Should fall back on unknown rules in strict mode")
    void shouldFallBackOnUnknownRuleInStrictMode() {
        ObserverRuleEngine strict = engineWith(new EngineConfig.Builder().strictValidation(true).build(),
                new ObjectIdRule());

        List<GeoObject> strictResult = strict.getFilteredObjects(observer(configuration(
                "{'no_such_rule': {}, 'ObjectIdRule': [2]}")));
        List<GeoObject> validResult = strict.getFilteredObjects(observer(configuration("{'ObjectIdRule': [2]}")));

        assertThat(strictResult).isEqualTo(ACTIVE);
        assertThat(validResult).extracting(GeoObject::getId).containsExactly(2L);
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        List<GeoObject> result = engine.getFilteredObjects(observer(configuration("{'ObjectIdRule': [1]}")));

        assertThatThrownBy(() -> result.add(object(9)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ObserverRuleEngine engineWith(EngineConfig config, ObserverRule... rules) {
        RuleRegistry registry = new RuleRegistry(List.of(rules), validator);
        return new ObserverRuleEngine(source, store, registry, validator, config);
    }

    private static Observer observer(RuleConfiguration rules) {
        return new Observer(7, "night-watch", MAP_ID, rules);
    }

    private static GeoObject object(long id) {
        return GeoObject.builder().id(id).mapId(MAP_ID).build();
    }

    private static RuleConfiguration configuration(String json) {
        try {
            return RuleConfiguration.fromJson(MAPPER.readTree(json.replace('\'', '"')));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /** Serves {@link #ACTIVE} by default and {@link #QUERY_RESULT} from queries. */
    private static final class FakeObjectSource implements GeoObjectSource {

        final List<RecordingQuery> queries = new ArrayList<>();

        @Override
        public GeoObjectQuery createQuery() {
            RecordingQuery query = new RecordingQuery(QUERY_RESULT);
            queries.add(query);
            return query;
        }

        @Override
        public List<GeoObject> findActiveByMap(long mapId) {
            return ACTIVE;
        }
    }

    private static final class CountingValidator extends RuleConfigValidator {

        int calls;

        @Override
        public List<String> validate(JsonNode configuration, JsonNode schema) {
            calls++;
            return super.validate(configuration, schema);
        }

        @Override
        public List<String> validateStructure(JsonNode configuration) {
            calls++;
            return super.validateStructure(configuration);
        }

        @Override
        public List<String> validateRule(String ruleName, JsonNode ruleConfiguration, JsonNode ruleSchema) {
            calls++;
            return super.validateRule(ruleName, ruleConfiguration, ruleSchema);
        }
    }

    private static final class ExplodingRule extends AbstractObserverRule implements StatefulObserverRule {

        @Override
        public JsonNode getConfigSchema() {
            return MAPPER.createObjectNode();
        }

        @Override
        public ObjectNode initializeState(RuleConfig config) {
            throw new IllegalStateException("boom");
        }

        @Override
        public ObjectNode updateState(RuleConfig config) {
            throw new IllegalStateException("boom");
        }
    }
}
