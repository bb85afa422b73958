package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Elapsed-time budget: access for {@code duration_seconds} after first use.
 *
 * <pre>
 * "time_limit": { "duration_seconds": 3600 }
 * </pre>
 *
 * <h3>State</h3>
 * <p>
 * {@code {first_used_at, expires_at, last_used_at}} in epoch seconds.
 * {@code expires_at} is fixed when the state is initialized; later requests
 * only move {@code last_used_at}. Once the clock passes {@code expires_at}
 * every request yields nothing.
 * </p>
 */
public class TimeLimitRule extends AbstractObserverRule implements StatefulObserverRule {

    public static final String NAME = "time_limit";

    /** Applied when the config lacks a duration. */
    static final long DEFAULT_DURATION_SECONDS = 300;

    private static final Pattern INTEGER_TEXT = Pattern.compile("^-?\\d+$");

    private final Clock clock;

    public TimeLimitRule() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the current instant; must not be {@code null}
     */
    public TimeLimitRule(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public GeoObjectQuery applyToQuery(GeoObjectQuery query, RuleConfig config) {
        if (isExpired(config)) {
            return query.andWhere(Criterion.none());
        }
        return query;
    }

    @Override
    public List<GeoObject> applyToObjects(List<GeoObject> objects, RuleConfig config) {
        if (isExpired(config)) {
            return List.of();
        }
        return objects;
    }

    @Override
    public ObjectNode initializeState(RuleConfig config) {
        long now = now();
        long duration = config.parameter("duration_seconds")
                .map(JsonNode::asLong)
                .orElse(DEFAULT_DURATION_SECONDS);

        ObjectNode state = JsonNodeFactory.instance.objectNode();
        state.put("first_used_at", now);
        state.put("expires_at", now + duration);
        state.putNull("last_used_at");
        return state;
    }

    @Override
    public ObjectNode updateState(RuleConfig config) {
        ObjectNode state = config.getState().orElseGet(() -> initializeState(config));
        state.put("last_used_at", now());
        return state;
    }

    /**
     * A slice without state has not started its budget yet and is not
     * expired. {@code expires_at} may be stored as an integer or as an
     * integer string, the two forms the schema accepts.
     */
    boolean isExpired(RuleConfig config) {
        return config.getState()
                .map(state -> state.get("expires_at"))
                .flatMap(TimeLimitRule::epochSeconds)
                .map(expiresAt -> now() > expiresAt)
                .orElse(false);
    }

    private static Optional<Long> epochSeconds(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isNumber() && node.canConvertToLong()) {
            return Optional.of(node.asLong());
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (INTEGER_TEXT.matcher(text).matches() && text.length() < 19) {
                return Optional.of(Long.parseLong(text));
            }
        }
        return Optional.empty();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
