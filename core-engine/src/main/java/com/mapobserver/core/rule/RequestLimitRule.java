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

/**
 * Request-count budget: a countdown of remaining requests.
 *
 * <pre>
 * "request_limit": { "limit": 10 }
 * </pre>
 *
 * <h3>State</h3>
 * <p>
 * {@code {remaining, initialized_at, last_used_at}}. Initialization sets
 * {@code remaining} to {@code limit}; every request decrements it, never
 * below zero.
 * </p>
 *
 * <h3>Decision</h3>
 * <p>
 * A request is served when {@code remaining} was positive <em>before</em>
 * its own decrement, read from {@link RuleConfig#getPreviousState()}. The
 * request that brings the counter to zero is still served; the next one is
 * not. A slice with no state at all is treated as exhausted.
 * </p>
 */
public class RequestLimitRule extends AbstractObserverRule implements StatefulObserverRule {

    public static final String NAME = "request_limit";

    /** Applied when the config lacks a limit. */
    static final int DEFAULT_LIMIT = 10;

    private final Clock clock;

    public RequestLimitRule() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the current instant; must not be {@code null}
     */
    public RequestLimitRule(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public GeoObjectQuery applyToQuery(GeoObjectQuery query, RuleConfig config) {
        if (remainingBeforeRequest(config) <= 0) {
            return query.andWhere(Criterion.none());
        }
        return query;
    }

    @Override
    public List<GeoObject> applyToObjects(List<GeoObject> objects, RuleConfig config) {
        if (remainingBeforeRequest(config) <= 0) {
            return List.of();
        }
        return objects;
    }

    @Override
    public ObjectNode initializeState(RuleConfig config) {
        int limit = config.parameter("limit")
                .map(JsonNode::asInt)
                .orElse(DEFAULT_LIMIT);

        ObjectNode state = JsonNodeFactory.instance.objectNode();
        state.put("remaining", limit);
        state.put("initialized_at", now());
        state.putNull("last_used_at");
        return state;
    }

    @Override
    public ObjectNode updateState(RuleConfig config) {
        ObjectNode state = config.getState().orElseGet(() -> initializeState(config));
        long remaining = state.path("remaining").asLong(0);
        state.put("remaining", Math.max(0, remaining - 1));
        state.put("last_used_at", now());
        return state;
    }

    /**
     * Remaining requests as seen before the current request's decrement.
     * Falls back to the current state when the slice did not go through
     * {@link #updateState} in this request.
     */
    long remainingBeforeRequest(RuleConfig config) {
        return config.getPreviousState()
                .or(config::getState)
                .map(state -> state.path("remaining").asLong(0))
                .orElse(0L);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
