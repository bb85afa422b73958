package com.mapobserver.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Configuration slice of a single rule for a single observer.
 *
 * <p>
 * On the wire a slice is one JSON value. For object-shaped slices the
 * reserved key {@value #STATE_KEY} holds state owned by the engine; every
 * other key is a user-authored parameter. This class keeps the two apart:
 * </p>
 * <ul>
 * <li>{@link #getParameters()}: the user-authored part, never containing
 * {@value #STATE_KEY}</li>
 * <li>{@link #getState()}: the engine-managed part, opaque to everything
 * but the owning rule</li>
 * <li>{@link #getPreviousState()}: the state the current invocation started
 * from; lives only for the duration of one call and is never serialized</li>
 * </ul>
 *
 * <p>
 * Instances are immutable. Accessors hand out copies of the underlying
 * Jackson trees.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfig {

    /** Reserved key under which rule state is serialized. */
    public static final String STATE_KEY = "_state";

    private final JsonNode parameters;
    private final ObjectNode state;
    private final ObjectNode previousState;

    private RuleConfig(JsonNode parameters, ObjectNode state, ObjectNode previousState) {
        this.parameters = parameters;
        this.state = state;
        this.previousState = previousState;
    }

    /**
     * Split a raw wire value into parameters and state.
     *
     * <p>
     * A {@value #STATE_KEY} entry is only treated as state when it is a JSON
     * object; any other value stays among the parameters so that schema
     * validation reports it.
     * </p>
     *
     * @param raw the raw slice; must not be {@code null}
     * @return the parsed slice
     */
    public static RuleConfig fromJson(JsonNode raw) {
        Objects.requireNonNull(raw, "Raw rule configuration must not be null");
        if (raw.isObject() && raw.get(STATE_KEY) instanceof ObjectNode stateNode) {
            ObjectNode params = ((ObjectNode) raw).deepCopy();
            params.remove(STATE_KEY);
            return new RuleConfig(params, stateNode.deepCopy(), null);
        }
        return new RuleConfig(raw.deepCopy(), null, null);
    }

    /**
     * Create a stateless slice from user parameters.
     *
     * @param parameters the parameters; must not be {@code null}
     * @return the slice
     */
    public static RuleConfig of(JsonNode parameters) {
        return fromJson(parameters);
    }

    public JsonNode getParameters() {
        return parameters.deepCopy();
    }

    /**
     * Look up a named parameter of an object-shaped slice.
     *
     * @param name parameter name
     * @return the value, or empty if absent, JSON {@code null}, or the slice
     *         is not an object
     */
    public Optional<JsonNode> parameter(String name) {
        JsonNode value = parameters.get(name);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.deepCopy());
    }

    public boolean hasState() {
        return state != null;
    }

    public Optional<ObjectNode> getState() {
        return Optional.ofNullable(state).map(ObjectNode::deepCopy);
    }

    public Optional<ObjectNode> getPreviousState() {
        return Optional.ofNullable(previousState).map(ObjectNode::deepCopy);
    }

    /**
     * Replace the state, keeping parameters and previous state.
     *
     * @param newState the state to hold; must not be {@code null}
     * @return a new slice
     */
    public RuleConfig withState(ObjectNode newState) {
        Objects.requireNonNull(newState, "State must not be null");
        return new RuleConfig(parameters, newState.deepCopy(), previousState);
    }

    /**
     * Move to the next state. The current state becomes the previous state.
     *
     * @param nextState the state produced by this invocation; must not be
     *                  {@code null}
     * @return a new slice
     */
    public RuleConfig advance(ObjectNode nextState) {
        Objects.requireNonNull(nextState, "Next state must not be null");
        return new RuleConfig(parameters, nextState.deepCopy(), state);
    }

    /**
     * Serialize back to the wire format. The previous state is dropped.
     *
     * @return the JSON value of this slice
     * @throws IllegalStateException if state is attached to a non-object slice
     */
    public JsonNode toJson() {
        if (state == null) {
            return parameters.deepCopy();
        }
        if (!parameters.isObject()) {
            throw new IllegalStateException(
                    "Rule state can only be attached to object configurations, got: "
                            + parameters.getNodeType());
        }
        ObjectNode json = ((ObjectNode) parameters).deepCopy();
        json.set(STATE_KEY, state.deepCopy());
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleConfig that))
            return false;
        return parameters.equals(that.parameters) && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, state);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
