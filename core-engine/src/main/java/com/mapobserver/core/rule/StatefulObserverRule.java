package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.model.RuleConfig;

/**
 * A rule whose behaviour depends on data kept between requests.
 *
 * <p>
 * The state lives in the observer's configuration under
 * {@value RuleConfig#STATE_KEY}; its shape is private to the rule and must
 * satisfy the rule's schema. The engine drives the lifecycle:
 * </p>
 * <ol>
 * <li>{@link #initializeState} once, when the slice has no state yet;</li>
 * <li>{@link #updateState} on every request, including the initializing
 * one;</li>
 * <li>the returned state is persisted if it differs from the stored one.</li>
 * </ol>
 */
public interface StatefulObserverRule extends ObserverRule {

    /**
     * Build the initial state.
     *
     * @param config the slice, without state
     * @return initial state
     */
    ObjectNode initializeState(RuleConfig config);

    /**
     * Compute the state to persist after the current request.
     *
     * @param config the slice holding the just-initialized or stored state
     * @return next state; never the same instance as the input
     */
    ObjectNode updateState(RuleConfig config);
}
