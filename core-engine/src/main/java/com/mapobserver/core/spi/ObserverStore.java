package com.mapobserver.core.spi;

import com.mapobserver.core.model.Observer;
import com.mapobserver.core.model.RuleConfiguration;

/**
 * Transactional persistence of observer rule configurations.
 *
 * <p>
 * The engine writes through this interface with a
 * refresh-then-write-then-commit sequence:
 * </p>
 *
 * <pre>
 * store.beginTransaction();
 * store.refresh(observer);
 * store.replaceRules(observer, updated);
 * store.commit();   // or rollback() on failure
 * </pre>
 *
 * <p>
 * Implementations report failures with unchecked exceptions.
 * </p>
 *
 * @since 1.0.0
 */
public interface ObserverStore {

    void beginTransaction();

    /**
     * Reload the stored state of {@code observer} into the given instance,
     * discarding unsaved changes.
     *
     * @param observer the observer to refresh
     */
    void refresh(Observer observer);

    /**
     * Replace the stored rule configuration of {@code observer}. Takes effect
     * on {@link #commit()}.
     *
     * @param observer      the observer to update
     * @param configuration the new configuration
     */
    void replaceRules(Observer observer, RuleConfiguration configuration);

    void commit();

    void rollback();
}
