package com.mapobserver.core.model;

import java.util.Objects;

/**
 * A read-only viewer of one map, configured with zero or more rules.
 *
 * <p>
 * Observers are created and edited by the surrounding CRUD application.
 * The rule engine reads {@link #getRules()} and, for stateful rules, writes
 * an updated configuration back through
 * {@link com.mapobserver.core.spi.ObserverStore}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A single instance must
 * only be accessed by one request at a time.
 * </p>
 *
 * @since 1.0.0
 */
public class Observer {

    private final long id;
    private final String name;
    private final long mapId;

    private RuleConfiguration rules;

    /** Incremented by the store on every committed write. */
    private long version;

    /**
     * @param id    observer identifier
     * @param name  display name; must not be {@code null}
     * @param mapId identifier of the map the observer is scoped to
     * @param rules the rule configuration; {@code null} means no rules
     */
    public Observer(long id, String name, long mapId, RuleConfiguration rules) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "Observer name must not be null");
        this.mapId = mapId;
        this.rules = rules != null ? rules : RuleConfiguration.empty();
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getMapId() {
        return mapId;
    }

    public RuleConfiguration getRules() {
        return rules;
    }

    /**
     * @param rules the new configuration; {@code null} clears all rules
     */
    public void setRules(RuleConfiguration rules) {
        this.rules = rules != null ? rules : RuleConfiguration.empty();
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @Override
    public String toString() {
        return "Observer{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", mapId=" + mapId +
                ", version=" + version +
                ", rules=" + rules.getRuleNames() +
                '}';
    }
}
