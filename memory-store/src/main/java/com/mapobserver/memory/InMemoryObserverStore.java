package com.mapobserver.memory;

import com.mapobserver.core.model.Observer;
import com.mapobserver.core.model.RuleConfiguration;
import com.mapobserver.core.spi.ObserverStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ObserverStore} keeping one snapshot per observer in memory.
 *
 * <h3>Transactions</h3>
 * <p>
 * Transactions are bound to the calling thread. Writes made through
 * {@link #replaceRules} are staged and only become visible on
 * {@link #commit()}. Commit is optimistic: it fails with
 * {@link ConcurrentUpdateException} when the stored version no longer
 * matches the one seen by {@link #refresh}, and leaves the transaction open
 * so that the caller can {@link #rollback()}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Commits and {@link #save} are serialized on the
 * store instance.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryObserverStore implements ObserverStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryObserverStore.class);

    private final Map<Long, Snapshot> snapshots = new HashMap<>();
    private final ThreadLocal<Transaction> transaction = new ThreadLocal<>();

    // ---------------------------------------------------------------
    // Direct access
    // ---------------------------------------------------------------

    /**
     * Store {@code observer} outside of any transaction, bumping its version.
     *
     * @param observer the observer; must not be {@code null}
     */
    public synchronized void save(Observer observer) {
        Objects.requireNonNull(observer, "Observer must not be null");
        Snapshot previous = snapshots.get(observer.getId());
        long version = previous == null ? 0 : previous.version + 1;
        snapshots.put(observer.getId(),
                new Snapshot(observer.getName(), observer.getMapId(), observer.getRules(), version));
        observer.setVersion(version);
    }

    /**
     * @param observerId observer identifier
     * @return a fresh instance built from the stored snapshot
     */
    public synchronized Optional<Observer> find(long observerId) {
        Snapshot snapshot = snapshots.get(observerId);
        if (snapshot == null) {
            return Optional.empty();
        }
        Observer observer = new Observer(observerId, snapshot.name, snapshot.mapId, snapshot.rules);
        observer.setVersion(snapshot.version);
        return Optional.of(observer);
    }

    public synchronized Optional<RuleConfiguration> findRules(long observerId) {
        return Optional.ofNullable(snapshots.get(observerId)).map(snapshot -> snapshot.rules);
    }

    public boolean isTransactionActive() {
        return transaction.get() != null;
    }

    // ---------------------------------------------------------------
    // ObserverStore
    // ---------------------------------------------------------------

    @Override
    public void beginTransaction() {
        if (transaction.get() != null) {
            throw new IllegalStateException("A transaction is already active on this thread");
        }
        transaction.set(new Transaction());
    }

    @Override
    public void refresh(Observer observer) {
        Objects.requireNonNull(observer, "Observer must not be null");
        Transaction tx = requireTransaction();
        Snapshot snapshot;
        synchronized (this) {
            snapshot = snapshots.get(observer.getId());
        }
        if (snapshot == null) {
            throw new IllegalStateException("Observer " + observer.getId() + " is not stored");
        }
        observer.setRules(snapshot.rules);
        observer.setVersion(snapshot.version);
        tx.readVersions.put(observer.getId(), snapshot.version);
    }

    @Override
    public void replaceRules(Observer observer, RuleConfiguration configuration) {
        Objects.requireNonNull(observer, "Observer must not be null");
        Objects.requireNonNull(configuration, "Rule configuration must not be null");
        Transaction tx = requireTransaction();
        long expectedVersion = tx.readVersions.getOrDefault(observer.getId(), observer.getVersion());
        tx.writes.put(observer.getId(), new StagedWrite(observer, configuration, expectedVersion));
    }

    @Override
    public void commit() {
        Transaction tx = requireTransaction();
        synchronized (this) {
            for (StagedWrite write : tx.writes.values()) {
                long observerId = write.observer.getId();
                Snapshot current = snapshots.get(observerId);
                long actualVersion = current == null ? -1 : current.version;
                if (actualVersion != write.expectedVersion) {
                    throw new ConcurrentUpdateException(observerId, write.expectedVersion, actualVersion);
                }
            }
            for (StagedWrite write : tx.writes.values()) {
                Snapshot current = snapshots.get(write.observer.getId());
                Snapshot next = new Snapshot(current.name, current.mapId, write.rules, current.version + 1);
                snapshots.put(write.observer.getId(), next);
                write.observer.setVersion(next.version);
            }
        }
        LOG.debug("Committed {} observer write(s)", tx.writes.size());
        transaction.remove();
    }

    @Override
    public void rollback() {
        Transaction tx = transaction.get();
        if (tx == null) {
            LOG.debug("Rollback requested without an active transaction");
            return;
        }
        LOG.debug("Rolled back {} staged observer write(s)", tx.writes.size());
        transaction.remove();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Transaction requireTransaction() {
        Transaction tx = transaction.get();
        if (tx == null) {
            throw new IllegalStateException("No active transaction on this thread");
        }
        return tx;
    }

    private static final class Snapshot {
        private final String name;
        private final long mapId;
        private final RuleConfiguration rules;
        private final long version;

        private Snapshot(String name, long mapId, RuleConfiguration rules, long version) {
            this.name = name;
            this.mapId = mapId;
            this.rules = rules;
            this.version = version;
        }
    }

    private static final class StagedWrite {
        private final Observer observer;
        private final RuleConfiguration rules;
        private final long expectedVersion;

        private StagedWrite(Observer observer, RuleConfiguration rules, long expectedVersion) {
            this.observer = observer;
            this.rules = rules;
            this.expectedVersion = expectedVersion;
        }
    }

    private static final class Transaction {
        private final Map<Long, Long> readVersions = new HashMap<>();
        private final Map<Long, StagedWrite> writes = new LinkedHashMap<>();
    }
}
