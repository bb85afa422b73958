package com.mapobserver.memory;

/**
 * Thrown on commit when an observer was changed by another transaction
 * after it was read.
 */
public class ConcurrentUpdateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long observerId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentUpdateException(long observerId, long expectedVersion, long actualVersion) {
        super("Observer " + observerId + " was modified concurrently: expected version "
                + expectedVersion + ", found " + actualVersion);
        this.observerId = observerId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getObserverId() {
        return observerId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
