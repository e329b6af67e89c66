package org.catalogregistry.harvest.pipeline;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.catalogregistry.harvest.pipeline.errors.LeaseUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-source mutual exclusion: at most one pass of a source runs at a time.
 *
 * Leases are not reentrant, so a second pass of the same source on the same
 * thread waits like any other.
 */
@Slf4j
public class SourceLeases {

    private final ConcurrentHashMap<String, Semaphore> leases = new ConcurrentHashMap<>();

    public Lease acquire(String source, Duration timeout) throws LeaseUnavailableException {
        var semaphore = leases.computeIfAbsent(source, k -> new Semaphore(1));
        try {
            if (!semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LeaseUnavailableException("Source " + source + " is already being harvested; gave up after "
                    + timeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaseUnavailableException("Interrupted while waiting for the lease of " + source, e);
        }
        log.debug("Acquired lease for source {}", source);
        return new Lease(source, semaphore);
    }

    public boolean isHeld(String source) {
        var semaphore = leases.get(source);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    public static final class Lease implements AutoCloseable {
        private final String source;
        private final Semaphore semaphore;
        private boolean released;

        private Lease(String source, Semaphore semaphore) {
            this.source = source;
            this.semaphore = semaphore;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                semaphore.release();
                log.debug("Released lease for source {}", source);
            }
        }
    }
}
