package io.allocations.runtime;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking mutual exclusion per key. A second attempt on a held key fails instead of waiting, and locks are
 * not reentrant.
 */
public class KeyedLocks<K> {
    private final Set<K> held = ConcurrentHashMap.newKeySet();

    public Optional<Lease> tryAcquire(K key) {
        if (!held.add(key)) return Optional.empty();
        return Optional.of(new Lease(key));
    }

    public boolean isHeld(K key) { return held.contains(key); }

    public final class Lease implements AutoCloseable {
        private final K key;
        private boolean released;

        private Lease(K key) { this.key = key; }

        @Override
        public synchronized void close() {
            if (released) return;
            released = true;
            held.remove(key);
        }
    }
}
