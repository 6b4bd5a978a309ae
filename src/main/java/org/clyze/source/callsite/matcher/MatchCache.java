package org.clyze.source.callsite.matcher;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * A cache of deterministic results. Values are computed outside any lock:
 * concurrent first computations may both run, but only one value is
 * published and returned to everybody.
 * @param <V>   the type of cached values
 */
public class MatchCache<V> {
    private final ConcurrentMap<Key, V> values = new ConcurrentHashMap<>();

    public V get(Supplier<V> compute, Object... keyParts) {
        Key key = new Key(keyParts);
        V value = values.get(key);
        if (value != null)
            return value;
        V computed = compute.get();
        V existing = values.putIfAbsent(key, computed);
        return existing != null ? existing : computed;
    }

    private static final class Key {
        private final Object[] parts;

        Key(Object[] parts) {
            this.parts = parts;
        }

        @Override
        public boolean equals(Object object) {
            return object instanceof Key && Arrays.equals(parts, ((Key) object).parts);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(parts);
        }
    }
}
