package software.amazon.policy.ruler;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-recently-used cache of compiled patterns keyed by the literal pattern string. Backed by an access-ordered
 * LinkedHashMap, i.e. a hash map threaded with a doubly linked list, so get and put are O(1) and the eldest entry is
 * the least recently used one.
 *
 * Every operation holds the monitor only for the map access itself. Compiling on a miss is the caller's job and
 * happens outside the lock, after which putIfAbsent settles races so that a key never maps to two instances.
 */
@ThreadSafe
class PatternCache {

    private final int capacity;

    @GuardedBy("this")
    private final Map<String, CompiledPattern> entries;

    PatternCache(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<String, CompiledPattern>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(final Map.Entry<String, CompiledPattern> eldest) {
                return size() > PatternCache.this.capacity;
            }
        };
    }

    @Nullable
    synchronized CompiledPattern get(final String pattern) {
        return entries.get(pattern);
    }

    /**
     * Inserts the compiled pattern unless another one is already cached under the same key.
     *
     * @return the instance that is cached once this call returns
     */
    synchronized CompiledPattern putIfAbsent(final String pattern, final CompiledPattern compiled) {
        final CompiledPattern existing = entries.get(pattern);
        if (existing != null) {
            return existing;
        }
        entries.put(pattern, compiled);
        return compiled;
    }

    synchronized boolean contains(final String pattern) {
        // containsKey does not count as an access, so probing leaves the eviction order alone.
        return entries.containsKey(pattern);
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized void clear() {
        entries.clear();
    }

    int capacity() {
        return capacity;
    }
}
