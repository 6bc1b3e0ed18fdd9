package ember.db;

import ember.utils.Clock;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key to value map plus the expiration index.
 *
 * <p>Expiration is lazy: a key whose deadline is strictly in the past is removed the next
 * time something touches it, and never before. There is no sweeper.
 *
 * <p>Not thread-safe. The command engine serializes every access.
 */
public class Keyspace {
    private final Map<String, Value> store = new HashMap<>();
    private final Map<String, Long> expirationTimes = new HashMap<>();
    private final Clock clock;

    public Keyspace() {
        this(Clock.SYSTEM);
    }

    public Keyspace(Clock clock) {
        this.clock = clock;
    }

    public long now() {
        return clock.currentTimeMillis();
    }

    private boolean isExpired(String key) {
        Long expireAt = expirationTimes.get(key);
        return expireAt != null && expireAt < now();
    }

    /**
     * Drops {@code key} from both maps if its deadline has passed.
     *
     * @return true if the key was expired and removed
     */
    public boolean checkExpiry(String key) {
        if (isExpired(key)) {
            store.remove(key);
            expirationTimes.remove(key);
            return true;
        }
        return false;
    }

    public Value get(String key) {
        checkExpiry(key);
        return store.get(key);
    }

    /**
     * Stores {@code value} under {@code key}. A live TTL on the key is kept.
     */
    public void put(String key, Value value) {
        checkExpiry(key);
        store.put(key, value);
    }

    /**
     * Removes the key and its TTL.
     *
     * @return true if a live entry existed
     */
    public boolean remove(String key) {
        checkExpiry(key);
        expirationTimes.remove(key);
        return store.remove(key) != null;
    }

    /**
     * Sets an absolute deadline, replacing any earlier one. The key does not need to exist.
     */
    public void expireAt(String key, long epochMillis) {
        checkExpiry(key);
        expirationTimes.put(key, epochMillis);
    }

    /**
     * Raw deadline lookup; does not run the expiration check.
     */
    public Long expirationOf(String key) {
        return expirationTimes.get(key);
    }

    /**
     * Raw presence check on the entry map; does not run the expiration check.
     */
    public boolean containsKey(String key) {
        return store.containsKey(key);
    }

    public int size() {
        return store.size();
    }

    /**
     * Deep copy of the entry map, for persistence.
     */
    public Map<String, Value> copyEntries() {
        Map<String, Value> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : store.entrySet()) {
            copy.put(e.getKey(), e.getValue().copy());
        }
        return copy;
    }

    public Map<String, Long> copyExpirations() {
        return new LinkedHashMap<>(expirationTimes);
    }

    /**
     * Union-merges persisted state into this keyspace. Loaded entries win over in-memory ones
     * for the same key; keys only present in memory are left alone.
     */
    public void merge(Map<String, Value> entries, Map<String, Long> expirations) {
        if (entries != null) {
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                if (e.getValue() != null) store.put(e.getKey(), e.getValue());
            }
        }
        if (expirations != null) {
            for (Map.Entry<String, Long> e : expirations.entrySet()) {
                if (e.getValue() != null) expirationTimes.put(e.getKey(), e.getValue());
            }
        }
    }
}
