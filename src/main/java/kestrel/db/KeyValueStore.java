package kestrel.db;

import kestrel.persistence.rdb.SnapshotRecord;
import kestrel.utils.Time;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The shared key space. Every operation runs under one lock held only for the map access;
 * nothing here performs I/O or calls back into another public method while holding it.
 * Expired entries are dropped lazily when read and in bulk by {@link #cleanup()}.
 */
public class KeyValueStore {
    private final Map<String, StoredValue> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void set(String key, String value) {
        put(key, StoredValue.persistent(value));
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous value and its expiry.
     *
     * @throws IllegalArgumentException if the key is empty or the TTL is negative
     */
    public void set(String key, String value, long ttlMillis) {
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("invalid expire time, must be non-negative");
        }
        put(key, StoredValue.expiring(value, Time.deadline(ttlMillis)));
    }

    private void put(String key, StoredValue value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> get(String key) {
        if (key == null || key.isEmpty()) return Optional.empty();

        lock.lock();
        try {
            StoredValue v = entries.get(key);
            if (v == null) return Optional.empty();
            if (v.isExpired(Time.now())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(v.getPayload());
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String key) {
        if (key == null || key.isEmpty()) return false;

        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every expired entry.
     *
     * @return the number of entries removed
     */
    public int cleanup() {
        lock.lock();
        try {
            long now = Time.now();
            int removed = 0;
            Iterator<Map.Entry<String, StoredValue>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** Live keys at the time of the call. Expired entries are skipped but left in place. */
    public List<String> keys() {
        lock.lock();
        try {
            long now = Time.now();
            List<String> live = new ArrayList<>(entries.size());
            for (Map.Entry<String, StoredValue> e : entries.entrySet()) {
                if (!e.getValue().isExpired(now)) {
                    live.add(e.getKey());
                }
            }
            return live;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes keys found in a snapshot visible with an empty payload and the snapshot's expiry.
     * Records that are already expired, and keys that already hold a live value, are skipped.
     *
     * @return the number of keys inserted
     */
    public int loadFromSnapshot(List<SnapshotRecord> records) {
        lock.lock();
        try {
            long now = Time.now();
            int loaded = 0;
            for (SnapshotRecord record : records) {
                if (record.getKey().isEmpty() || record.isExpired(now)) continue;

                StoredValue existing = entries.get(record.getKey());
                if (existing != null && !existing.isExpired(now)) continue;

                entries.put(record.getKey(), record.hasExpiry()
                        ? StoredValue.expiring("", record.getExpireAt())
                        : StoredValue.persistent(""));
                loaded++;
            }
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    /** Number of entries held, including expired ones not yet reclaimed. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
