package kestrel.persistence.rdb;

/**
 * A key discovered in a snapshot, optionally with an absolute expiry in epoch milliseconds.
 * Values are never materialized.
 */
public final class SnapshotRecord {
    private final String key;
    private final boolean hasExpiry;
    private final long expireAt;

    private SnapshotRecord(String key, boolean hasExpiry, long expireAt) {
        this.key = key;
        this.hasExpiry = hasExpiry;
        this.expireAt = expireAt;
    }

    /** A key that never expires. */
    public SnapshotRecord(String key) {
        this(key, false, 0);
    }

    /** A key that expires at {@code expireAt}; any value is a real timestamp, including negative ones. */
    public SnapshotRecord(String key, long expireAt) {
        this(key, true, expireAt);
    }

    public String getKey() {
        return key;
    }

    public boolean hasExpiry() {
        return hasExpiry;
    }

    /** Only meaningful when {@link #hasExpiry()} is true. */
    public long getExpireAt() {
        return expireAt;
    }

    public boolean isExpired(long now) {
        return hasExpiry && now >= expireAt;
    }

    @Override
    public String toString() {
        return hasExpiry ? key + "@" + expireAt : key;
    }
}
