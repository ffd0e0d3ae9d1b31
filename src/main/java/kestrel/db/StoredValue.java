package kestrel.db;

/**
 * A string payload with an optional absolute expiry in epoch milliseconds.
 */
public final class StoredValue {
    private final String payload;
    private final boolean hasExpiry;
    private final long expireAt;

    private StoredValue(String payload, boolean hasExpiry, long expireAt) {
        this.payload = payload;
        this.hasExpiry = hasExpiry;
        this.expireAt = expireAt;
    }

    public static StoredValue persistent(String payload) {
        return new StoredValue(payload, false, 0);
    }

    public static StoredValue expiring(String payload, long expireAt) {
        return new StoredValue(payload, true, expireAt);
    }

    public String getPayload() {
        return payload;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return hasExpiry;
    }

    /**
     * Expiry is checked at millisecond resolution and the deadline itself already counts as
     * expired, so a value written with a TTL of zero is never readable.
     */
    public boolean isExpired(long now) {
        return hasExpiry && now >= expireAt;
    }
}
