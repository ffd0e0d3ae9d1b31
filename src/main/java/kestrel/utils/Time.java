package kestrel.utils;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall clock used for key expiration. Tests swap in their own clock to move time forward
 * without sleeping.
 */
public class Time {
    public interface Clock {
        long currentTimeMillis();
    }

    private static final Clock SYSTEM_CLOCK = System::currentTimeMillis;
    private static final AtomicReference<Clock> clock = new AtomicReference<>(SYSTEM_CLOCK);

    public static long now() {
        return clock.get().currentTimeMillis();
    }

    /**
     * Absolute instant {@code ttlMillis} from now, saturating at {@link Long#MAX_VALUE}
     * instead of wrapping for very large TTLs.
     */
    public static long deadline(long ttlMillis) {
        long now = now();
        if (ttlMillis > Long.MAX_VALUE - now) {
            return Long.MAX_VALUE;
        }
        return now + ttlMillis;
    }

    public static void setClock(Clock newClock) {
        clock.set(newClock);
    }

    public static void useSystemClock() {
        clock.set(SYSTEM_CLOCK);
    }
}
