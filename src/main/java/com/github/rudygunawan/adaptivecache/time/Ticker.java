package com.github.rudygunawan.adaptivecache.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Every timestamp the cache keeps (entry creation, last access, expiration, cleanup events)
 * is read from a {@code Ticker}. Tests substitute a fake ticker to drive expiration, entry
 * ageing and the cleanup event window without sleeping.
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .enableBackgroundCleanup(false)
 *     .build();
 *
 * cache.set("session", token, Duration.ofMinutes(10));
 * ticker.advance(11, TimeUnit.MINUTES);
 * assertNull(cache.get("session"));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Values must be monotonic, with the same properties as {@link System#nanoTime()}.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return the default ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
