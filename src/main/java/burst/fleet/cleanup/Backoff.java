package burst.fleet.cleanup;

import java.time.Duration;

/**
 * Capped exponential backoff. Not thread-safe; one instance per retry loop.
 */
final class Backoff {
    private final Duration max;
    private Duration next;

    Backoff(Duration initial, Duration max) {
        this.next = initial;
        this.max = max;
    }

    /** Delay to wait before the next attempt; doubles each call up to the cap. */
    Duration nextDelay() {
        Duration current = next.compareTo(max) > 0 ? max : next;
        Duration doubled = current.multipliedBy(2);
        next = doubled.compareTo(max) > 0 ? max : doubled;
        return current;
    }

    static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
