package io.vaultflow.testing;

import io.vaultflow.storage.StoreClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** Store clock that only moves when a test moves it. */
public final class MutableStoreClock implements StoreClock {
    private final AtomicReference<Instant> now;

    public MutableStoreClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public Instant set(Instant next) {
        now.set(next);
        return next;
    }

    public Instant advance(Duration step) {
        return now.updateAndGet(current -> current.plus(step));
    }
}
