package io.vaultflow.storage;

import java.io.IOException;
import java.time.Instant;

/**
 * Source of "now" for expiry and staleness decisions. Implementations read the shared store's
 * notion of time rather than the local wall clock.
 */
@FunctionalInterface
public interface StoreClock {
    Instant now() throws IOException;
}
