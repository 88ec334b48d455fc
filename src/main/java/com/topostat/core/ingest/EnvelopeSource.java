package com.topostat.core.ingest;

import java.time.Duration;
import java.util.Optional;

/**
 * A bound transport endpoint delivering raw envelope JSON to the collector.
 */
public interface EnvelopeSource {

    String name();

    /**
     * Waits at most {@code timeout} for the next envelope.
     *
     * @return the raw envelope, or empty when the timeout elapsed
     */
    Optional<String> poll(Duration timeout) throws InterruptedException;
}
