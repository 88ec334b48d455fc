package com.topostat.agent;

import java.io.IOException;

/**
 * Delivers an encoded envelope to the collector.
 */
public interface EnvelopeSink {

    /**
     * @throws IOException when the collector cannot be reached or refuses the envelope
     */
    void send(String envelopeJson) throws IOException, InterruptedException;
}
