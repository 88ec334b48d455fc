package com.topostat.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Topostat-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String ENVELOPE = "envelope";
    public static final String AGENT = "agent";
    public static final String PLAN = "plan";

    private MdcContext() {}

    public static void setEnvelope(String envelopeId) {
        MDC.put(ENVELOPE, envelopeId);
    }

    public static void setRecord(String agentName, String planName) {
        MDC.put(AGENT, agentName);
        MDC.put(PLAN, planName);
    }

    public static void clearRecord() {
        MDC.remove(AGENT);
        MDC.remove(PLAN);
    }

    public static void clear() {
        MDC.remove(ENVELOPE);
        MDC.remove(AGENT);
        MDC.remove(PLAN);
    }
}
