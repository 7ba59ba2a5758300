package com.cratemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Cratemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setBatch(int batchNumber) {
        MDC.put("batchNumber", String.valueOf(batchNumber));
        MDC.remove("attempt");
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearBatch() {
        MDC.remove("batchNumber");
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("batchNumber");
        MDC.remove("attempt");
    }
}
