package com.magicfolder.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing per-request MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId, int fileCount) {
        MDC.put("requestId", requestId);
        MDC.put("fileCount", String.valueOf(fileCount));
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("fileCount");
    }
}
