package com.eidos.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing EIDOS-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEpisode(String episodeId) {
        MDC.put("episodeId", episodeId);
    }

    public static void setDistillation(String distillationId) {
        MDC.put("distillationId", distillationId);
    }

    public static void setBatch(String batchId) {
        MDC.put("batchId", batchId);
    }

    public static void clearDistillation() {
        MDC.remove("distillationId");
    }

    public static void clear() {
        MDC.remove("episodeId");
        MDC.remove("distillationId");
        MDC.remove("batchId");
    }
}
