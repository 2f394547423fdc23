package com.markrunner.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing markrunner MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STAGE_ID = "stageId";
    public static final String UNIT_ID = "unitId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stageId) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE_ID, stageId);
    }

    public static void setUnit(int unitId) {
        MDC.put(UNIT_ID, String.valueOf(unitId));
    }

    public static void clearUnit() {
        MDC.remove(UNIT_ID);
    }

    public static void clearStage() {
        MDC.remove(STAGE_ID);
        MDC.remove(UNIT_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE_ID);
        MDC.remove(UNIT_ID);
    }
}
