package com.autofix.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for the group currently processed on this thread.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGroup(String groupId, int attempt) {
        MDC.put("groupId", groupId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("groupId");
        MDC.remove("attempt");
        MDC.remove("stage");
    }
}
