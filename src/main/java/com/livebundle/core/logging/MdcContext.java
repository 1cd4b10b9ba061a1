package com.livebundle.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing livebundle MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TARGET = "target";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setTarget(String sessionId, String target) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(TARGET, target);
    }

    public static void clearTarget() {
        MDC.remove(TARGET);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TARGET);
    }
}
