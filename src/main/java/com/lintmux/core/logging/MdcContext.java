package com.lintmux.core.logging;

import com.lintmux.core.model.ChildIdentity;
import org.slf4j.MDC;

/**
 * Utility for managing Lintmux-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setChild(ChildIdentity identity, String name) {
        MDC.put("childId", identity.key());
        MDC.put("childName", name);
    }

    public static void setRequest(String method) {
        MDC.put("requestMethod", method);
    }

    /** Removes the child keys, leaving the request key of an enclosing request in place. */
    public static void clearChild() {
        MDC.remove("childId");
        MDC.remove("childName");
    }

    public static void clear() {
        MDC.remove("childId");
        MDC.remove("childName");
        MDC.remove("requestMethod");
    }
}
