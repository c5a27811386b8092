package com.propertybooking.common.util;

/**
 * Common constants shared by the services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:property:";
    public static final String USER_ID_HEADER = "X-User-Id";

    public static final int DEFAULT_LOOKAHEAD_MONTHS = 3;
    public static final int DEFAULT_LOOKBACK_MONTHS = 3;
}
