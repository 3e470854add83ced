package com.watchwise.backend.restriction.cache;

public final class RestrictionCacheKeys {
    private RestrictionCacheKeys() {}

    public static final String BEDTIME = "bedtime_settings";
    private static final String APP_PREFIX = "app_restriction_";

    public static String app(String bundleId) {
        return APP_PREFIX + bundleId;
    }
}
