package in.flowmind.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 *
 * Every lookup checks the process environment first and falls back to a
 * system property of the same name, so tests can override with -D.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    /**
     * First non-empty value among aliased keys, in the order given.
     */
    public static String firstOf(String... keys) {
        for (String key : keys) {
            String value = get(key, null);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static Duration getSeconds(String key, long defaultSeconds) {
        String value = get(key, null);
        if (value == null) return Duration.ofSeconds(defaultSeconds);
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(value.trim()) * 1000));
        } catch (NumberFormatException e) {
            return Duration.ofSeconds(defaultSeconds);
        }
    }

    private Env() {}
}
