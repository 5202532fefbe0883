package in.gts.util;

/**
 * Environment lookups with system-property fallback.
 *
 * A variable set in the process environment wins; otherwise the JVM system
 * property of the same name is used (handy for tests and -D overrides).
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
     * @throws IllegalArgumentException if the value is present but not an integer
     */
    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + value, e);
        }
    }

    private Env() {}
}
