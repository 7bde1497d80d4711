package in.civicdesk.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.function.Function;

/**
 * Typed configuration lookups.
 *
 * A key resolves from the environment, then from a JVM system property of the
 * same name, then to the caller's default. Values that do not parse are
 * logged and replaced by the default, so a typo never stops startup.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    /**
     * Read a non-negative whole number of {@code unit}s.
     */
    public static Duration getDuration(String key, ChronoUnit unit, Duration defaultValue) {
        Duration value = parse(key, defaultValue, raw -> Duration.of(Long.parseLong(raw), unit));
        if (value.isNegative()) {
            log.warn("Ignoring negative {}={}, using {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Ignoring invalid {}='{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
