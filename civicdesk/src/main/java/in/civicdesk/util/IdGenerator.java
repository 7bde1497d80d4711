package in.civicdesk.util;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates ids of the form {@code <prefix><millis base36>-<sequence base36>}.
 *
 * The millisecond part is zero-padded, so ids created later sort after ids
 * created earlier; the sequence keeps ids unique within one millisecond.
 */
public final class IdGenerator {
    private static final int MILLIS_WIDTH = 9;
    private static final int SEQUENCE_WIDTH = 4;

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public IdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public String next(Instant at) {
        String millis = pad(Long.toString(at.toEpochMilli(), 36), MILLIS_WIDTH);
        String seq = pad(Long.toString(sequence.incrementAndGet(), 36), SEQUENCE_WIDTH);
        return prefix + millis.toUpperCase(Locale.ROOT) + "-" + seq.toUpperCase(Locale.ROOT);
    }

    private static String pad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return "0".repeat(width - value.length()) + value;
    }
}
