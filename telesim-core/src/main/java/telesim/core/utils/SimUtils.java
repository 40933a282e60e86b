package telesim.core.utils;

import com.fasterxml.uuid.Generators;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class SimUtils {

    // RFC 3339, millisecond precision, always UTC with a 'Z' suffix
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    public static Instant parseTimestamp(String text) {
        return Instant.parse(text);
    }

    public static String newDeviceId() {
        return Generators.timeBasedEpochGenerator().generate().toString();
    }

    public static String formatMillis(Duration duration) {
        return duration.toMillis() + "ms";
    }
}
