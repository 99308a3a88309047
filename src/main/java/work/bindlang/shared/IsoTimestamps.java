package work.bindlang.shared;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses the ISO-8601 forms accepted by guards and scenario files. Timestamps are local
 * (zone-less); offset timestamps are reduced to their local date-time.
 */
public final class IsoTimestamps {
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern WITH_OFFSET = Pattern.compile(".*T.*(Z|[+-]\\d{2}:?\\d{2})$");

    private IsoTimestamps() {}

    public static LocalDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Timestamp must not be blank");
        }
        String trimmed = raw.trim();
        try {
            if (DATE_ONLY.matcher(trimmed).matches()) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            if (WITH_OFFSET.matcher(trimmed).matches()) {
                return OffsetDateTime.parse(trimmed).toLocalDateTime();
            }
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid ISO datetime: '" + raw + "'", ex);
        }
    }
}
