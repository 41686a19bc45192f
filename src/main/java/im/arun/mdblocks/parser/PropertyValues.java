package im.arun.mdblocks.parser;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts property values into plain JSON-friendly structures.
 * Date and time values become ISO-8601 strings; maps and collections are
 * copied recursively with their order preserved.
 */
public final class PropertyValues {

    private PropertyValues() {}

    public static Map<String, Object> toJsonSafe(Map<?, ?> properties) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (properties == null) {
            return result;
        }
        properties.forEach((key, value) -> result.put(String.valueOf(key), toJsonSafe(value)));
        return result;
    }

    public static Object toJsonSafe(Object value) {
        if (value instanceof Map) {
            return toJsonSafe((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(toJsonSafe(item));
            }
            return items;
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        if (value instanceof LocalDateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
        }
        if (value instanceof LocalTime) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format((LocalTime) value);
        }
        if (value instanceof OffsetDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value);
        }
        if (value instanceof ZonedDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((ZonedDateTime) value);
        }
        if (value instanceof Instant) {
            return value.toString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        return value;
    }
}
