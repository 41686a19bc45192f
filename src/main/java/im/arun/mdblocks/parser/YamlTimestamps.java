package im.arun.mdblocks.parser;

import org.yaml.snakeyaml.resolver.Resolver;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves YAML 1.1 timestamp scalars into {@code java.time} values.
 *
 * <p>Jackson's YAML reader hands timestamps back as plain strings. Values
 * matching SnakeYAML's implicit timestamp pattern are turned into a
 * {@link LocalDate}, {@link LocalDateTime} or {@link OffsetDateTime} so that
 * {@link PropertyValues} renders them in ISO-8601 form.
 */
final class YamlTimestamps {

    private YamlTimestamps() {
    }

    static Map<String, Object> resolve(Map<String, Object> properties) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue()));
        }
        return resolved;
    }

    @SuppressWarnings("unchecked")
    static Object resolveValue(Object value) {
        if (value instanceof String) {
            return parse((String) value);
        }
        if (value instanceof Map) {
            return resolve((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<?>) value) {
                resolved.add(resolveValue(item));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Parse a timestamp scalar, or return the text unchanged when it is not
     * one (including out-of-range fields such as month 13).
     */
    static Object parse(String text) {
        if (!Resolver.TIMESTAMP.matcher(text).matches()) {
            return text;
        }
        try {
            int separator = indexOfSeparator(text);
            if (separator < 0) {
                return parseDate(text);
            }
            LocalDate date = parseDate(text.substring(0, separator));

            int timeStart = separator;
            while (timeStart < text.length() && isSeparator(text.charAt(timeStart))) {
                timeStart++;
            }
            String rest = text.substring(timeStart);

            int zoneStart = indexOfZone(rest);
            String time = (zoneStart < 0 ? rest : rest.substring(0, zoneStart)).strip();
            LocalDateTime dateTime = LocalDateTime.of(date, parseTime(time));
            if (zoneStart < 0) {
                return dateTime;
            }
            return OffsetDateTime.of(dateTime, parseOffset(rest.substring(zoneStart)));
        } catch (DateTimeException e) {
            return text;
        }
    }

    private static LocalDate parseDate(String text) {
        String[] parts = text.split("-");
        return LocalDate.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
    }

    private static LocalTime parseTime(String text) {
        String[] parts = text.split(":");
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);

        String seconds = parts[2];
        int nanos = 0;
        int dot = seconds.indexOf('.');
        if (dot >= 0) {
            String fraction = seconds.substring(dot + 1);
            if (fraction.length() > 9) {
                fraction = fraction.substring(0, 9);
            }
            if (!fraction.isEmpty()) {
                nanos = Integer.parseInt(fraction + "000000000".substring(fraction.length()));
            }
            seconds = seconds.substring(0, dot);
        }
        return LocalTime.of(hour, minute, Integer.parseInt(seconds), nanos);
    }

    private static ZoneOffset parseOffset(String zone) {
        if ("Z".equals(zone)) {
            return ZoneOffset.UTC;
        }
        int sign = zone.charAt(0) == '-' ? -1 : 1;
        String[] parts = zone.substring(1).split(":");
        int hours = Integer.parseInt(parts[0]);
        int minutes = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
        return ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes);
    }

    private static int indexOfSeparator(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isSeparator(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isSeparator(char c) {
        return c == 'T' || c == 't' || c == ' ' || c == '\t';
    }

    // The time part carries no sign characters, so the first Z, + or - starts the zone
    private static int indexOfZone(String rest) {
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == 'Z' || c == '+' || c == '-') {
                return i;
            }
        }
        return -1;
    }
}
