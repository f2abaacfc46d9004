package at.sv.astro.sun;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves sun event expressions like {@code sunrise}, {@code golden_hour-30} or {@code 07:30} for a given day.
 */
public final class SunEventResolver {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final Pattern EXPRESSION = Pattern.compile("^\\s*([A-Za-z][A-Za-z_\\-]*?)\\s*(?:([+-])\\s*(\\d+))?\\s*$");

    private final SunCalculator sunCalculator;
    private final double latitude;
    private final double longitude;
    private final Map<String, LocalTime> timeCache;

    public SunEventResolver(SunCalculator sunCalculator, double latitude, double longitude) {
        this.sunCalculator = sunCalculator;
        this.latitude = latitude;
        this.longitude = longitude;
        timeCache = new ConcurrentHashMap<>();
    }

    /**
     * @param input    a ISO_LOCAL_TIME formatted string, or a sun event name with optional minute offset
     * @param dateTime the date to resolve sun events for, also defines the zone of the result
     * @return the resolved time on the date of dateTime
     * @throws InvalidSunEventExpression if the input is neither a valid local time nor a known sun event with
     *                                   optional offset
     */
    public ZonedDateTime resolve(String input, ZonedDateTime dateTime) {
        LocalTime time = tryParseTimeString(input);
        if (time != null) return dateTime.with(time);
        Matcher matcher = EXPRESSION.matcher(input);
        if (!matcher.matches()) {
            throw new InvalidSunEventExpression("Failed to parse sun event expression '" + input + "'");
        }
        ZonedDateTime eventTime = getEvent(matcher.group(1), dateTime);
        if (matcher.group(2) == null) {
            return eventTime;
        }
        long offset = parseOffset(input, matcher.group(3));
        try {
            if ("+".equals(matcher.group(2))) {
                return eventTime.plusMinutes(offset);
            } else {
                return eventTime.minusMinutes(offset);
            }
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidSunEventExpression("Offset out of range in '" + input + "': " + e.getMessage());
        }
    }

    private LocalTime tryParseTimeString(String input) {
        if (input.isEmpty() || !Character.isDigit(input.charAt(0))) {
            return null;
        }

        return timeCache.computeIfAbsent(input, k -> {
            try {
                return LocalTime.parse(input);
            } catch (Exception e) {
                throw new InvalidSunEventExpression("Failed to parse time '" + input + "': " + e.getMessage());
            }
        });
    }

    private long parseOffset(String input, String offset) {
        try {
            return Long.parseLong(offset);
        } catch (NumberFormatException e) {
            throw new InvalidSunEventExpression("Invalid offset in '" + input + "': " + e.getMessage());
        }
    }

    private ZonedDateTime getEvent(String name, ZonedDateTime dateTime) {
        String key = normalize(name);
        return getEvents(dateTime).entrySet().stream()
                                  .filter(entry -> normalize(entry.getKey()).equals(key))
                                  .map(Map.Entry::getValue)
                                  .findFirst()
                                  .orElseThrow(() -> new InvalidSunEventExpression("Unknown sun event: '" + name + "'"));
    }

    /**
     * @return all sun events of the local date of dateTime, converted to its zone
     */
    public Map<String, ZonedDateTime> getEvents(ZonedDateTime dateTime) {
        Instant localNoon = dateTime.with(LocalTime.NOON).toInstant();
        Map<String, ZonedDateTime> events = new LinkedHashMap<>();
        sunCalculator.getTimes(localNoon, latitude, longitude)
                     .forEach((name, instant) -> events.put(name, instant.atZone(dateTime.getZone())));
        return events;
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ENGLISH);
    }

    public String toDebugString(ZonedDateTime dateTime) {
        return getEvents(dateTime).entrySet().stream()
                                  .sorted(Map.Entry.<String, ZonedDateTime>comparingByValue())
                                  .map(entry -> entry.getKey() + ": " + TIME_FORMATTER.format(entry.getValue()))
                                  .collect(Collectors.joining("\n"));
    }
}
