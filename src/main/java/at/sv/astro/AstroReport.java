package at.sv.astro;

import at.sv.astro.moon.MoonCalculator;
import at.sv.astro.moon.MoonIllumination;
import at.sv.astro.moon.MoonPosition;
import at.sv.astro.position.HorizontalPosition;
import at.sv.astro.sun.SunCalculator;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sun and moon data for one instant and location, angles in degrees.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AstroReport(String instant, String zone, double latitude, double longitude, SunReport sun,
                          MoonReport moon) {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    public record SunReport(double azimuth, double altitude, Map<String, String> events) {
    }

    public record MoonReport(double azimuth, double altitude, double distance, double fraction, double phase,
                             double angle, boolean waxing) {
    }

    public static AstroReport create(SunCalculator sunCalculator, Instant instant, ZoneId zone, double latitude,
                                     double longitude) {
        HorizontalPosition sunPosition = sunCalculator.getPosition(instant, latitude, longitude);
        Map<String, String> events = new LinkedHashMap<>();
        sunCalculator.getTimes(instant, latitude, longitude).entrySet().stream()
                     .sorted(Map.Entry.<String, Instant>comparingByValue())
                     .forEachOrdered(entry -> events.put(entry.getKey(), entry.getValue().atZone(zone).toOffsetDateTime().toString()));
        MoonPosition moonPosition = MoonCalculator.getMoonPosition(instant, latitude, longitude);
        MoonIllumination illumination = MoonCalculator.getMoonIllumination(instant);
        return new AstroReport(instant.toString(), zone.getId(), latitude, longitude,
                new SunReport(sunPosition.azimuthDegrees(), sunPosition.altitudeDegrees(), events),
                new MoonReport(Math.toDegrees(moonPosition.azimuth()), Math.toDegrees(moonPosition.altitude()),
                        moonPosition.distance(), illumination.fraction(), illumination.phase(),
                        Math.toDegrees(illumination.angle()), illumination.isWaxing()));
    }

    public String toText() {
        StringBuilder text = new StringBuilder();
        text.append("Instant: ").append(instant).append(" at ").append(format(latitude)).append(", ")
            .append(format(longitude)).append('\n');
        text.append("Sun: azimuth ").append(format(sun.azimuth())).append("°, altitude ")
            .append(format(sun.altitude())).append("°\n");
        text.append("Sun events (").append(zone).append("):\n");
        sun.events().forEach((name, time) -> text.append("  ").append(name).append(": ")
                                                 .append(TIME_FORMATTER.format(OffsetDateTime.parse(time)))
                                                 .append('\n'));
        text.append("Moon: azimuth ").append(format(moon.azimuth())).append("°, altitude ")
            .append(format(moon.altitude())).append("°, distance ")
            .append(String.format(Locale.ROOT, "%.1f", moon.distance())).append(" km\n");
        text.append("Moon illumination: fraction ").append(format(moon.fraction())).append(", phase ")
            .append(format(moon.phase())).append(", angle ").append(format(moon.angle())).append("° (")
            .append(moon.waxing() ? "waxing" : "waning").append(")\n");
        return text.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
