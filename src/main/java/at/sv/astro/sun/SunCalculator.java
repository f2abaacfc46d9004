package at.sv.astro.sun;

import at.sv.astro.position.CoordinateMath;
import at.sv.astro.position.HorizontalPosition;
import at.sv.astro.time.JulianDate;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static at.sv.astro.position.CoordinateMath.RAD;
import static at.sv.astro.position.CoordinateMath.TWO_PI;

/**
 * Calculates the position of the sun and the times of named sun events, like sunrise, dusk or golden hour.
 * <p>
 * The list of sun event definitions can be extended with {@link #addTime(double, String, String)}. Instances are
 * not thread-safe: adding definitions while calculating times on another thread needs external synchronization.
 */
@Slf4j
public final class SunCalculator {

    public static final String SOLAR_NOON = "solarNoon";
    public static final String NADIR = "nadir";

    private static final double J0 = 0.0009;

    private final List<SunTimeDefinition> times;

    public SunCalculator() {
        times = new ArrayList<>(List.of(
                new SunTimeDefinition(-0.833, "sunrise", "sunset"),
                new SunTimeDefinition(-0.3, "sunriseEnd", "sunsetStart"),
                new SunTimeDefinition(-6, "dawn", "dusk"),
                new SunTimeDefinition(-12, "nauticalDawn", "nauticalDusk"),
                new SunTimeDefinition(-18, "nightEnd", "night"),
                new SunTimeDefinition(6, "goldenHourEnd", "goldenHour")
        ));
    }

    public HorizontalPosition getPosition(Instant instant, double latitude, double longitude) {
        return SolarEphemeris.getPosition(instant, latitude, longitude);
    }

    /**
     * Adds a custom sun event pair, reported by all following {@link #getTimes} calls.
     *
     * @param angle    sun altitude in degrees
     * @param riseName name of the morning event, empty to skip it
     * @param setName  name of the evening event, empty to skip it
     */
    public void addTime(double angle, String riseName, String setName) {
        SunTimeDefinition definition = new SunTimeDefinition(angle, riseName, setName);
        times.add(definition);
        log.debug("Added sun time definition: {}", definition);
    }

    public List<SunTimeDefinition> getTimeDefinitions() {
        return List.copyOf(times);
    }

    /**
     * Calculates the sun events of the day the given instant belongs to. The map always contains
     * {@link #SOLAR_NOON} and {@link #NADIR}, followed by the rise and set events of all definitions.
     * <p>
     * If the sun never reaches the altitude of a definition on that day, its hour angle is NaN and the reported
     * instants of that pair are meaningless. They are not removed.
     *
     * @return the event times by name, in insertion order
     */
    public Map<String, Instant> getTimes(Instant instant, double latitude, double longitude) {
        double lw = RAD * -longitude;
        double phi = RAD * latitude;
        JulianDate days = JulianDate.toDaysSinceJ2000(instant);
        double n = julianCycle(days, lw);
        double ds = approxTransit(0, lw, n);

        double m = SolarEphemeris.solarMeanAnomaly(JulianDate.fromFractionalDays(ds));
        double l = SolarEphemeris.eclipticLongitude(m);
        double dec = CoordinateMath.declination(l, 0);

        double jNoon = solarTransitJ(ds, m, l);

        Map<String, Instant> result = new LinkedHashMap<>();
        result.put(SOLAR_NOON, toInstant(jNoon));
        result.put(NADIR, toInstant(jNoon - 0.5));
        for (SunTimeDefinition time : times) {
            double jSet = getSetJ(time.angle() * RAD, lw, phi, dec, n, m, l);
            double jRise = jNoon - (jSet - jNoon);
            if (Double.isNaN(jSet)) {
                log.debug("Sun does not reach {}° on {} at {},{}", time.angle(), instant, latitude, longitude);
            }
            if (time.hasRise()) {
                result.put(time.riseName(), toInstant(jRise));
            }
            if (time.hasSet()) {
                result.put(time.setName(), toInstant(jSet));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Rounds to the nearest whole cycle. The fractional part is compared with 0.5 as is, which floors all negative
     * values.
     */
    static double julianCycle(JulianDate days, double lw) {
        double value = days.toFractionalDays() - J0 - lw / TWO_PI;
        double fraction = value % 1;
        if (fraction >= 0.5) {
            return Math.ceil(value);
        }
        return Math.floor(value);
    }

    private static double approxTransit(double hourAngle, double lw, double n) {
        return J0 + (hourAngle + lw) / TWO_PI + n;
    }

    private static double solarTransitJ(double ds, double m, double l) {
        return JulianDate.J2000 + ds + 0.0053 * Math.sin(m) - 0.0069 * Math.sin(2 * l);
    }

    private static double hourAngle(double h, double phi, double dec) {
        return Math.acos((Math.sin(h) - Math.sin(phi) * Math.sin(dec)) / (Math.cos(phi) * Math.cos(dec)));
    }

    private static double getSetJ(double h, double lw, double phi, double dec, double n, double m, double l) {
        double w = hourAngle(h, phi, dec);
        double a = approxTransit(w, lw, n);
        return solarTransitJ(a, m, l);
    }

    private static Instant toInstant(double julianDays) {
        return JulianDate.fromFractionalDays(julianDays).toInstant();
    }
}
