package at.sv.astro.sun;

import at.sv.astro.position.CoordinateMath;
import at.sv.astro.position.EquatorialCoordinates;
import at.sv.astro.position.HorizontalPosition;
import at.sv.astro.time.JulianDate;

import java.time.Instant;

import static at.sv.astro.position.CoordinateMath.RAD;

/**
 * Position of the sun, based on the formulas of <a href="http://aa.quae.nl/en/reken/zonpositie.html">aa.quae.nl</a>.
 */
public final class SolarEphemeris {

    private SolarEphemeris() {
    }

    private static final long MEAN_ANOMALY_COEF0_NANO = 357_529_100_000L; // 357.5291 deg
    private static final long MEAN_ANOMALY_COEF1_NANO = 985_600_280L; // 0.98560028 deg per day
    private static final double PERIHELION = RAD * 102.9372;

    /**
     * @param daysSinceJ2000 the date, day number counted from J2000
     * @return the mean anomaly of the sun in radians, negative values are shifted by 2PI
     */
    public static double solarMeanAnomaly(JulianDate daysSinceJ2000) {
        double meanAnomaly = RAD * CoordinateMath.periodicDegrees(daysSinceJ2000, MEAN_ANOMALY_COEF0_NANO,
                MEAN_ANOMALY_COEF1_NANO);
        if (meanAnomaly < 0) {
            meanAnomaly += CoordinateMath.TWO_PI;
        }
        return meanAnomaly;
    }

    public static double eclipticLongitude(double meanAnomaly) {
        double center = RAD * (1.9148 * Math.sin(meanAnomaly) + 0.02 * Math.sin(2 * meanAnomaly) +
                               0.0003 * Math.sin(3 * meanAnomaly)); // equation of center
        return meanAnomaly + center + PERIHELION + Math.PI;
    }

    public static EquatorialCoordinates sunCoordinates(JulianDate daysSinceJ2000) {
        double eclipticLongitude = eclipticLongitude(solarMeanAnomaly(daysSinceJ2000));
        return CoordinateMath.equatorial(eclipticLongitude, 0);
    }

    /**
     * @return azimuth and altitude of the sun in radians, for a location given in degrees
     */
    public static HorizontalPosition getPosition(Instant instant, double latitude, double longitude) {
        double lw = RAD * -longitude;
        double phi = RAD * latitude;
        JulianDate days = JulianDate.toDaysSinceJ2000(instant);

        EquatorialCoordinates sun = sunCoordinates(days);
        double hourAngle = CoordinateMath.siderealTime(days, lw) - sun.rightAscension();

        return new HorizontalPosition(CoordinateMath.azimuth(hourAngle, phi, sun.declination()),
                CoordinateMath.altitude(hourAngle, phi, sun.declination()));
    }
}
