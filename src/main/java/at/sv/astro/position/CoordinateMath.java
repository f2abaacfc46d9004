package at.sv.astro.position;

import at.sv.astro.time.JulianDate;

/**
 * Conversions between ecliptic, equatorial and horizontal coordinates.
 * <p>
 * Formulas from <a href="http://aa.quae.nl/en/reken/zonpositie.html">aa.quae.nl</a>. All angles are in radians.
 */
public final class CoordinateMath {

    private CoordinateMath() {
    }

    public static final double RAD = Math.PI / 180;
    public static final double TWO_PI = 2 * Math.PI;
    /**
     * Obliquity of the earth, 23.4397 degrees. Written out as literal, as multiplying with {@link #RAD} is off
     * by one ulp.
     */
    public static final double OBLIQUITY = 0.4090999406797149;

    private static final long FULL_CIRCLE_NANO = 360L * 1_000_000_000L;
    private static final long SIDEREAL_COEF0_NANO = 280_160_000_000L; // 280.16 deg
    private static final long SIDEREAL_COEF1_NANO = 360_985_623_500L; // 360.9856235 deg per day
    private static final double DAY_SECONDS = 86400;

    public static double rightAscension(double eclipticLongitude, double eclipticLatitude) {
        return Math.atan2(Math.sin(eclipticLongitude) * Math.cos(OBLIQUITY) - Math.tan(eclipticLatitude) * Math.sin(OBLIQUITY),
                Math.cos(eclipticLongitude));
    }

    public static double declination(double eclipticLongitude, double eclipticLatitude) {
        return Math.asin(Math.sin(eclipticLatitude) * Math.cos(OBLIQUITY) +
                         Math.cos(eclipticLatitude) * Math.sin(OBLIQUITY) * Math.sin(eclipticLongitude));
    }

    public static EquatorialCoordinates equatorial(double eclipticLongitude, double eclipticLatitude) {
        return new EquatorialCoordinates(declination(eclipticLongitude, eclipticLatitude),
                rightAscension(eclipticLongitude, eclipticLatitude));
    }

    public static double azimuth(double hourAngle, double latitude, double declination) {
        return Math.atan2(Math.sin(hourAngle),
                Math.cos(hourAngle) * Math.sin(latitude) - Math.tan(declination) * Math.cos(latitude));
    }

    public static double altitude(double hourAngle, double latitude, double declination) {
        return Math.asin(Math.sin(latitude) * Math.sin(declination) +
                         Math.cos(latitude) * Math.cos(declination) * Math.cos(hourAngle));
    }

    /**
     * @param daysSinceJ2000 the date, day number counted from J2000
     * @param lw             the negated observer longitude in radians
     * @return the local sidereal time in radians, negative values are shifted by 2PI
     */
    public static double siderealTime(JulianDate daysSinceJ2000, double lw) {
        double siderealTime = RAD * periodicDegrees(daysSinceJ2000, SIDEREAL_COEF0_NANO, SIDEREAL_COEF1_NANO) - lw;
        if (siderealTime < 0) {
            siderealTime += TWO_PI;
        }
        return siderealTime;
    }

    /**
     * Evaluates {@code coef0 + coef1 * days} in degrees, with both coefficients scaled by 10^9. The whole days are
     * multiplied and reduced modulo 360 degrees with integer arithmetic, only the time of day is added as floating
     * point value. Multiplying the rate with a floating point day count loses too much precision.
     *
     * @return the angle in degrees, only the whole days are reduced modulo 360
     */
    public static double periodicDegrees(JulianDate days, long coef0Nano, long coef1Nano) {
        long reduced = (coef0Nano + days.getJulianDayNumber() * coef1Nano) % FULL_CIRCLE_NANO;
        return reduced / 1e9 + days.getTimeOfDay() / DAY_SECONDS * (coef1Nano / 1e18);
    }
}
