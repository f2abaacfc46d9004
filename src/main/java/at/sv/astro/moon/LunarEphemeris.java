package at.sv.astro.moon;

import at.sv.astro.position.CoordinateMath;
import at.sv.astro.time.JulianDate;

import static at.sv.astro.position.CoordinateMath.RAD;

/**
 * Geocentric position of the moon, based on <a href="http://aa.quae.nl/en/reken/hemelpositie.html">aa.quae.nl</a>.
 */
public final class LunarEphemeris {

    private LunarEphemeris() {
    }

    private static final double LONGITUDE_AMPLITUDE = RAD * 6.289;
    private static final double LATITUDE_AMPLITUDE = RAD * 5.128;

    public static MoonCoordinates moonCoordinates(JulianDate daysSinceJ2000) {
        double d = daysSinceJ2000.toFractionalDays();

        double eclipticLongitude = RAD * (218.316 + 13.176396 * d);
        double meanAnomaly = RAD * (134.963 + 13.064993 * d);
        double meanDistance = RAD * (93.272 + 13.229350 * d);

        double longitude = eclipticLongitude + LONGITUDE_AMPLITUDE * Math.sin(meanAnomaly);
        double latitude = LATITUDE_AMPLITUDE * Math.sin(meanDistance);
        double distance = 385001 - 20905 * Math.cos(meanAnomaly);

        return new MoonCoordinates(CoordinateMath.declination(longitude, latitude),
                CoordinateMath.rightAscension(longitude, latitude), distance);
    }
}
