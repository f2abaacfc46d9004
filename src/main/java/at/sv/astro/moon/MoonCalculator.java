package at.sv.astro.moon;

import at.sv.astro.position.CoordinateMath;
import at.sv.astro.position.EquatorialCoordinates;
import at.sv.astro.sun.SolarEphemeris;
import at.sv.astro.time.JulianDate;

import java.time.Instant;

import static at.sv.astro.position.CoordinateMath.RAD;

public final class MoonCalculator {

    private MoonCalculator() {
    }

    /**
     * Distance from the earth to the sun in km.
     */
    public static final double SUN_DISTANCE = 149598000;

    private static final double REFRACTION_0 = RAD * 0.017;
    private static final double REFRACTION_1 = 0.17907078125461823; // 10.26 deg, RAD * 10.26 is off by one ulp
    private static final double REFRACTION_2 = RAD * 5.10;

    public static MoonPosition getMoonPosition(Instant instant, double latitude, double longitude) {
        double lw = RAD * -longitude;
        double phi = RAD * latitude;
        JulianDate days = JulianDate.toDaysSinceJ2000(instant);

        MoonCoordinates moon = LunarEphemeris.moonCoordinates(days);
        double hourAngle = CoordinateMath.siderealTime(days, lw) - moon.rightAscension();
        double h = CoordinateMath.altitude(hourAngle, phi, moon.declination());
        // altitude correction for refraction
        h = h + REFRACTION_0 / Math.tan(h + REFRACTION_1 / (h + REFRACTION_2));

        return new MoonPosition(CoordinateMath.azimuth(hourAngle, phi, moon.declination()), h, moon.distance());
    }

    /**
     * Based on <a href="http://idlastro.gsfc.nasa.gov/ftp/pro/astro/mphase.pro">mphase.pro</a> and chapter 48 of
     * "Astronomical Algorithms" 2nd edition by Jean Meeus (Willmann-Bell, Richmond) 1998.
     */
    public static MoonIllumination getMoonIllumination(Instant instant) {
        JulianDate days = JulianDate.toDaysSinceJ2000(instant);
        EquatorialCoordinates sun = SolarEphemeris.sunCoordinates(days);
        MoonCoordinates moon = LunarEphemeris.moonCoordinates(days);

        double sDec = sun.declination();
        double sRa = sun.rightAscension();
        double mDec = moon.declination();
        double mRa = moon.rightAscension();

        double elongation = Math.acos(Math.sin(sDec) * Math.sin(mDec) + Math.cos(sDec) * Math.cos(mDec) * Math.cos(sRa - mRa));
        double inc = Math.atan2(SUN_DISTANCE * Math.sin(elongation), moon.distance() - SUN_DISTANCE * Math.cos(elongation));
        double angle = Math.atan2(Math.cos(sDec) * Math.sin(sRa - mRa),
                Math.sin(sDec) * Math.cos(mDec) - Math.cos(sDec) * Math.sin(mDec) * Math.cos(sRa - mRa));

        double fraction = (1 + Math.cos(inc)) / 2;
        return new MoonIllumination(fraction, phase(inc, angle), angle);
    }

    /**
     * An angle of exactly zero counts as waning.
     */
    static double phase(double inc, double angle) {
        double sign = angle < 0 ? -1.0 : 1.0;
        return 0.5 + 0.5 * inc * sign / Math.PI;
    }
}
