package at.sv.astro.moon;

/**
 * @param azimuth  in radians, measured from south to west
 * @param altitude in radians, corrected for atmospheric refraction
 * @param distance to the moon in km
 */
public record MoonPosition(double azimuth, double altitude, double distance) {
}
