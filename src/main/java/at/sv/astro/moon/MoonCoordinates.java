package at.sv.astro.moon;

/**
 * Geocentric equatorial coordinates of the moon.
 *
 * @param declination    in radians
 * @param rightAscension in radians
 * @param distance       distance between the centers of earth and moon in km
 */
public record MoonCoordinates(double declination, double rightAscension, double distance) {
}
