package at.sv.astro.position;

/**
 * Position on the celestial sphere relative to the earth's equator, both angles in radians.
 */
public record EquatorialCoordinates(double declination, double rightAscension) {
}
