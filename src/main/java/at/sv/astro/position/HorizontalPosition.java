package at.sv.astro.position;

/**
 * Apparent position in the sky of an observer, in radians.
 *
 * @param azimuth  direction along the horizon, measured from south to west, within (-PI, PI]
 * @param altitude height above the horizon, within [-PI/2, PI/2]
 */
public record HorizontalPosition(double azimuth, double altitude) {

    public double azimuthDegrees() {
        return Math.toDegrees(azimuth);
    }

    public double altitudeDegrees() {
        return Math.toDegrees(altitude);
    }
}
