package at.sv.astro.moon;

/**
 * @param fraction illuminated fraction of the moon, from 0.0 (new moon) to 1.0 (full moon)
 * @param phase    from 0.0 (new moon) over 0.25 (first quarter), 0.5 (full moon), 0.75 (last quarter) back to 1.0
 * @param angle    midpoint angle in radians of the illuminated limb, reckoned eastward from the north point of the
 *                 disk. The moon is waxing if the angle is negative and waning if positive.
 */
public record MoonIllumination(double fraction, double phase, double angle) {

    public boolean isWaxing() {
        return angle < 0;
    }
}
