package at.sv.astro.sun;

import java.util.Objects;

/**
 * A named sun event pair, reached when the sun crosses the given altitude in the morning and in the evening.
 *
 * @param angle    the altitude of the sun's center in degrees
 * @param riseName the name of the morning event, or an empty string if it should not be reported
 * @param setName  the name of the evening event, or an empty string if it should not be reported
 */
public record SunTimeDefinition(double angle, String riseName, String setName) {

    public SunTimeDefinition {
        Objects.requireNonNull(riseName, "riseName");
        Objects.requireNonNull(setName, "setName");
    }

    public boolean hasRise() {
        return !riseName.isEmpty();
    }

    public boolean hasSet() {
        return !setName.isEmpty();
    }
}
