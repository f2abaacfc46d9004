package at.sv.astro.moon;

import at.sv.astro.time.JulianDate;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LunarEphemerisTest {

    @Test
    void moonCoordinates_referenceDistance() {
        MoonCoordinates moon = LunarEphemeris.moonCoordinates(
                JulianDate.toDaysSinceJ2000(Instant.parse("2014-07-29T19:03:25Z")));

        assertThat(moon.distance()).isCloseTo(404133.76960804936, within(1e-9));
    }

    @Test
    void moonCoordinates_declinationWithinLunarStandstillLimits() {
        Instant start = Instant.parse("2020-01-01T00:00:00Z");
        for (int day = 0; day < 19 * 365; day += 3) {
            MoonCoordinates moon = LunarEphemeris.moonCoordinates(JulianDate.toDaysSinceJ2000(start.plusSeconds(day * 86400L)));

            assertThat(Math.toDegrees(Math.abs(moon.declination()))).isLessThan(23.4397 + 5.128 + 0.01);
        }
    }
}
