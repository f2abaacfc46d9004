package at.sv.astro.moon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MoonCalculatorTest {

    private static final double EPS = 1e-15;
    private static final Instant INSTANT = Instant.parse("2014-07-29T19:03:25Z");

    @Test
    void getMoonPosition_referenceValues() {
        MoonPosition position = MoonCalculator.getMoonPosition(INSTANT, 31.783, 35.233);

        assertThat(position.azimuth()).isCloseTo(1.8424006017910686, within(EPS));
        assertThat(position.altitude()).isCloseTo(-0.2419311867071057, within(EPS));
        assertThat(position.distance()).isCloseTo(404133.76960804936, within(1e-9));
    }

    @Test
    void getMoonIllumination_referenceValues() {
        MoonIllumination illumination = MoonCalculator.getMoonIllumination(INSTANT);

        assertThat(illumination.fraction()).isCloseTo(0.07382281607579783, within(EPS));
        assertThat(illumination.phase()).isCloseTo(0.08758701583098588, within(EPS));
        assertThat(illumination.angle()).isCloseTo(-1.0922384803528917, within(EPS));
        assertThat(illumination.isWaxing()).isTrue();
    }

    @Test
    void getMoonIllumination_fullMoon() {
        MoonIllumination illumination = MoonCalculator.getMoonIllumination(Instant.parse("2023-02-05T18:28:00Z"));

        assertThat(illumination.fraction()).isGreaterThan(0.99);
        assertThat(illumination.phase()).isCloseTo(0.5, within(0.03));
    }

    @Test
    void getMoonIllumination_newMoon() {
        MoonIllumination illumination = MoonCalculator.getMoonIllumination(Instant.parse("2023-02-20T07:06:00Z"));

        assertThat(illumination.fraction()).isLessThan(0.01);
        assertThat(Math.min(illumination.phase(), 1 - illumination.phase())).isLessThan(0.02);
    }

    @Test
    void getMoonIllumination_lastQuarter_waning() {
        MoonIllumination illumination = MoonCalculator.getMoonIllumination(Instant.parse("2023-02-13T16:01:00Z"));

        assertThat(illumination.fraction()).isCloseTo(0.5, within(0.05));
        assertThat(illumination.phase()).isCloseTo(0.75, within(0.02));
        assertThat(illumination.isWaxing()).isFalse();
    }

    @Test
    @DisplayName("Fraction and phase stay within [0, 1], phase follows the sign of the limb angle")
    void getMoonIllumination_ranges() {
        Instant start = Instant.parse("2023-01-01T00:00:00Z");
        for (int hour = 0; hour < 24 * 60; hour += 5) {
            MoonIllumination illumination = MoonCalculator.getMoonIllumination(start.plus(Duration.ofHours(hour)));

            assertThat(illumination.fraction()).isBetween(0.0, 1.0);
            assertThat(illumination.phase()).isBetween(0.0, 1.0);
            if (illumination.angle() < 0) {
                assertThat(illumination.phase()).isLessThanOrEqualTo(0.5);
            } else {
                assertThat(illumination.phase()).isGreaterThanOrEqualTo(0.5);
            }
        }
    }

    @Test
    @DisplayName("A limb angle of exactly zero counts as waning")
    void phase_zeroAngle_waning() {
        double inc = 1.2;

        assertThat(MoonCalculator.phase(inc, 0.0)).isEqualTo(0.5 + 0.5 * inc / Math.PI);
        assertThat(MoonCalculator.phase(inc, 0.1)).isEqualTo(0.5 + 0.5 * inc / Math.PI);
        assertThat(MoonCalculator.phase(inc, -0.1)).isEqualTo(0.5 - 0.5 * inc / Math.PI);
    }

    @Test
    @DisplayName("Azimuth within (-PI, PI], distance between perigee and apogee of the model")
    void getMoonPosition_ranges() {
        Instant start = Instant.parse("2023-01-01T00:00:00Z");
        for (int hour = 0; hour < 24 * 60; hour += 7) {
            MoonPosition position = MoonCalculator.getMoonPosition(start.plus(Duration.ofHours(hour)), 48.20, 16.39);

            assertThat(position.azimuth()).isGreaterThan(-Math.PI).isLessThanOrEqualTo(Math.PI);
            assertThat(position.distance()).isBetween(385001.0 - 20905, 385001.0 + 20905);
        }
    }
}
