package at.sv.astro.time;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JulianDateTest {

    private void assertJulianDate(JulianDate julianDate, long julianDayNumber, long timeOfDay) {
        assertThat("Julian day number differs", julianDate.getJulianDayNumber(), is(julianDayNumber));
        assertThat("Time of day differs", julianDate.getTimeOfDay(), is(timeOfDay));
    }

    private void assertRoundTrip(String instant) {
        Instant time = Instant.parse(instant);
        assertThat(JulianDate.fromInstant(time).toInstant(), is(time));
    }

    @Test
    void fromInstant_noon_startsNewJulianDay() {
        assertJulianDate(JulianDate.fromInstant(Instant.parse("2004-04-01T12:00:00Z")), 2453097, 0);
    }

    @Test
    void fromInstant_evening_timeCountedFromNoon() {
        assertJulianDate(JulianDate.fromInstant(Instant.parse("2014-07-29T19:03:25Z")), 2456868, 25405L * 1_000_000_000L);
    }

    @Test
    void fromInstant_beforeNoon_belongsToPreviousJulianDay() {
        assertJulianDate(JulianDate.fromInstant(Instant.parse("2004-04-01T11:59:59Z")), 2453096, 86399L * 1_000_000_000L);
    }

    @Test
    void fromInstant_unixEpoch() {
        assertJulianDate(JulianDate.fromInstant(Instant.EPOCH), JulianDate.J1970 - 1, 43200L * 1_000_000_000L);
    }

    @Test
    void toInstant_isExactInverse() {
        assertRoundTrip("2014-07-29T19:03:25Z");
        assertRoundTrip("2014-07-29T19:03:25.123456789Z");
        assertRoundTrip("2000-01-01T12:00:00Z");
        assertRoundTrip("2000-01-01T11:59:59.999999999Z");
        assertRoundTrip("1969-12-31T23:59:59.500Z");
        assertRoundTrip("1900-02-28T03:14:15.926535897Z");
        assertRoundTrip("2100-12-31T23:59:59.000000001Z");
    }

    @Test
    void toDaysSinceJ2000_j2000Epoch_isZero() {
        assertJulianDate(JulianDate.toDaysSinceJ2000(Instant.parse("2000-01-01T12:00:00Z")), 0, 0);
    }

    @Test
    void toDaysSinceJ2000_beforeEpoch_negativeDays_positiveTime() {
        assertJulianDate(JulianDate.toDaysSinceJ2000(Instant.parse("1999-12-31T18:00:00Z")), -1, 21600L * 1_000_000_000L);
    }

    @Test
    void fromFractionalDays_splitsFraction_noNoonShift() {
        JulianDate julianDate = JulianDate.fromFractionalDays(2451545.25);

        assertJulianDate(julianDate, 2451545, 21600L * 1_000_000_000L);
        assertThat(julianDate.toInstant(), is(Instant.parse("2000-01-01T18:00:00Z")));
    }

    @Test
    void fromFractionalDays_toFractionalDays() {
        assertThat(JulianDate.fromFractionalDays(2451545.5).toFractionalDays(), is(2451545.5));
    }

    @Test
    void dayAndTime_fromDayAndTime() {
        JulianDate julianDate = JulianDate.fromDayAndTime(2456868, 25405L * 1_000_000_000L);

        long[] dayAndTime = julianDate.dayAndTime();

        assertThat(dayAndTime[0], is(2456868L));
        assertThat(dayAndTime[1], is(25405L * 1_000_000_000L));
        assertThat(julianDate, is(JulianDate.fromInstant(Instant.parse("2014-07-29T19:03:25Z"))));
    }

    @Test
    void fromDayAndTime_timeOutsideOfDay_exception() {
        assertThrows(IllegalArgumentException.class, () -> JulianDate.fromDayAndTime(0, -1));
        assertThrows(IllegalArgumentException.class, () -> JulianDate.fromDayAndTime(0, 86400L * 1_000_000_000L));
    }

    @Test
    void fromInstant_null_exception() {
        assertThrows(NullPointerException.class, () -> JulianDate.fromInstant(null));
    }

    @Test
    void toString_namesDayAndTime() {
        JulianDate julianDate = JulianDate.fromDayAndTime(2451545, 21600L * 1_000_000_000L);

        assertThat(julianDate.toString(), is("JulianDate(julianDayNumber=2451545, timeOfDay=21600000000000)"));
    }
}
