package at.sv.astro.time;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * An instant expressed as a Julian day number and the nanoseconds elapsed since the start of that day.
 * <p>
 * Julian days begin at noon UTC, see <a href="http://aa.quae.nl/en/reken/juliaansedag.html">aa.quae.nl</a>.
 * Keeping the day count as an integer avoids the precision loss of a single floating point day value.
 */
@EqualsAndHashCode
@Getter
@ToString
public final class JulianDate {

    static final long DAY_SECONDS = 60 * 60 * 24;
    static final long HALF_DAY_SECONDS = 60 * 60 * 12;
    static final long NANOS_PER_SECOND = 1_000_000_000L;
    static final long NANOS_PER_DAY = DAY_SECONDS * NANOS_PER_SECOND;
    static final long HALF_DAY_NANOS = HALF_DAY_SECONDS * NANOS_PER_SECOND;
    /**
     * Julian day number of the unix epoch 1970-01-01.
     */
    public static final long J1970 = 2440588;
    /**
     * Julian day number of the J2000 epoch.
     */
    public static final long J2000 = 2451545;

    private final long julianDayNumber;
    private final long timeOfDay;

    private JulianDate(long julianDayNumber, long timeOfDay) {
        this.julianDayNumber = julianDayNumber;
        this.timeOfDay = timeOfDay;
    }

    public static JulianDate fromInstant(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        long epochSecond = instant.getEpochSecond();
        long daysSince1970 = Math.floorDiv(epochSecond, DAY_SECONDS);
        long secondOfDay = Math.floorMod(epochSecond, DAY_SECONDS);
        long day = daysSince1970 + J1970;
        long time = secondOfDay * NANOS_PER_SECOND + instant.getNano();
        if (time < HALF_DAY_NANOS) {
            return new JulianDate(day - 1, time + HALF_DAY_NANOS);
        }
        return new JulianDate(day, time - HALF_DAY_NANOS);
    }

    /**
     * @return the Julian date of the instant, with the day number counted from the J2000 epoch
     */
    public static JulianDate toDaysSinceJ2000(Instant instant) {
        JulianDate julianDate = fromInstant(instant);
        return new JulianDate(julianDate.julianDayNumber - J2000, julianDate.timeOfDay);
    }

    /**
     * Splits a fractional Julian day value into its whole days and the nanoseconds of the remainder.
     * No noon shift is applied, the value is expected to already be a Julian day.
     */
    public static JulianDate fromFractionalDays(double julianDays) {
        long day = (long) julianDays;
        double fraction = julianDays - day;
        return new JulianDate(day, (long) (fraction * DAY_SECONDS * 1e9));
    }

    public static JulianDate fromDayAndTime(long julianDayNumber, long timeOfDay) {
        if (timeOfDay < 0 || timeOfDay >= NANOS_PER_DAY) {
            throw new IllegalArgumentException("Time of day must be within [0, " + NANOS_PER_DAY + ") ns, but was "
                                               + timeOfDay);
        }
        return new JulianDate(julianDayNumber, timeOfDay);
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond((julianDayNumber - J1970) * DAY_SECONDS + HALF_DAY_SECONDS, timeOfDay);
    }

    /**
     * @return the julian day number and the nanoseconds since the beginning of that day
     */
    public long[] dayAndTime() {
        return new long[]{julianDayNumber, timeOfDay};
    }

    /**
     * @return the date as a single floating point day count. Loses precision for large day numbers.
     */
    public double toFractionalDays() {
        return julianDayNumber + timeOfDay / (double) NANOS_PER_DAY;
    }
}
