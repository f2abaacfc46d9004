package at.sv.astro;

import at.sv.astro.sun.InvalidSunEventExpression;
import at.sv.astro.sun.SunCalculator;
import at.sv.astro.sun.SunEventResolver;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

@Command(name = "AstroCalc", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the position of sun and moon, the sun event times and the moon illumination.")
public final class AstroCalc implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(AstroCalc.class);

    enum Format {TEXT, JSON}

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0", arity = "0..1", paramLabel = "INSTANT",
            description = "The ISO-8601 instant to calculate for, e.g. 2014-07-29T19:03:25Z. Default: now")
    String instant;
    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:ZONE}",
            description = "The time zone used to display the sun event times. Default: the system zone")
    String zone;
    @Option(names = "--time", paramLabel = "<angle:rise:set>",
            description = "Adds a custom sun event pair, reached at the given sun altitude in degrees. " +
                          "Either name may be empty. Example: --time=-4:blueHourEnd:blueHour")
    List<String> customTimes = new ArrayList<>();
    @Option(names = "--event", paramLabel = "<expression>",
            description = "Additionally resolves a sun event expression for the day of the instant, " +
                          "e.g. sunrise, golden_hour-30 or 07:30.")
    List<String> eventExpressions = new ArrayList<>();
    @Option(names = "--format",
            defaultValue = "${env:FORMAT:-TEXT}",
            description = "The output format, one of: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Format format;

    private final Supplier<Instant> currentTime;
    private final ObjectMapper mapper;

    public AstroCalc() {
        this(Instant::now);
    }

    AstroCalc(Supplier<Instant> currentTime) {
        this.currentTime = currentTime;
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new AstroCalc()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "calc");
        assertConfigurationParameters();
        Instant calculationTime = parseInstant();
        ZoneId zoneId = parseZone();
        SunCalculator sunCalculator = createSunCalculator();
        LOG.info("Calculating for {} at {},{}.", calculationTime, latitude, longitude);

        AstroReport report = AstroReport.create(sunCalculator, calculationTime, zoneId, latitude, longitude);
        PrintWriter out = getOut();
        if (format == Format.JSON) {
            out.println(toJson(report));
        } else {
            out.print(report.toText());
        }
        printEventExpressions(sunCalculator, calculationTime.atZone(zoneId), out);
        out.flush();
    }

    private void assertConfigurationParameters() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        customTimes.forEach(this::parseCustomTime);
    }

    private String[] parseCustomTime(String customTime) {
        String[] parts = customTime.split(":", -1);
        if (parts.length != 3) {
            fail("--time must have the form <angle>:<riseName>:<setName>, but was '" + customTime + "'");
        }
        try {
            Double.parseDouble(parts[0]);
        } catch (NumberFormatException e) {
            fail("--time angle must be a number in degrees, but was '" + parts[0] + "'");
        }
        if (parts[1].isBlank() && parts[2].isBlank()) {
            fail("--time needs at least one event name: '" + customTime + "'");
        }
        return parts;
    }

    private Instant parseInstant() {
        if (instant == null) {
            return currentTime.get();
        }
        try {
            return Instant.parse(instant);
        } catch (DateTimeParseException e) {
            fail("Invalid instant '" + instant + "': " + e.getMessage());
            return null;
        }
    }

    private ZoneId parseZone() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("Invalid --zone '" + zone + "': " + e.getMessage());
            return null;
        }
    }

    private SunCalculator createSunCalculator() {
        SunCalculator sunCalculator = new SunCalculator();
        for (String customTime : customTimes) {
            String[] parts = parseCustomTime(customTime);
            sunCalculator.addTime(Double.parseDouble(parts[0]), parts[1].trim(), parts[2].trim());
        }
        return sunCalculator;
    }

    private void printEventExpressions(SunCalculator sunCalculator, ZonedDateTime dateTime, PrintWriter out) {
        if (eventExpressions.isEmpty()) {
            return;
        }
        SunEventResolver resolver = new SunEventResolver(sunCalculator, latitude, longitude);
        LOG.debug("Sun events of {}:\n{}", dateTime.toLocalDate(), resolver.toDebugString(dateTime));
        for (String expression : eventExpressions) {
            try {
                out.println(expression + " = " + resolver.resolve(expression, dateTime).toOffsetDateTime());
            } catch (InvalidSunEventExpression e) {
                fail("--event " + e.getMessage());
            }
        }
    }

    private String toJson(AstroReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out, true);
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
