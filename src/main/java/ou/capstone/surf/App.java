package ou.capstone.surf;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.exceptions.SurfDataException;
import ou.capstone.surf.forecast.WeekForecast;
import ou.capstone.surf.forecast.WeekForecastAnalyzer;
import ou.capstone.surf.history.HistoricalPercentileEstimator;
import ou.capstone.surf.io.ConditionsSnapshot;
import ou.capstone.surf.io.ConditionsSnapshotReader;
import ou.capstone.surf.print.SpotReportPrinter;
import ou.capstone.surf.print.SpotView;
import ou.capstone.surf.profile.SurferProfile;
import ou.capstone.surf.score.RankedSpot;
import ou.capstone.surf.score.SpotRanker;
import ou.capstone.surf.score.SpotScoreCalculator;
import ou.capstone.surf.spots.LocationProfile;
import ou.capstone.surf.spots.SpotDirectory;
import ou.capstone.surf.sun.DawnPatrolStateMachine;
import ou.capstone.surf.sun.SunTimes;
import ou.capstone.surf.sun.SunTimesCalculator;
import ou.capstone.surf.tide.TideSeries;
import ou.capstone.surf.window.BestTimeWindowFinder;
import ou.capstone.surf.window.TimeWindow;

/**
 * Console driver for the surf conditions engine.
 *
 * Orchestrates the flow between components:
 * - Surfer profile parsing
 * - Conditions snapshot loading (readings fetched elsewhere)
 * - Ranking via SpotRanker
 * - Best window, dawn patrol and percentile per spot
 * - Optional week outlook for one spot
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final String DEFAULT_BOARD = "mid-length";
    static final String DEFAULT_SKILL = "intermediate";

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        // --conditions is checked by hand after the help case, so that
        // `--help` alone does not fail as a missing required option.
        final Option conditionsOption = Option.builder("c")
                .longOpt("conditions").hasArg()
                .desc("Conditions snapshot JSON file").get();
        final Option boardOption = Option.builder("b")
                .longOpt("board").hasArg()
                .desc("Board: longboard, mid-length or shortboard (default: " + DEFAULT_BOARD + ")").get();
        final Option skillOption = Option.builder("s")
                .longOpt("skill").hasArg()
                .desc("Skill: beginner, intermediate or expert (default: " + DEFAULT_SKILL + ")").get();
        final Option nowOption = Option.builder()
                .longOpt("now").hasArg()
                .desc("Evaluate at this local time, e.g. 2024-10-26T06:15 (default: snapshot time)").get();
        final Option weekOption = Option.builder("w")
                .longOpt("week").hasArg()
                .desc("Also print the seven day outlook for this spot id").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( conditionsOption );
        options.addOption( boardOption );
        options.addOption( skillOption );
        options.addOption( nowOption );
        options.addOption( weekOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("app",
                    "Surf Almanac Options", options,
                    "Readings are not fetched; pass a snapshot file with --conditions.",
                    true);
            exitHandler.exit(0);
            return;
        }

        if (!line.hasOption(conditionsOption)) {
            throw new ParseException("Invalid options: conditions snapshot file is required");
        }

        logger.info("Surf Almanac starting");

        try {
            // Step 1: Who is surfing
            final SurferProfile surfer = SurferProfile.of(
                    line.getOptionValue(boardOption, DEFAULT_BOARD),
                    line.getOptionValue(skillOption, DEFAULT_SKILL));
            logger.info("Surfer profile: {}", surfer);

            // Step 2: Load readings
            ConditionsSnapshot snapshot = new ConditionsSnapshotReader()
                    .read(Path.of(line.getOptionValue(conditionsOption)));
            if (line.hasOption(nowOption)) {
                snapshot = snapshot.withNow(parseNow(line.getOptionValue(nowOption), snapshot));
            }

            // Step 3: Rank
            final SpotDirectory directory = SpotDirectory.loadDefault();
            final Map<String, Measurement> measurements = snapshot.measurementsFor(directory.all());
            final List<RankedSpot> ranked = new SpotRanker(new SpotScoreCalculator())
                    .rank(directory.all(), measurements, surfer);

            // Step 4: Display
            final SpotReportPrinter printer = new SpotReportPrinter();
            displayResults(ranked, snapshot, surfer, printer);

            // Step 5: Week outlook
            if (line.hasOption(weekOption)) {
                final String spotId = line.getOptionValue(weekOption);
                final Optional<LocationProfile> spot = directory.findById(spotId);
                if (spot.isEmpty()) {
                    logger.error("Unknown spot id: {}", spotId);
                    System.err.println("Unknown spot id: " + spotId);
                    exitHandler.exit(1);
                    return;
                }
                displayWeek(spot.get(), snapshot, printer);
            }

            logger.info("Surf Almanac completed successfully");
        } catch (final SurfDataException e) {
            logger.error("Conditions data error: {}", e.getMessage());
            System.err.println("\nConditions Error: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalStateException e) {
            logger.error("Configuration error: {}", e.getMessage());
            System.err.println("\nConfiguration Error: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            exitHandler.exit(1);

        } catch (final Exception e) {
            logger.error("Unexpected error during execution", e);
            System.err.println("\nUnexpected Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    static ZonedDateTime parseNow(final String text, final ConditionsSnapshot snapshot) {
        try {
            return LocalDateTime.parse(text).atZone(snapshot.getZone());
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("--now must look like 2024-10-26T06:15, got: " + text, e);
        }
    }

    /**
     * Builds one printable row per ranked spot and prints the table.
     */
    static List<SpotView> displayResults(final List<RankedSpot> ranked,
                                         final ConditionsSnapshot snapshot,
                                         final SurferProfile surfer,
                                         final SpotReportPrinter printer) {
        final ZonedDateTime now = snapshot.getNow();
        final LocalDate today = now.toLocalDate();
        final BestTimeWindowFinder windowFinder = new BestTimeWindowFinder();
        final HistoricalPercentileEstimator percentiles = new HistoricalPercentileEstimator();

        final List<SpotView> views = new ArrayList<>(ranked.size());
        int rank = 1;
        for (final RankedSpot r : ranked) {
            final LocationProfile spot = r.spot();
            final TimeWindow window = windowFinder.find(snapshot.tideFor(spot.tideStation()), today, spot.bestTide());
            final SunTimes sun = SunTimesCalculator.compute(spot.coordinate(), today, snapshot.getZone());
            final Integer drive = snapshot.reading(spot.id())
                    .map(ConditionsSnapshot.SpotReading::driveMinutes)
                    .orElse(null);
            final String dawn = DawnPatrolStateMachine.evaluate(now, sun, drive).getMessage();
            final String percentile = r.result().hasData()
                    ? percentiles.context(r.score(), now.getMonth())
                    : null;

            views.add(new SpotView(
                    rank++,
                    spot.name(),
                    r.score(),
                    r.result().rating().label(),
                    window == null ? null : window.startLabel() + " - " + window.endLabel(),
                    dawn,
                    percentile,
                    r.result().breakdown()));
        }

        System.out.println("\n" + "=".repeat(80));
        System.out.println("Surf spots for a " + surfer + " surfer at " + now.toLocalDateTime());
        System.out.println("Sorted by Score (Best First)");
        System.out.println("=".repeat(80));
        System.out.println();
        printer.print(views);
        return views;
    }

    private static void displayWeek(final LocationProfile spot,
                                    final ConditionsSnapshot snapshot,
                                    final SpotReportPrinter printer) {
        final LocalDate start = snapshot.getNow().toLocalDate();
        final TideSeries series = snapshot.tideFor(spot.tideStation());
        final Map<LocalDate, TideSeries> byDate = new LinkedHashMap<>();
        for (int i = 0; i < WeekForecastAnalyzer.DAYS; i++) {
            byDate.put(start.plusDays(i), series);
        }
        final WeekForecast week = new WeekForecastAnalyzer()
                .analyze(byDate, spot, start, snapshot.getZone());

        System.out.println("Week outlook: " + spot.name());
        System.out.println("=".repeat(80));
        System.out.println(printer.renderWeek(week));
        System.out.println();
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
