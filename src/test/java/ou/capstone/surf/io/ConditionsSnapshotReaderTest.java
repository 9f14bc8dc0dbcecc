package ou.capstone.surf.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.exceptions.SurfDataException;
import ou.capstone.surf.spots.SpotDirectory;
import ou.capstone.surf.tide.TidePhase;

final class ConditionsSnapshotReaderTest {

    private final ConditionsSnapshotReader reader = new ConditionsSnapshotReader();

    private static Path sample() throws Exception {
        return Path.of(ConditionsSnapshotReaderTest.class
                .getResource("/snapshots/sample-conditions.json").toURI());
    }

    @Test
    void readsSampleSnapshot() throws Exception {
        final ConditionsSnapshot snapshot = reader.read(sample());

        assertEquals(ZoneId.of("America/Los_Angeles"), snapshot.getZone());
        assertEquals(LocalDateTime.of(2024, 10, 26, 7, 30), snapshot.getNow().toLocalDateTime());

        final ConditionsSnapshot.SpotReading ob = snapshot.reading("ocean-beach-sf").orElseThrow();
        assertEquals(5.0, ob.waveHeightFt());
        assertEquals(20, ob.driveMinutes());
        assertEquals(55.0, ob.waterTempF());

        // no drive time or temperatures given
        final ConditionsSnapshot.SpotReading fortPoint = snapshot.reading("fort-point").orElseThrow();
        assertNull(fortPoint.driveMinutes());
        assertNull(fortPoint.airTempF());

        assertEquals(24, snapshot.tideFor("9414290").hourly().size());
        assertEquals(2, snapshot.tideFor("9414290").highLow().size());
    }

    @Test
    void negativeWaveHeightSkipsOnlyThatSpot() throws Exception {
        final ConditionsSnapshot snapshot = reader.read(sample());

        assertFalse(snapshot.reading("muir-beach").isPresent());
        assertTrue(snapshot.reading("bolinas").isPresent());
    }

    @Test
    void badDriveTimeSkipsOnlyThatSpot() throws Exception {
        final String json = "{\"now\": \"2024-10-26T07:30:00\", \"spots\": ["
                + reading("ocean-beach-sf", "-5") + ","
                + reading("bolinas", "\"abc\"") + ","
                + reading("stinson-beach", "12.5") + ","
                + reading("fort-point", "15") + ","
                + reading("muir-beach", "null") + "]}";

        final ConditionsSnapshot snapshot = reader.parse(json);

        assertFalse(snapshot.reading("ocean-beach-sf").isPresent());
        assertFalse(snapshot.reading("bolinas").isPresent());
        assertFalse(snapshot.reading("stinson-beach").isPresent());
        assertEquals(15, snapshot.reading("fort-point").orElseThrow().driveMinutes());
        assertNull(snapshot.reading("muir-beach").orElseThrow().driveMinutes());
    }

    private static String reading(final String spotId, final String driveMinutes) {
        return "{\"spotId\": \"" + spotId + "\", \"waveHeightFt\": 3.0, \"wavePeriodS\": 11,"
                + " \"swellDirectionDeg\": 280, \"windSpeedMph\": 5, \"windDirectionDeg\": 90,"
                + " \"driveMinutes\": " + driveMinutes + "}";
    }

    @Test
    void measurementsResolveTideAtEachSpot() throws Exception {
        final ConditionsSnapshot snapshot = reader.read(sample());
        final Map<String, Measurement> measurements =
                snapshot.measurementsFor(SpotDirectory.loadDefault().all());

        assertEquals(3, measurements.size());
        final Measurement ob = measurements.get("ocean-beach-sf");
        // halfway between the 07:00 (3.34 ft) and 08:00 (2.24 ft) samples
        assertEquals(2.79, ob.getTideHeightFt(), 1e-9);
        assertEquals(TidePhase.FALLING, ob.getTidePhase());
        assertEquals(55.0, ob.getWaterTempF().getAsDouble());
    }

    @Test
    void unknownStationGivesEmptySeries() throws Exception {
        final ConditionsSnapshot snapshot = reader.read(sample());
        assertTrue(snapshot.tideFor("0000000").isEmpty());
        assertTrue(snapshot.tideFor(null).isEmpty());
    }

    @Test
    void zoneDefaultsToUtc() throws Exception {
        final ConditionsSnapshot snapshot = reader.parse("{\"now\": \"2024-10-26T07:30:00\"}");
        assertEquals(ZoneId.of("UTC"), snapshot.getZone());
        assertFalse(snapshot.reading("ocean-beach-sf").isPresent());
    }

    @Test
    void missingFileIsADataError(@TempDir final Path dir) {
        assertThrows(SurfDataException.class, () -> reader.read(dir.resolve("nope.json")));
    }

    @Test
    void malformedInputIsADataError(@TempDir final Path dir) throws Exception {
        final Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ \"now\": ");
        assertThrows(SurfDataException.class, () -> reader.read(broken));

        assertThrows(SurfDataException.class, () -> reader.parse(""));
        assertThrows(SurfDataException.class, () -> reader.parse("{\"zone\": \"UTC\"}"));
        assertThrows(SurfDataException.class,
                () -> reader.parse("{\"now\": \"2024-10-26T07:30:00\", \"zone\": \"Mars/Olympus\"}"));
        assertThrows(SurfDataException.class,
                () -> reader.parse("{\"now\": \"yesterday\"}"));
    }

    @Test
    void badTideStationFailsTheRead() {
        final String json = "{\"now\": \"2024-10-26T07:30:00\", \"tideStations\": {\"9414290\": {"
                + "\"hourly\": [{\"time\": \"2024-10-26 08:00\", \"height\": 2.0},"
                + "             {\"time\": \"2024-10-26 07:00\", \"height\": 2.5}]}}}";
        assertThrows(SurfDataException.class, () -> reader.parse(json));

        final String untyped = "{\"now\": \"2024-10-26T07:30:00\", \"tideStations\": {\"9414290\": {"
                + "\"highLow\": [{\"time\": \"2024-10-26 04:12\", \"height\": 5.3}]}}}";
        assertThrows(SurfDataException.class, () -> reader.parse(untyped));
    }

    @Test
    void withNowKeepsTheReadings() throws Exception {
        final ConditionsSnapshot snapshot = reader.read(sample());
        final ConditionsSnapshot later = snapshot.withNow(snapshot.getNow().plusHours(3));

        assertEquals(10, later.getNow().getHour());
        assertTrue(later.reading("bolinas").isPresent());
    }
}
