package ou.capstone.surf.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.exceptions.SurfDataException;
import ou.capstone.surf.io.ConditionsSnapshot.SpotReading;
import ou.capstone.surf.tide.TideEventType;
import ou.capstone.surf.tide.TidePrediction;
import ou.capstone.surf.tide.TideSeries;

/**
 * Reads a conditions snapshot file.
 *
 * <pre>
 * {
 *   "now": "2024-10-26T07:30:00",
 *   "zone": "America/Los_Angeles",
 *   "spots": [ { "spotId": "...", "waveHeightFt": 4.5, "wavePeriodS": 12,
 *                "swellDirectionDeg": 280, "windSpeedMph": 4, "windDirectionDeg": 50,
 *                "waterTempF": 55, "airTempF": 60, "driveMinutes": 35 } ],
 *   "tideStations": { "9414290": {
 *       "hourly":  [ { "time": "2024-10-26 00:00", "height": 2.1 } ],
 *       "highLow": [ { "time": "2024-10-26 04:12", "height": 5.3, "type": "H" } ] } }
 * }
 * </pre>
 *
 * Tide times are station-local, in the NOAA "yyyy-MM-dd HH:mm" shape.
 * Malformed spot entries are skipped with a warning; a malformed file or tide
 * station fails the whole read.
 */
public class ConditionsSnapshotReader {
    private static final Logger logger = LoggerFactory.getLogger(ConditionsSnapshotReader.class);

    static final DateTimeFormatter TIDE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ObjectMapper objectMapper;

    public ConditionsSnapshotReader() {
        this.objectMapper = new ObjectMapper();
    }

    public ConditionsSnapshot read(final Path file) throws SurfDataException {
        logger.info("Reading conditions snapshot {}", file);
        final String json;
        try {
            json = Files.readString(file);
        } catch (final IOException e) {
            throw new SurfDataException("Cannot read conditions snapshot " + file, e);
        }
        return parse(json);
    }

    public ConditionsSnapshot parse(final String json) throws SurfDataException {
        if (json == null || json.isBlank()) {
            throw new SurfDataException("Conditions snapshot is empty");
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new SurfDataException("Conditions snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        }

        try {
            final ZoneId zone = ZoneId.of(root.path("zone").asText("UTC"));
            final JsonNode nowNode = root.get("now");
            if (nowNode == null || !nowNode.isTextual()) {
                throw new SurfDataException("Conditions snapshot is missing 'now'");
            }
            final ZonedDateTime now = LocalDateTime.parse(nowNode.asText()).atZone(zone);

            final Map<String, SpotReading> readings = parseReadings(root.path("spots"));
            final Map<String, TideSeries> stations = parseStations(root.path("tideStations"));

            logger.info("Snapshot at {}: {} spot readings, {} tide stations", now, readings.size(), stations.size());
            return new ConditionsSnapshot(now, readings, stations);
        } catch (final DateTimeException | IllegalArgumentException e) {
            throw new SurfDataException("Invalid conditions snapshot: " + e.getMessage(), e);
        }
    }

    private Map<String, SpotReading> parseReadings(final JsonNode spots) {
        final Map<String, SpotReading> readings = new LinkedHashMap<>();
        if (!spots.isArray()) {
            logger.warn("Conditions snapshot has no 'spots' array");
            return readings;
        }
        int skipped = 0;
        for (final JsonNode node : spots) {
            try {
                final SpotReading reading = parseReading(node);
                readings.put(reading.spotId(), reading);
            } catch (final DateTimeException | IllegalArgumentException e) {
                skipped++;
                logger.warn("Skipping spot reading: {}", e.getMessage());
            }
        }
        if (skipped > 0) {
            logger.info("Skipped {} malformed spot readings", skipped);
        }
        return readings;
    }

    private static SpotReading parseReading(final JsonNode node) {
        final String id = node.path("spotId").asText(null);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("spot reading without spotId");
        }
        final double waveHeight = requireNumber(node, "waveHeightFt", id);
        final double wavePeriod = requireNumber(node, "wavePeriodS", id);
        final double swellDirection = requireNumber(node, "swellDirectionDeg", id);
        final double windSpeed = requireNumber(node, "windSpeedMph", id);
        final double windDirection = requireNumber(node, "windDirectionDeg", id);
        Measurement.requireNonNegative(waveHeight, id + " waveHeightFt");
        Measurement.requireNonNegative(wavePeriod, id + " wavePeriodS");
        Measurement.requireNonNegative(windSpeed, id + " windSpeedMph");
        Measurement.requireBearing(swellDirection, id + " swellDirectionDeg");
        Measurement.requireBearing(windDirection, id + " windDirectionDeg");
        final Integer driveMinutes = optionalDriveMinutes(node, id);
        return new SpotReading(
                id,
                waveHeight,
                wavePeriod,
                swellDirection,
                windSpeed,
                windDirection,
                optionalNumber(node, "waterTempF"),
                optionalNumber(node, "airTempF"),
                driveMinutes);
    }

    private static Integer optionalDriveMinutes(final JsonNode node, final String id) {
        final JsonNode value = node.get("driveMinutes");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isInt() || value.intValue() < 0) {
            throw new IllegalArgumentException(id + ": 'driveMinutes' must be a whole number >= 0, got: " + value);
        }
        return value.intValue();
    }

    private static Map<String, TideSeries> parseStations(final JsonNode stations) {
        final Map<String, TideSeries> out = new LinkedHashMap<>();
        if (!stations.isObject()) {
            logger.warn("Conditions snapshot has no 'tideStations' object");
            return out;
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = stations.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            out.put(entry.getKey(), parseSeries(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    static TideSeries parseSeries(final String stationId, final JsonNode node) {
        final List<TidePrediction> hourly = new ArrayList<>();
        for (final JsonNode p : node.path("hourly")) {
            hourly.add(TidePrediction.hourly(parseTime(p, stationId), requireNumber(p, "height", stationId)));
        }
        final List<TidePrediction> highLow = new ArrayList<>();
        for (final JsonNode p : node.path("highLow")) {
            final TideEventType type = TideEventType.fromCode(p.path("type").asText(null));
            if (type == null) {
                throw new IllegalArgumentException("Station " + stationId + " has a high/low entry without a type");
            }
            highLow.add(TidePrediction.event(parseTime(p, stationId), requireNumber(p, "height", stationId), type));
        }
        logger.debug("Station {}: {} hourly, {} high/low", stationId, hourly.size(), highLow.size());
        return new TideSeries(hourly, highLow);
    }

    private static LocalDateTime parseTime(final JsonNode p, final String owner) {
        final String text = p.path("time").asText(null);
        if (text == null) {
            throw new IllegalArgumentException(owner + ": tide entry without time");
        }
        return LocalDateTime.parse(text, TIDE_TIME);
    }

    private static double requireNumber(final JsonNode node, final String field, final String owner) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException(owner + ": '" + field + "' must be a number");
        }
        return value.asDouble();
    }

    private static Double optionalNumber(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return (value == null || !value.isNumber()) ? null : value.asDouble();
    }
}
