package ou.capstone.surf.spots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ou.capstone.surf.config.JsonResources;
import ou.capstone.surf.geo.Coordinate;

/**
 * Resource location: src/main/resources/data/surf-spots.json
 * Accessed via classpath (portable across OS/JARs): "/data/surf-spots.json"
 * <p>
 * Keeps the configured order, which is also the ranking tie-break order.
 */
public final class SpotDirectory {
    private static final Logger logger = LoggerFactory.getLogger(SpotDirectory.class);

    public static final String RESOURCE_PATH = "/data/surf-spots.json";

    private final Map<String, LocationProfile> byId;

    public SpotDirectory(final List<LocationProfile> spots) {
        final Map<String, LocationProfile> index = new LinkedHashMap<>();
        for (final LocationProfile spot : spots) {
            final String key = spot.id().toLowerCase(Locale.ROOT);
            if (index.putIfAbsent(key, spot) != null) {
                throw new IllegalArgumentException("Duplicate spot id: " + spot.id());
            }
        }
        this.byId = index;
    }

    /** Loads the bundled spot list. */
    public static SpotDirectory loadDefault() {
        final JsonNode root = JsonResources.read(RESOURCE_PATH);
        final List<LocationProfile> spots = new ArrayList<>();
        for (final JsonNode node : JsonResources.requireArray(root, "spots", RESOURCE_PATH)) {
            spots.add(parseSpot(node));
        }
        logger.info("Loaded {} surf spots from {}", spots.size(), RESOURCE_PATH);
        return new SpotDirectory(spots);
    }

    public List<LocationProfile> all() {
        return List.copyOf(byId.values());
    }

    public Optional<LocationProfile> findById(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    public int size() {
        return byId.size();
    }

    /**
     * @throws IllegalStateException for a missing field or a value the spot
     *                               model rejects (bad tide class, bearing, latitude)
     */
    static LocationProfile parseSpot(final JsonNode node) {
        final String id = JsonResources.requireText(node, "id", RESOURCE_PATH);
        final String source = RESOURCE_PATH + " (spot " + id + ")";

        final JsonNode coords = node.get("coordinates");
        if (coords == null) {
            throw new IllegalStateException("Missing 'coordinates' in " + source);
        }
        final double lat = JsonResources.requireDouble(coords, "lat", source);
        final double lng = JsonResources.requireDouble(coords, "lng", source);

        final List<Double> swell = new ArrayList<>();
        for (final JsonNode bearing : JsonResources.requireArray(node, "optimalSwellDirections", source)) {
            swell.add(bearing.asDouble());
        }

        final List<String> hazards = new ArrayList<>();
        final JsonNode hazardNode = node.get("hazards");
        if (hazardNode != null && hazardNode.isArray()) {
            hazardNode.forEach(h -> hazards.add(h.asText()));
        }

        final double offshore = JsonResources.requireDouble(node, "offshoreWindDirection", source);
        final String bestTide = JsonResources.requireText(node, "bestTide", source);
        try {
            return new LocationProfile(
                    id,
                    text(node, "name"),
                    text(node, "region"),
                    text(node, "description"),
                    new Coordinate(lat, lng),
                    swell,
                    offshore,
                    TidePreference.parse(bestTide),
                    text(node, "buoyStation"),
                    text(node, "tideStation"),
                    text(node, "breakType"),
                    text(node, "skillLevel"),
                    hazards);
        } catch (final IllegalArgumentException e) {
            throw new IllegalStateException(source + ": " + e.getMessage(), e);
        }
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }
}
