package ou.capstone.surf.window;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ou.capstone.surf.config.JsonResources;

/**
 * Typical wind quality by hour of day, used where no wind forecast exists.
 * Coastal wind is usually calm at dawn, worst mid-day and glassy again in
 * the evening. Kept as data so another region can ship its own curve.
 */
public final class DiurnalWindCurve {
    private static final Logger logger = LoggerFactory.getLogger(DiurnalWindCurve.class);

    public static final String RESOURCE_PATH = "/data/diurnal-wind-curve.json";

    private final List<Band> bands;
    private final int defaultScore;

    public DiurnalWindCurve(final List<Band> bands, final int defaultScore) {
        this.bands = List.copyOf(bands);
        this.defaultScore = defaultScore;
    }

    /** Loads the bundled curve. */
    public static DiurnalWindCurve loadDefault() {
        final JsonNode root = JsonResources.read(RESOURCE_PATH);
        final List<Band> bands = new ArrayList<>();
        for (final JsonNode node : JsonResources.requireArray(root, "bands", RESOURCE_PATH)) {
            bands.add(new Band(
                    (int) JsonResources.requireDouble(node, "fromHour", RESOURCE_PATH),
                    (int) JsonResources.requireDouble(node, "toHour", RESOURCE_PATH),
                    (int) JsonResources.requireDouble(node, "score", RESOURCE_PATH)));
        }
        final int fallback = (int) JsonResources.requireDouble(root, "defaultScore", RESOURCE_PATH);
        logger.debug("Loaded {} diurnal wind bands", bands.size());
        return new DiurnalWindCurve(bands, fallback);
    }

    /**
     * @param hour hour of day, 0-23
     * @return the score of the first band containing the hour, else the default
     */
    public int scoreAt(final int hour) {
        for (final Band band : bands) {
            if (band.contains(hour)) {
                return band.score();
            }
        }
        return defaultScore;
    }

    /** Hours [fromHour, toHour) share one score. */
    public record Band(int fromHour, int toHour, int score) {
        public Band {
            if (fromHour < 0 || toHour > 24 || fromHour >= toHour) {
                throw new IllegalArgumentException("Invalid hour band " + fromHour + "-" + toHour);
            }
        }

        boolean contains(final int hour) {
            return hour >= fromHour && hour < toHour;
        }
    }
}
