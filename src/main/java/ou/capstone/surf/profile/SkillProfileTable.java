package ou.capstone.surf.profile;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ou.capstone.surf.config.JsonResources;

/**
 * Lookup table from {board x skill} to the wave heights that profile enjoys.
 * Immutable once built.
 */
public final class SkillProfileTable {
    private static final Logger logger = LoggerFactory.getLogger(SkillProfileTable.class);

    public static final String RESOURCE_PATH = "/data/skill-profiles.json";

    /** Range reported by {@link #idealRange} when a cell is missing. */
    static final double FALLBACK_IDEAL_MIN = 2.0;
    static final double FALLBACK_IDEAL_MAX = 5.0;

    private final Map<BoardType, Map<SkillLevel, WaveRange>> cells;

    private SkillProfileTable(final Map<BoardType, Map<SkillLevel, WaveRange>> cells) {
        final Map<BoardType, Map<SkillLevel, WaveRange>> copy = new EnumMap<>(BoardType.class);
        cells.forEach((board, row) -> copy.put(board, new EnumMap<>(row)));
        this.cells = copy;
    }

    /** Loads the bundled table from {@value #RESOURCE_PATH}. */
    public static SkillProfileTable loadDefault() {
        return fromJson(JsonResources.read(RESOURCE_PATH), RESOURCE_PATH);
    }

    static SkillProfileTable fromJson(final JsonNode root, final String source) {
        final Builder builder = builder();
        for (final JsonNode row : JsonResources.requireArray(root, "profiles", source)) {
            builder.put(
                    BoardType.parse(JsonResources.requireText(row, "board", source)),
                    SkillLevel.parse(JsonResources.requireText(row, "skill", source)),
                    new WaveRange(
                            JsonResources.requireDouble(row, "idealMin", source),
                            JsonResources.requireDouble(row, "idealMax", source),
                            JsonResources.requireDouble(row, "surfableMin", source),
                            JsonResources.requireDouble(row, "surfableMax", source)));
        }
        final SkillProfileTable table = builder.build();
        logger.info("Loaded {} skill profile cells from {}", table.size(), source);
        return table;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the range for the profile, or empty when the table has no cell for it
     */
    public Optional<WaveRange> find(final SurferProfile profile) {
        if (profile == null) {
            return Optional.empty();
        }
        final Map<SkillLevel, WaveRange> row = cells.get(profile.board());
        return (row == null) ? Optional.empty() : Optional.ofNullable(row.get(profile.skill()));
    }

    /**
     * Ideal wave band for display; 2-5 ft when the profile is not in the table.
     */
    public IdealBand idealRange(final SurferProfile profile) {
        return find(profile)
                .map(r -> new IdealBand(r.idealMin(), r.idealMax()))
                .orElseGet(() -> new IdealBand(FALLBACK_IDEAL_MIN, FALLBACK_IDEAL_MAX));
    }

    public int size() {
        return cells.values().stream().mapToInt(Map::size).sum();
    }

    /** Ideal wave heights in feet. */
    public record IdealBand(double min, double max) {
    }

    /** Collects cells before freezing them into a table. */
    public static final class Builder {
        private final Map<BoardType, Map<SkillLevel, WaveRange>> cells = new EnumMap<>(BoardType.class);

        public Builder put(final BoardType board, final SkillLevel skill, final WaveRange range) {
            cells.computeIfAbsent(board, b -> new EnumMap<>(SkillLevel.class)).put(skill, range);
            return this;
        }

        public SkillProfileTable build() {
            return new SkillProfileTable(cells);
        }
    }
}
