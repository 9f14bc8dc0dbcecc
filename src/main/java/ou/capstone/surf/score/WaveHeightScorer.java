package ou.capstone.surf.score;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.profile.WaveRange;

/**
 * Scores wave height against the surfer's preferred range.
 */
public final class WaveHeightScorer implements ConditionScorer {
    private static final Logger logger = LoggerFactory.getLogger(WaveHeightScorer.class);

    // ---- Wave height knobs ----
    static final int NEUTRAL_SCORE = 50;            // no range known for the surfer
    private static final double UNDERSIZE_PENALTY = 40.0;  // ideal -> surfableMin costs up to 40
    private static final double OVERSIZE_PENALTY = 50.0;   // ideal -> surfableMax costs up to 50
    private static final double OUT_OF_RANGE_CEILING = 30.0;
    private static final double POINTS_LOST_PER_FOOT_TOO_BIG = 10.0;

    private final WaveRange range;

    /**
     * @param range the surfer's range; empty when the profile lookup missed
     */
    public WaveHeightScorer(final Optional<WaveRange> range) {
        this.range = range.orElse(null);
    }

    @Override
    public double score(final Measurement measurement) {
        return scoreHeight(measurement.getWaveHeightFt());
    }

    /**
     * @param heightFt wave height in feet, must be non-negative
     * @return 0-100; exactly 100 inside the ideal band
     */
    public int scoreHeight(final double heightFt) {
        Measurement.requireNonNegative(heightFt, "waveHeightFt");
        if (range == null) {
            logger.debug("No wave range for surfer profile, using neutral score {}", NEUTRAL_SCORE);
            return NEUTRAL_SCORE;
        }

        if (range.isIdeal(heightFt)) {
            return 100;
        }

        if (heightFt >= range.surfableMin() && heightFt < range.idealMin()) {
            final double span = range.idealMin() - range.surfableMin();
            final double diff = range.idealMin() - heightFt;
            return (int) Math.round(100.0 - (diff / span) * UNDERSIZE_PENALTY);
        }

        if (heightFt > range.idealMax() && heightFt <= range.surfableMax()) {
            final double span = range.surfableMax() - range.idealMax();
            final double diff = heightFt - range.idealMax();
            return (int) Math.round(100.0 - (diff / span) * OVERSIZE_PENALTY);
        }

        if (heightFt < range.surfableMin()) {
            return (int) Math.max(0L, Math.round((heightFt / range.surfableMin()) * OUT_OF_RANGE_CEILING));
        }

        // Bigger than surfable
        final double over = heightFt - range.surfableMax();
        return (int) Math.max(0L, Math.round(OUT_OF_RANGE_CEILING - over * POINTS_LOST_PER_FOOT_TOO_BIG));
    }
}
