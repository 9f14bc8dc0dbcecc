package ou.capstone.surf.score;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.spots.TidePreference;
import ou.capstone.surf.tide.TidePhase;

/**
 * Scores the current tide height against the level the spot prefers.
 * Heights are read against a nominal 0-6 ft local range.
 */
public final class TideScorer implements ConditionScorer {

    static final int ANY_TIDE_SCORE = 80;
    private static final double TIDE_RANGE_FT = 6.0;

    private final TidePreference preference;

    public TideScorer(final TidePreference preference) {
        this.preference = Objects.requireNonNull(preference, "preference is required");
    }

    @Override
    public double score(final Measurement measurement) {
        return scoreTide(measurement.getTideHeightFt(), measurement.getTidePhase());
    }

    /**
     * @param phase accepted for completeness; the score depends on height only
     */
    public int scoreTide(final double heightFt, final TidePhase phase) {
        Validate.finite(heightFt, "tideHeightFt must be finite");
        if (preference == TidePreference.ANY) {
            return ANY_TIDE_SCORE;
        }

        final double pct = Math.min(1.0, Math.max(0.0, heightFt / TIDE_RANGE_FT));
        switch (preference) {
            case LOW:
                if (pct < 0.33) return 100;
                if (pct < 0.5) return 75;
                if (pct < 0.67) return 50;
                return 30;
            case MID:
                if (pct >= 0.33 && pct <= 0.67) return 100;
                if (pct >= 0.2 && pct <= 0.8) return 75;
                return 50;
            case HIGH:
                if (pct > 0.67) return 100;
                if (pct > 0.5) return 75;
                if (pct > 0.33) return 50;
                return 30;
            default:
                return 50;
        }
    }
}
