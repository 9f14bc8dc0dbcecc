package ou.capstone.surf.score;

import java.util.Objects;

/**
 * Overall verdict for one spot. Recomputed from scratch on every input change.
 *
 * @param score     0-100
 * @param subScores the per-factor scores behind it; null when there was no data
 */
public record ScoreResult(int score, Rating rating, String breakdown, SubScores subScores) {

    public ScoreResult {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be within 0-100, got: " + score);
        }
        Objects.requireNonNull(rating, "rating is required");
        breakdown = (breakdown == null) ? "" : breakdown;
    }

    /** Result for a spot with no readings. */
    public static ScoreResult noData() {
        return new ScoreResult(0, Rating.POOR, "No conditions data available.", null);
    }

    public boolean hasData() {
        return subScores != null;
    }

    /** Per-factor scores, each 0-100. */
    public record SubScores(int waveHeight, int wavePeriod, int wind, int swellDirection, int tide) {
    }
}
