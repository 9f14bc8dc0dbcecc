package ou.capstone.surf.score;

import ou.capstone.surf.Measurement;

/**
 * Assigns a numeric score to one aspect of a {@link Measurement}.
 * Higher score = better surf.
 */
@FunctionalInterface
public interface ConditionScorer {

    /**
     * Returns the score for the given readings.
     *
     * @param measurement the readings to score
     * @return a finite score, 0-100 for the single-factor scorers
     */
    double score(Measurement measurement);
}
