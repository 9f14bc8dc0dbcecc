package ou.capstone.surf.score;

import java.util.List;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.geo.AngleMath;

/**
 * Scores swell direction by its distance to the closest bearing the spot
 * lines up with.
 */
public final class SwellDirectionScorer implements ConditionScorer {

    private final List<Double> optimalBearings;

    public SwellDirectionScorer(final List<Double> optimalBearings) {
        if (optimalBearings == null || optimalBearings.isEmpty()) {
            throw new IllegalArgumentException("At least one optimal swell bearing is required");
        }
        for (final Double bearing : optimalBearings) {
            Measurement.requireBearing(bearing, "optimalSwellDirection");
        }
        this.optimalBearings = List.copyOf(optimalBearings);
    }

    @Override
    public double score(final Measurement measurement) {
        return scoreDirection(measurement.getSwellDirectionDeg());
    }

    public int scoreDirection(final double swellDirectionDeg) {
        Measurement.requireBearing(swellDirectionDeg, "swellDirectionDeg");
        final double offset = AngleMath.minDifference(swellDirectionDeg, optimalBearings);

        if (offset <= 15) return 100; // direct hit
        if (offset <= 30) return 85;
        if (offset <= 45) return 70;
        if (offset <= 60) return 50;
        if (offset <= 90) return 30;
        return 10;                    // wrong direction
    }
}
