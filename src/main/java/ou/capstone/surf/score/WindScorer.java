package ou.capstone.surf.score;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.geo.AngleMath;

/**
 * Scores wind: a speed score scaled by how close the wind is to blowing
 * offshore at this spot.
 */
public final class WindScorer implements ConditionScorer {

    // ---- Direction multipliers by offset from offshore ----
    private static final double MULT_OFFSHORE = 1.0;        // <= 45 deg
    private static final double MULT_CROSS_OFFSHORE = 0.85; // <= 90 deg
    private static final double MULT_CROSS_ONSHORE = 0.6;   // <= 135 deg
    private static final double MULT_ONSHORE = 0.4;

    // Below this speed direction barely matters
    private static final double GLASSY_MPH = 5.0;
    private static final double GLASSY_MIN_MULT = 0.9;

    private final double offshoreBearing;

    public WindScorer(final double offshoreBearing) {
        Measurement.requireBearing(offshoreBearing, "offshoreBearing");
        this.offshoreBearing = offshoreBearing;
    }

    @Override
    public double score(final Measurement measurement) {
        return scoreWind(measurement.getWindSpeedMph(), measurement.getWindDirectionDeg());
    }

    public int scoreWind(final double speedMph, final double directionDeg) {
        Measurement.requireNonNegative(speedMph, "windSpeedMph");
        Measurement.requireBearing(directionDeg, "windDirectionDeg");

        double multiplier = directionMultiplier(AngleMath.difference(directionDeg, offshoreBearing));
        if (speedMph < GLASSY_MPH) {
            multiplier = Math.max(GLASSY_MIN_MULT, multiplier);
        }
        return (int) Math.round(speedScore(speedMph) * multiplier);
    }

    static int speedScore(final double speedMph) {
        if (speedMph < 5) return 100;  // glassy
        if (speedMph < 10) return 85;  // light
        if (speedMph < 15) return 65;  // moderate
        if (speedMph < 20) return 40;  // strong
        if (speedMph < 25) return 20;  // very strong
        return 5;
    }

    static double directionMultiplier(final double offsetDeg) {
        if (offsetDeg <= 45) return MULT_OFFSHORE;
        if (offsetDeg <= 90) return MULT_CROSS_OFFSHORE;
        if (offsetDeg <= 135) return MULT_CROSS_ONSHORE;
        return MULT_ONSHORE;
    }
}
