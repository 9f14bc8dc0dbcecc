package ou.capstone.surf.score;

import ou.capstone.surf.Measurement;

/**
 * Scores wave period. Longer period means more organized groundswell:
 * under 7s is wind chop, 15s and up is long-period groundswell.
 */
public final class WavePeriodScorer implements ConditionScorer {

    @Override
    public double score(final Measurement measurement) {
        return scorePeriod(measurement.getWavePeriodS());
    }

    public int scorePeriod(final double periodS) {
        Measurement.requireNonNegative(periodS, "wavePeriodS");
        if (periodS >= 15) return 100;
        if (periodS >= 13) return 90;
        if (periodS >= 11) return 75;
        if (periodS >= 9) return 55;
        if (periodS >= 7) return 35;
        return 20;
    }
}
