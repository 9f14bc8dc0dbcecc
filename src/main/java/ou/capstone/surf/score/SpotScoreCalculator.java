package ou.capstone.surf.score;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.geo.CompassDirections;
import ou.capstone.surf.profile.SkillProfileTable;
import ou.capstone.surf.profile.SurferProfile;
import ou.capstone.surf.profile.WaveRange;
import ou.capstone.surf.spots.LocationProfile;

/**
 * Combines the five condition scorers into one 0-100 score per spot.
 *
 * Weights:
 *  - wave height 0.30
 *  - wave period 0.20
 *  - wind 0.20
 *  - swell direction 0.15
 *  - wind again 0.10 (the wind score already folds in direction; it is
 *    counted a second time at this weight)
 *  - tide 0.05
 *
 * Stateless apart from the skill table, so one instance can be shared
 * across threads.
 */
public class SpotScoreCalculator {
    private static final Logger logger = LoggerFactory.getLogger(SpotScoreCalculator.class);

    // ---- Weights ----
    static final double W_WAVE_HEIGHT = 0.30;
    static final double W_WAVE_PERIOD = 0.20;
    static final double W_WIND = 0.20;
    static final double W_SWELL_DIRECTION = 0.15;
    static final double W_WIND_DIRECTION = 0.10;
    static final double W_TIDE = 0.05;

    private final SkillProfileTable skillProfiles;

    /** Default constructor: bundled skill table. */
    public SpotScoreCalculator() {
        this(SkillProfileTable.loadDefault());
    }

    public SpotScoreCalculator(final SkillProfileTable skillProfiles) {
        this.skillProfiles = Objects.requireNonNull(skillProfiles, "skillProfiles is required");
    }

    /**
     * Scores one spot. Pure function of its inputs.
     *
     * @throws IllegalArgumentException if the location carries invalid bearings
     */
    public ScoreResult calculate(final Measurement measurement,
                                 final LocationProfile location,
                                 final SurferProfile surferProfile) {
        Objects.requireNonNull(measurement, "measurement is required");
        Objects.requireNonNull(location, "location is required");

        final Optional<WaveRange> range = skillProfiles.find(surferProfile);
        final WaveHeightScorer waveHeight = new WaveHeightScorer(range);
        final WavePeriodScorer wavePeriod = new WavePeriodScorer();
        final WindScorer wind = new WindScorer(location.offshoreWindDirection());
        final SwellDirectionScorer swell = new SwellDirectionScorer(location.optimalSwellDirections());
        final TideScorer tide = new TideScorer(location.bestTide());

        final ScoreResult.SubScores subs = new ScoreResult.SubScores(
                (int) waveHeight.score(measurement),
                (int) wavePeriod.score(measurement),
                (int) wind.score(measurement),
                (int) swell.score(measurement),
                (int) tide.score(measurement));

        // Wiring of the weighted scorer.
        final WeightedConditionScorer combined = new WeightedConditionScorer(List.of(
                new WeightedConditionScorer.Component("waveHeight", W_WAVE_HEIGHT, waveHeight),
                new WeightedConditionScorer.Component("wavePeriod", W_WAVE_PERIOD, wavePeriod),
                new WeightedConditionScorer.Component("wind", W_WIND, wind),
                new WeightedConditionScorer.Component("swellDirection", W_SWELL_DIRECTION, swell),
                new WeightedConditionScorer.Component("windDirection", W_WIND_DIRECTION, wind),
                new WeightedConditionScorer.Component("tide", W_TIDE, tide)
        ));

        final long rounded = Math.round(combined.score(measurement));
        final int score = (int) Math.min(100L, Math.max(0L, rounded));
        final Rating rating = Rating.fromScore(score);

        logger.debug("Spot {} scored {} ({}) from {}", location.id(), score, rating, subs);
        return new ScoreResult(score, rating, breakdown(measurement, surferProfile, subs), subs);
    }

    /**
     * Canned phrases for wave size, period, wind and swell direction,
     * joined by spaces.
     */
    static String breakdown(final Measurement m,
                            final SurferProfile profile,
                            final ScoreResult.SubScores subs) {
        final List<String> parts = new ArrayList<>();
        final String height = oneDecimal(m.getWaveHeightFt());

        if (subs.waveHeight() >= 80) {
            final String who = (profile != null) ? profile.toString() : "most";
            parts.add("Excellent wave size (" + height + "ft) for " + who + " surfers.");
        } else if (subs.waveHeight() >= 60) {
            parts.add("Good wave size (" + height + "ft) for developing skills.");
        } else if (m.getWaveHeightFt() > 6) {
            parts.add("Large waves (" + height + "ft) - challenging for most surfers.");
        } else if (m.getWaveHeightFt() < 2) {
            parts.add("Small waves (" + height + "ft) - may be underwhelming.");
        } else {
            parts.add("Waves at " + height + "ft.");
        }

        final String period = oneDecimal(m.getWavePeriodS());
        if (subs.wavePeriod() >= 75) {
            parts.add("Good wave period (" + period + "s) indicates organized groundswell.");
        } else if (subs.wavePeriod() <= 35) {
            parts.add("Short period (" + period + "s) suggests wind swell - expect choppier conditions.");
        }

        final long mph = Math.round(m.getWindSpeedMph());
        if (m.getWindSpeedMph() < 5) {
            parts.add("Light winds with glassy conditions.");
        } else if (m.getWindSpeedMph() < 10) {
            parts.add("Light winds (" + mph + "mph) with clean conditions.");
        } else if (m.getWindSpeedMph() < 15) {
            parts.add("Moderate winds (" + mph + "mph) with manageable texture.");
        } else {
            parts.add("Strong winds (" + mph + "mph) creating challenging conditions.");
        }

        final String swell = CompassDirections.cardinal(m.getSwellDirectionDeg())
                + ", " + CompassDirections.swellSource(m.getSwellDirectionDeg());
        if (subs.swellDirection() >= 85) {
            parts.add("Swell direction (" + swell + ") is ideal for this spot.");
        } else if (subs.swellDirection() <= 30) {
            parts.add("Swell direction (" + swell + ") is not optimal for this spot.");
        }

        return String.join(" ", parts);
    }

    private static String oneDecimal(final double value) {
        return String.format(Locale.US, "%.1f", value);
    }
}
