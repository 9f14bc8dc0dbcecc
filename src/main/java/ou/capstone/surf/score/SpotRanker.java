package ou.capstone.surf.score;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.profile.SurferProfile;
import ou.capstone.surf.spots.LocationProfile;

/**
 * Scores every configured spot and orders them best first.
 *
 * Spots are scored independently, so the ranking is order-insensitive
 * except for ties: equal scores keep the order the spots were given in
 * ({@link List#sort} is stable).
 */
public class SpotRanker {
    private static final Logger logger = LoggerFactory.getLogger(SpotRanker.class);

    private final SpotScoreCalculator calculator;

    public SpotRanker(final SpotScoreCalculator calculator) {
        this.calculator = Objects.requireNonNull(calculator, "calculator is required");
    }

    /**
     * @param spots          spots in tie-break order
     * @param measurements   readings keyed by spot id; spots without an entry score 0
     * @param surferProfile  who is surfing
     * @return a new list sorted by descending score
     */
    public List<RankedSpot> rank(final List<LocationProfile> spots,
                                 final Map<String, Measurement> measurements,
                                 final SurferProfile surferProfile) {
        final List<RankedSpot> ranked = new ArrayList<>(spots.size());
        for (final LocationProfile spot : spots) {
            final Measurement m = measurements.get(spot.id());
            if (m == null) {
                logger.warn("No conditions for spot {}, scoring as no data", spot.id());
                ranked.add(new RankedSpot(spot, ScoreResult.noData()));
            } else {
                ranked.add(new RankedSpot(spot, calculator.calculate(m, spot, surferProfile)));
            }
        }
        ranked.sort(Comparator.comparingInt(RankedSpot::score).reversed());
        logger.info("Ranked {} spots for {}", ranked.size(), surferProfile);
        return ranked;
    }
}
