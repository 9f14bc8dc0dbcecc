package ou.capstone.surf.score;

import ou.capstone.surf.spots.LocationProfile;

/** A spot paired with its score, as returned by {@link SpotRanker}. */
public record RankedSpot(LocationProfile spot, ScoreResult result) {

    public int score() {
        return result.score();
    }
}
