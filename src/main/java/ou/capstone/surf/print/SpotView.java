package ou.capstone.surf.print;

/** One printable row of the spot report. Text fields may be null. */
public record SpotView(
        int rank,
        String name,
        int score,
        String rating,
        String bestWindow,
        String dawnPatrol,
        String percentile,
        String breakdown
) {
}
