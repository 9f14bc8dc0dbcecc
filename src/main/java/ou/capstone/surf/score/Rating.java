package ou.capstone.surf.score;

/** Four-level rating shown next to a score. */
public enum Rating {
    POOR("Poor"),
    FAIR("Fair"),
    GOOD("Good"),
    EXCELLENT("Excellent");

    private final String label;

    Rating(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** >=80 Excellent, >=60 Good, >=40 Fair, else Poor. */
    public static Rating fromScore(final int score) {
        if (score >= 80) return EXCELLENT;
        if (score >= 60) return GOOD;
        if (score >= 40) return FAIR;
        return POOR;
    }

    /**
     * Finer-grained wording for a score, e.g. "Epic conditions".
     */
    public static String describe(final int score) {
        if (score >= 90) return "Epic conditions";
        if (score >= 80) return "Excellent conditions";
        if (score >= 70) return "Very good conditions";
        if (score >= 60) return "Good conditions";
        if (score >= 50) return "Fair conditions";
        if (score >= 40) return "Below average";
        if (score >= 30) return "Poor conditions";
        return "Not recommended";
    }
}
