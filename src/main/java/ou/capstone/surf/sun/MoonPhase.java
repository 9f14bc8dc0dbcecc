package ou.capstone.surf.sun;

/** The eight named phases of the lunar cycle, in order from new moon. */
public enum MoonPhase {
    NEW("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private final String displayName;

    MoonPhase(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** New, full and the two quarters. */
    public boolean isSignificant() {
        return this == NEW || this == FULL || this == FIRST_QUARTER || this == LAST_QUARTER;
    }
}
