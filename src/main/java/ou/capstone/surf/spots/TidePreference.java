package ou.capstone.surf.spots;

import java.util.Locale;

/** Tide level a break works best on. */
public enum TidePreference {
    LOW, MID, HIGH, ANY;

    /**
     * @throws IllegalArgumentException for unknown values
     */
    public static TidePreference parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Tide preference is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
