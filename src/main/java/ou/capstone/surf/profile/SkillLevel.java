package ou.capstone.surf.profile;

import java.util.Locale;

/** Surfer ability. */
public enum SkillLevel {
    BEGINNER("beginner"),
    INTERMEDIATE("intermediate"),
    EXPERT("expert");

    private final String label;

    SkillLevel(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a user or config value; "advanced" is accepted as INTERMEDIATE.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static SkillLevel parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Skill level is required");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "beginner":
                return BEGINNER;
            case "intermediate":
            case "advanced":
                return INTERMEDIATE;
            case "expert":
                return EXPERT;
            default:
                throw new IllegalArgumentException("Unknown skill level: " + raw);
        }
    }
}
