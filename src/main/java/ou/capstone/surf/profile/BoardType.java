package ou.capstone.surf.profile;

import java.util.Locale;

/** Board class the surfer is riding. */
public enum BoardType {
    LONGBOARD("longboard"),
    MID_LENGTH("mid-length"),
    SHORTBOARD("shortboard");

    private final String label;

    BoardType(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a user or config value. Accepts the label, the enum name and the
     * legacy "mediumboard" spelling.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static BoardType parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Board type is required");
        }
        final String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        switch (value) {
            case "longboard":
                return LONGBOARD;
            case "mid-length":
            case "midlength":
            case "mediumboard":
                return MID_LENGTH;
            case "shortboard":
                return SHORTBOARD;
            default:
                throw new IllegalArgumentException("Unknown board type: " + raw);
        }
    }
}
