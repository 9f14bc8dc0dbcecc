package ou.capstone.surf.tide;

import java.util.Locale;

/** Tag on a high/low prediction; NOAA encodes these as "H" and "L". */
public enum TideEventType {
    HIGH, LOW;

    /**
     * @return the event type, or null for untagged (hourly) samples
     * @throws IllegalArgumentException for any code other than H/L/blank
     */
    public static TideEventType fromCode(final String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "H":
            case "HH":
                return HIGH;
            case "L":
            case "LL":
                return LOW;
            default:
                throw new IllegalArgumentException("Unknown tide event code: " + code);
        }
    }

    public TidePhase asPhase() {
        return this == HIGH ? TidePhase.HIGH : TidePhase.LOW;
    }
}
