package ou.capstone.surf.geo;

/**
 * Human-readable labels for bearings: 16-point cardinal names and the
 * ocean region a Northern California swell most likely came from.
 */
public final class CompassDirections {

    private static final String[] CARDINALS = {
            "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
            "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"
    };

    private CompassDirections() {
        // Prevent instantiation
    }

    /** 16-point compass label, e.g. 280 -> "W". */
    public static String cardinal(final double degrees) {
        final double folded = AngleMath.normalize(degrees);
        final double bearing = folded < 0 ? folded + 360.0 : folded;
        final int index = (int) Math.round(bearing / 22.5) % 16;
        return CARDINALS[index];
    }

    /**
     * Likely generating region for a swell arriving from {@code degrees}.
     */
    public static String swellSource(final double degrees) {
        if (degrees >= 270 && degrees <= 315) {
            return "North Pacific / Alaska";
        }
        if (degrees >= 225 && degrees < 270) {
            return "West Pacific";
        }
        if (degrees >= 180 && degrees < 225) {
            return "South Pacific / Southern Hemisphere";
        }
        if (degrees >= 315 || degrees < 45) {
            return "North Pacific / Gulf of Alaska";
        }
        return "Local wind swell";
    }
}
