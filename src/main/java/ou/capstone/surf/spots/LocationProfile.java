package ou.capstone.surf.spots;

import java.util.List;
import java.util.Objects;

import ou.capstone.surf.geo.Coordinate;

/**
 * Static description of a surf break: where it is and which swell, wind and
 * tide it likes. Loaded once from configuration and never mutated.
 *
 * @param offshoreWindDirection the wind bearing (degrees) that blows offshore at this break
 * @param optimalSwellDirections swell bearings (degrees) the break lines up with
 */
public record LocationProfile(
        String id,
        String name,
        String region,
        String description,
        Coordinate coordinate,
        List<Double> optimalSwellDirections,
        double offshoreWindDirection,
        TidePreference bestTide,
        String buoyStation,
        String tideStation,
        String breakType,
        String suggestedSkill,
        List<String> hazards
) {
    public LocationProfile {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Location id is required");
        }
        Objects.requireNonNull(coordinate, "coordinate is required");
        Objects.requireNonNull(bestTide, "bestTide is required");
        if (optimalSwellDirections == null || optimalSwellDirections.isEmpty()) {
            throw new IllegalArgumentException("Location " + id + " needs at least one optimal swell direction");
        }
        for (final Double bearing : optimalSwellDirections) {
            requireBearing(id, bearing);
        }
        requireBearing(id, offshoreWindDirection);
        name = (name == null || name.isBlank()) ? id : name;
        optimalSwellDirections = List.copyOf(optimalSwellDirections);
        hazards = (hazards == null) ? List.of() : List.copyOf(hazards);
    }

    /** Minimal profile for callers that only need the scoring fields. */
    public static LocationProfile of(final String id,
                                     final Coordinate coordinate,
                                     final List<Double> optimalSwellDirections,
                                     final double offshoreWindDirection,
                                     final TidePreference bestTide) {
        return new LocationProfile(id, id, null, null, coordinate, optimalSwellDirections,
                offshoreWindDirection, bestTide, null, null, null, null, List.of());
    }

    private static void requireBearing(final String id, final Double bearing) {
        if (bearing == null || !(bearing >= 0.0 && bearing <= 360.0)) {
            throw new IllegalArgumentException(
                    "Location " + id + " has a bearing outside 0-360: " + bearing);
        }
    }
}
