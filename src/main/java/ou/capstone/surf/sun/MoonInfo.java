package ou.capstone.surf.sun;

import java.util.Objects;

/**
 * @param illumination percent of the disc lit, 0-100
 * @param ageDays      days since the last new moon
 */
public record MoonInfo(MoonPhase phase, int illumination, double ageDays) {

    public MoonInfo {
        Objects.requireNonNull(phase, "phase is required");
        if (illumination < 0 || illumination > 100) {
            throw new IllegalArgumentException("Illumination must be 0-100, got: " + illumination);
        }
    }

    @Override
    public String toString() {
        return phase.displayName() + " (" + illumination + "%)";
    }
}
