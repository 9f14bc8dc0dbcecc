package ou.capstone.surf.sun;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Moon phase from the mean synodic month counted off a known new moon.
 * Good to within about a day, which is all the tide calendar needs.
 */
public final class MoonPhaseCalculator {

    // ---- knobs ----
    static final Instant REFERENCE_NEW_MOON = Instant.parse("2024-01-11T11:57:00Z");
    static final double SYNODIC_MONTH_DAYS = 29.53058867;

    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final MoonPhase[] PHASES = MoonPhase.values();

    private MoonPhaseCalculator() {
        // Prevent instantiation
    }

    public static MoonInfo phaseAt(final Instant when) {
        Objects.requireNonNull(when, "instant is required");
        final double days = Duration.between(REFERENCE_NEW_MOON, when).toMillis() / MILLIS_PER_DAY;
        final double age = ((days % SYNODIC_MONTH_DAYS) + SYNODIC_MONTH_DAYS) % SYNODIC_MONTH_DAYS;
        final double fraction = age / SYNODIC_MONTH_DAYS;

        final int illumination = (int) Math.round((1 - Math.cos(fraction * 2 * Math.PI)) / 2 * 100);
        final int index = (int) Math.floor(fraction * 8) % 8;
        return new MoonInfo(PHASES[index], illumination, age);
    }

    /** Phase at local noon on {@code date}. */
    public static MoonInfo phaseOn(final LocalDate date, final ZoneId zone) {
        Objects.requireNonNull(date, "date is required");
        return phaseAt(date.atTime(12, 0).atZone(zone).toInstant());
    }

    /** Day-of-month to phase, for every day of {@code month}. */
    public static Map<Integer, MoonInfo> monthPhases(final YearMonth month, final ZoneId zone) {
        Objects.requireNonNull(month, "month is required");
        final Map<Integer, MoonInfo> phases = new LinkedHashMap<>();
        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            phases.put(day, phaseOn(month.atDay(day), zone));
        }
        return Collections.unmodifiableMap(phases);
    }
}
