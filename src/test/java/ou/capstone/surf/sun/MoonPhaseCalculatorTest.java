package ou.capstone.surf.sun;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Map;

import org.junit.jupiter.api.Test;

final class MoonPhaseCalculatorTest {

    private static final Instant NEW_MOON = MoonPhaseCalculator.REFERENCE_NEW_MOON;

    private static Instant daysAfterNewMoon(final double days) {
        return NEW_MOON.plus(Duration.ofMinutes(Math.round(days * 24 * 60)));
    }

    @Test
    void referenceNewMoonIsDark() {
        final MoonInfo info = MoonPhaseCalculator.phaseAt(NEW_MOON);
        assertEquals(MoonPhase.NEW, info.phase());
        assertEquals(0, info.illumination());
    }

    @Test
    void phasesAdvanceThroughTheCycle() {
        assertEquals(MoonPhase.FIRST_QUARTER, MoonPhaseCalculator.phaseAt(daysAfterNewMoon(7.5)).phase());
        assertEquals(51, MoonPhaseCalculator.phaseAt(daysAfterNewMoon(7.5)).illumination());

        final MoonInfo full = MoonPhaseCalculator.phaseAt(daysAfterNewMoon(15));
        assertEquals(MoonPhase.FULL, full.phase());
        assertEquals(100, full.illumination());

        assertEquals(MoonPhase.WANING_CRESCENT, MoonPhaseCalculator.phaseAt(daysAfterNewMoon(-1)).phase());
        assertEquals(MoonPhase.NEW,
                MoonPhaseCalculator.phaseAt(daysAfterNewMoon(MoonPhaseCalculator.SYNODIC_MONTH_DAYS + 0.5)).phase());
    }

    @Test
    void monthPhasesCoversEveryDay() {
        final Map<Integer, MoonInfo> feb = MoonPhaseCalculator.monthPhases(YearMonth.of(2024, 2),
                ZoneId.of("America/Los_Angeles"));
        assertEquals(29, feb.size());
        assertTrue(feb.containsKey(1));
        assertTrue(feb.containsKey(29));
    }

    @Test
    void significantPhases() {
        assertTrue(MoonPhase.NEW.isSignificant());
        assertTrue(MoonPhase.LAST_QUARTER.isSignificant());
        assertFalse(MoonPhase.WAXING_GIBBOUS.isSignificant());
        assertEquals("Full Moon", MoonPhase.FULL.displayName());
    }
}
