package ou.capstone.surf.sun;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import org.junit.jupiter.api.Test;

import ou.capstone.surf.geo.Coordinate;

final class SunTimesCalculatorTest {

    private static final ZoneId PACIFIC = ZoneId.of("America/Los_Angeles");
    private static final Coordinate OCEAN_BEACH = new Coordinate(37.76, -122.51);

    private static void assertNear(final LocalTime expected, final ZonedDateTime actual) {
        final long diff = Math.abs(Duration.between(expected, actual.toLocalTime()).toMinutes());
        assertTrue(diff <= 2, "expected about " + expected + " but was " + actual.toLocalTime());
    }

    @Test
    void summerSolsticeInSanFrancisco() {
        final SunTimes sun = SunTimesCalculator.compute(OCEAN_BEACH, LocalDate.of(2024, 6, 21), PACIFIC);

        assertNear(LocalTime.of(5, 17), sun.firstLight());
        assertNear(LocalTime.of(5, 48), sun.sunrise());
        assertNear(LocalTime.of(20, 35), sun.sunset());
        assertNear(LocalTime.of(21, 6), sun.lastLight());
        assertEquals(PACIFIC, sun.sunrise().getZone());
    }

    @Test
    void winterSolsticeUsesStandardTime() {
        final SunTimes sun = SunTimesCalculator.compute(OCEAN_BEACH, LocalDate.of(2024, 12, 21), PACIFIC);

        assertNear(LocalTime.of(7, 22), sun.sunrise());
        assertNear(LocalTime.of(16, 55), sun.sunset());
    }

    @Test
    void eventsStayOrderedEvenAtPolarLatitudes() {
        final ZoneId svalbard = ZoneId.of("Arctic/Longyearbyen");
        for (final LocalDate date : new LocalDate[] {LocalDate.of(2024, 6, 21), LocalDate.of(2024, 12, 21)}) {
            final SunTimes sun = SunTimesCalculator.compute(78.2, 15.6, date, svalbard);
            assertFalse(sun.sunrise().isBefore(sun.firstLight()));
            assertFalse(sun.sunset().isBefore(sun.sunrise()));
            assertFalse(sun.lastLight().isBefore(sun.sunset()));
        }
        // polar night: every event collapses onto solar noon
        final SunTimes night = SunTimesCalculator.compute(78.2, 15.6, LocalDate.of(2024, 12, 21), svalbard);
        assertEquals(night.sunrise(), night.sunset());
    }

    @Test
    void orderedAllYearAtEverySpotLatitude() {
        LocalDate date = LocalDate.of(2024, 1, 1);
        while (date.getYear() == 2024) {
            final SunTimes sun = SunTimesCalculator.compute(38.315, -123.048, date, PACIFIC);
            assertTrue(sun.firstLight().isBefore(sun.sunrise()), date.toString());
            assertTrue(sun.sunset().isBefore(sun.lastLight()), date.toString());
            date = date.plusDays(5);
        }
    }

    @Test
    void eventsInsideTheSpringForwardGapKeepTheirOrder() {
        // Far-south coordinates against a Pacific clock put first light near 2:30 AM on the DST switch day
        final SunTimes sun = SunTimesCalculator.compute(-65.0, -75.0, LocalDate.of(2024, 3, 10), PACIFIC);

        assertFalse(sun.sunrise().isBefore(sun.firstLight()));
        assertFalse(sun.sunset().isBefore(sun.sunrise()));
        assertFalse(sun.lastLight().isBefore(sun.sunset()));
        assertEquals(PACIFIC, sun.firstLight().getZone());
    }

    @Test
    void everyDayOfTheYearStaysOrderedInAMismatchedZone() {
        final ZoneId chicago = ZoneId.of("America/Chicago");
        LocalDate date = LocalDate.of(2024, 1, 1);
        while (date.getYear() == 2024) {
            final SunTimes sun = SunTimesCalculator.compute(-65.0, -75.0, date, PACIFIC);
            assertFalse(sun.sunrise().isBefore(sun.firstLight()), date.toString());
            final SunTimes other = SunTimesCalculator.compute(50.0, -170.0, date, chicago);
            assertFalse(other.lastLight().isBefore(other.sunset()), date.toString());
            date = date.plusDays(1);
        }
    }

    @Test
    void daylightAndFormatting() {
        final SunTimes sun = SunTimesCalculator.compute(OCEAN_BEACH, LocalDate.of(2024, 6, 21), PACIFIC);
        final ZonedDateTime noon = ZonedDateTime.of(2024, 6, 21, 12, 0, 0, 0, PACIFIC);

        assertTrue(sun.isDaylight(noon));
        assertTrue(sun.isDaylight(sun.firstLight()));
        assertFalse(sun.isDaylight(noon.withHour(3)));
        assertEquals("5:48 AM", SunTimes.formatTime(noon.withHour(5).withMinute(48)));
        assertEquals("8:05 PM", SunTimes.formatTime(noon.withHour(20).withMinute(5)));
    }

    @Test
    void rejectsImpossibleCoordinates() {
        assertThrows(IllegalArgumentException.class,
                () -> SunTimesCalculator.compute(95.0, 0.0, LocalDate.of(2024, 1, 1), PACIFIC));
    }
}
