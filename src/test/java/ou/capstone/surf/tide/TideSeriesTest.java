package ou.capstone.surf.tide;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

final class TideSeriesTest {

    @Test
    void rejectsOutOfOrderSamples() {
        final LocalDateTime t = LocalDateTime.parse("2024-10-26T06:00");
        assertThrows(IllegalArgumentException.class, () -> new TideSeries(
                List.of(TidePrediction.hourly(t, 1.0), TidePrediction.hourly(t.minusHours(1), 2.0)),
                List.of()));
    }

    @Test
    void rejectsUntaggedHighLowEntries() {
        final LocalDateTime t = LocalDateTime.parse("2024-10-26T06:00");
        assertThrows(IllegalArgumentException.class,
                () -> new TideSeries(List.of(), List.of(TidePrediction.hourly(t, 4.0))));
    }

    @Test
    void forDateKeepsOnlyThatDay() {
        final LocalDateTime start = LocalDateTime.parse("2024-10-26T22:00");
        final TideSeries series = new TideSeries(
                List.of(TidePrediction.hourly(start, 1.0),
                        TidePrediction.hourly(start.plusHours(1), 1.2),
                        TidePrediction.hourly(start.plusHours(2), 1.5)),
                List.of(TidePrediction.event(start.plusHours(4), 4.0, TideEventType.HIGH)));

        final TideSeries nextDay = series.forDate(LocalDate.of(2024, 10, 27));
        assertEquals(1, nextDay.hourly().size());
        assertEquals(1, nextDay.highLow().size());
        assertTrue(series.forDate(LocalDate.of(2024, 10, 30)).isEmpty());
    }

    @Test
    void eventCodes() {
        assertEquals(TideEventType.HIGH, TideEventType.fromCode("HH"));
        assertEquals(TideEventType.LOW, TideEventType.fromCode("l"));
        assertNull(TideEventType.fromCode(" "));
        assertThrows(IllegalArgumentException.class, () -> TideEventType.fromCode("X"));
    }
}
