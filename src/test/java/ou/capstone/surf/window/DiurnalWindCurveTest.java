package ou.capstone.surf.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

final class DiurnalWindCurveTest {

    @Test
    void bundledCurveFollowsTheSeaBreezePattern() {
        final DiurnalWindCurve curve = DiurnalWindCurve.loadDefault();

        assertEquals(50, curve.scoreAt(5));
        assertEquals(50, curve.scoreAt(8));
        assertEquals(35, curve.scoreAt(9));
        assertEquals(10, curve.scoreAt(12));
        assertEquals(20, curve.scoreAt(16));
        assertEquals(40, curve.scoreAt(18));
        assertEquals(25, curve.scoreAt(19));
        assertEquals(25, curve.scoreAt(3));
    }

    @Test
    void customCurveForAnotherCoast() {
        final DiurnalWindCurve offshoreMornings = new DiurnalWindCurve(
                List.of(new DiurnalWindCurve.Band(6, 12, 60)), 5);
        assertEquals(60, offshoreMornings.scoreAt(11));
        assertEquals(5, offshoreMornings.scoreAt(12));
    }

    @Test
    void rejectsEmptyBands() {
        assertThrows(IllegalArgumentException.class, () -> new DiurnalWindCurve.Band(9, 9, 10));
        assertThrows(IllegalArgumentException.class, () -> new DiurnalWindCurve.Band(20, 25, 10));
    }

    @Test
    void timeWindowLabels() {
        final TimeWindow w = new TimeWindow(11, 13, "Mid tide conditions");
        assertEquals("11:00 AM", w.startLabel());
        assertEquals("1:00 PM", w.endLabel());
        assertEquals("12:00 PM", TimeWindow.formatHour(12));
        assertEquals("12:00 AM", TimeWindow.formatHour(0));
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(8, 8, ""));
    }
}
