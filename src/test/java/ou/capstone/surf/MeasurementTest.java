package ou.capstone.surf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import ou.capstone.surf.tide.TidePhase;

class MeasurementTest {

    private static Measurement.Builder valid() {
        return new Measurement.Builder()
                .waveHeightFt(4.5)
                .wavePeriodS(12)
                .swellDirectionDeg(280)
                .windSpeedMph(4)
                .windDirectionDeg(50)
                .tideHeightFt(-0.4)
                .tidePhase(TidePhase.LOW);
    }

    @Test
    void buildsWithOptionalTemperaturesAbsent() {
        final Measurement m = valid().build();

        assertEquals(4.5, m.getWaveHeightFt(), 1e-9);
        assertEquals(-0.4, m.getTideHeightFt(), 1e-9, "tides below MLLW are allowed");
        assertFalse(m.getWaterTempF().isPresent());
        assertTrue(valid().waterTempF(54.0).build().getWaterTempF().isPresent());
    }

    @Test
    void equalReadingsAreEqual() {
        assertEquals(valid().build(), valid().build());
        assertEquals(valid().build().hashCode(), valid().build().hashCode());
    }

    @Test
    void rejectsOutOfRangeReadings() {
        assertThrows(IllegalArgumentException.class, () -> valid().waveHeightFt(-1).build());
        assertThrows(IllegalArgumentException.class, () -> valid().wavePeriodS(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> valid().windSpeedMph(-3).build());
        assertThrows(IllegalArgumentException.class, () -> valid().swellDirectionDeg(361).build());
        assertThrows(IllegalArgumentException.class, () -> valid().windDirectionDeg(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> valid().tideHeightFt(Double.POSITIVE_INFINITY).build());
    }

    @Test
    void requiresEveryReading() {
        assertThrows(NullPointerException.class, () -> new Measurement.Builder().waveHeightFt(3).build());
        assertThrows(NullPointerException.class, () -> valid().tidePhase(null).build());
    }
}
