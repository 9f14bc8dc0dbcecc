package ou.capstone.surf;

import java.util.Objects;
import java.util.OptionalDouble;

import org.apache.commons.lang3.Validate;

import ou.capstone.surf.tide.TidePhase;

/**
 * One instant of environmental readings for a surf spot.
 * Units are already normalized: feet, seconds, mph, degrees, Fahrenheit.
 */
public final class Measurement {
    private final double waveHeightFt;
    private final double wavePeriodS;
    private final double swellDirectionDeg;   // direction the swell comes FROM
    private final double windSpeedMph;
    private final double windDirectionDeg;
    private final double tideHeightFt;        // MLLW, may be negative
    private final TidePhase tidePhase;
    private final Double waterTempF;          // nullable
    private final Double airTempF;            // nullable

    /**
     * Builder Pattern (Effective Java Item 2)
     * Every reading is required except the two temperatures. {@link #build()}
     * rejects values a scorer could not make sense of.
     */
    public static class Builder {
        private Double waveHeightFt;
        private Double wavePeriodS;
        private Double swellDirectionDeg;
        private Double windSpeedMph;
        private Double windDirectionDeg;
        private Double tideHeightFt;
        private TidePhase tidePhase;
        private Double waterTempF;
        private Double airTempF;

        public Builder waveHeightFt(double waveHeightFt) {
            this.waveHeightFt = waveHeightFt;
            return this;
        }

        public Builder wavePeriodS(double wavePeriodS) {
            this.wavePeriodS = wavePeriodS;
            return this;
        }

        public Builder swellDirectionDeg(double swellDirectionDeg) {
            this.swellDirectionDeg = swellDirectionDeg;
            return this;
        }

        public Builder windSpeedMph(double windSpeedMph) {
            this.windSpeedMph = windSpeedMph;
            return this;
        }

        public Builder windDirectionDeg(double windDirectionDeg) {
            this.windDirectionDeg = windDirectionDeg;
            return this;
        }

        public Builder tideHeightFt(double tideHeightFt) {
            this.tideHeightFt = tideHeightFt;
            return this;
        }

        public Builder tidePhase(TidePhase tidePhase) {
            this.tidePhase = tidePhase;
            return this;
        }

        public Builder waterTempF(Double waterTempF) {
            this.waterTempF = waterTempF;
            return this;
        }

        public Builder airTempF(Double airTempF) {
            this.airTempF = airTempF;
            return this;
        }

        /**
         * Validates the readings and constructs a Measurement.
         *
         * @throws NullPointerException if a required reading is missing
         * @throws IllegalArgumentException if a reading is out of range
         */
        public Measurement build() {
            Objects.requireNonNull(waveHeightFt, "waveHeightFt is required");
            Objects.requireNonNull(wavePeriodS, "wavePeriodS is required");
            Objects.requireNonNull(swellDirectionDeg, "swellDirectionDeg is required");
            Objects.requireNonNull(windSpeedMph, "windSpeedMph is required");
            Objects.requireNonNull(windDirectionDeg, "windDirectionDeg is required");
            Objects.requireNonNull(tideHeightFt, "tideHeightFt is required");
            Objects.requireNonNull(tidePhase, "tidePhase is required");

            requireNonNegative(waveHeightFt, "waveHeightFt");
            requireNonNegative(wavePeriodS, "wavePeriodS");
            requireNonNegative(windSpeedMph, "windSpeedMph");
            requireBearing(swellDirectionDeg, "swellDirectionDeg");
            requireBearing(windDirectionDeg, "windDirectionDeg");
            Validate.finite(tideHeightFt, "tideHeightFt must be finite");

            return new Measurement(this);
        }
    }

    private Measurement(Builder builder) {
        this.waveHeightFt = builder.waveHeightFt;
        this.wavePeriodS = builder.wavePeriodS;
        this.swellDirectionDeg = builder.swellDirectionDeg;
        this.windSpeedMph = builder.windSpeedMph;
        this.windDirectionDeg = builder.windDirectionDeg;
        this.tideHeightFt = builder.tideHeightFt;
        this.tidePhase = builder.tidePhase;
        this.waterTempF = builder.waterTempF;
        this.airTempF = builder.airTempF;
    }

    /** Shared check for magnitudes: finite and not below zero. */
    public static void requireNonNegative(final double value, final String name) {
        Validate.finite(value, "%s must be finite", name);
        Validate.isTrue(value >= 0.0, "%s must not be negative, got: %s", name, value);
    }

    /** Shared check for compass bearings: within [0, 360]. */
    public static void requireBearing(final double value, final String name) {
        Validate.finite(value, "%s must be finite", name);
        Validate.isTrue(value >= 0.0 && value <= 360.0, "%s must be within 0-360 degrees, got: %s", name, value);
    }

    public double getWaveHeightFt() { return waveHeightFt; }
    public double getWavePeriodS() { return wavePeriodS; }
    public double getSwellDirectionDeg() { return swellDirectionDeg; }
    public double getWindSpeedMph() { return windSpeedMph; }
    public double getWindDirectionDeg() { return windDirectionDeg; }
    public double getTideHeightFt() { return tideHeightFt; }
    public TidePhase getTidePhase() { return tidePhase; }

    public OptionalDouble getWaterTempF() {
        return waterTempF == null ? OptionalDouble.empty() : OptionalDouble.of(waterTempF);
    }

    public OptionalDouble getAirTempF() {
        return airTempF == null ? OptionalDouble.empty() : OptionalDouble.of(airTempF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Measurement)) return false;
        Measurement m = (Measurement) o;
        return Double.compare(waveHeightFt, m.waveHeightFt) == 0
                && Double.compare(wavePeriodS, m.wavePeriodS) == 0
                && Double.compare(swellDirectionDeg, m.swellDirectionDeg) == 0
                && Double.compare(windSpeedMph, m.windSpeedMph) == 0
                && Double.compare(windDirectionDeg, m.windDirectionDeg) == 0
                && Double.compare(tideHeightFt, m.tideHeightFt) == 0
                && tidePhase == m.tidePhase
                && Objects.equals(waterTempF, m.waterTempF)
                && Objects.equals(airTempF, m.airTempF);
    }

    @Override
    public int hashCode() {
        return Objects.hash(waveHeightFt, wavePeriodS, swellDirectionDeg, windSpeedMph,
                windDirectionDeg, tideHeightFt, tidePhase, waterTempF, airTempF);
    }

    @Override
    public String toString() {
        return "Measurement{" +
                "waveHeightFt=" + waveHeightFt +
                ", wavePeriodS=" + wavePeriodS +
                ", swellDirectionDeg=" + swellDirectionDeg +
                ", windSpeedMph=" + windSpeedMph +
                ", windDirectionDeg=" + windDirectionDeg +
                ", tideHeightFt=" + tideHeightFt +
                ", tidePhase=" + tidePhase +
                '}';
    }
}
