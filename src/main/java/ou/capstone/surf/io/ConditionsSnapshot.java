package ou.capstone.surf.io;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.surf.Measurement;
import ou.capstone.surf.spots.LocationProfile;
import ou.capstone.surf.tide.TideAnalyzer;
import ou.capstone.surf.tide.TideSeries;

/**
 * Raw readings already fetched for a moment in time: buoy and wind values
 * per spot plus tide series per station. Turns into {@link Measurement}s once
 * the tide at each spot's station is resolved.
 */
public final class ConditionsSnapshot {
    private static final Logger logger = LoggerFactory.getLogger(ConditionsSnapshot.class);

    private final ZonedDateTime now;
    private final Map<String, SpotReading> readings;
    private final Map<String, TideSeries> tideStations;

    public ConditionsSnapshot(final ZonedDateTime now,
                              final Map<String, SpotReading> readings,
                              final Map<String, TideSeries> tideStations) {
        this.now = Objects.requireNonNull(now, "now is required");
        this.readings = Collections.unmodifiableMap(new LinkedHashMap<>(readings));
        this.tideStations = Collections.unmodifiableMap(new LinkedHashMap<>(tideStations));
    }

    public ZonedDateTime getNow() {
        return now;
    }

    /** Same readings, evaluated at a different moment. */
    public ConditionsSnapshot withNow(final ZonedDateTime otherNow) {
        return new ConditionsSnapshot(otherNow, readings, tideStations);
    }

    public ZoneId getZone() {
        return now.getZone();
    }

    public Optional<SpotReading> reading(final String spotId) {
        return Optional.ofNullable(readings.get(spotId));
    }

    /** Tide series for the station, or an empty series if the station is unknown. */
    public TideSeries tideFor(final String stationId) {
        if (stationId == null) {
            return TideSeries.empty();
        }
        return tideStations.getOrDefault(stationId, TideSeries.empty());
    }

    /**
     * Builds a measurement for every spot that has a reading. Spots without
     * one are left out, which the ranker scores as "no data".
     */
    public Map<String, Measurement> measurementsFor(final List<LocationProfile> spots) {
        final Map<String, Measurement> out = new LinkedHashMap<>();
        for (final LocationProfile spot : spots) {
            final SpotReading reading = readings.get(spot.id());
            if (reading == null) {
                logger.warn("No reading in snapshot for spot {}", spot.id());
                continue;
            }
            final TideSeries tide = tideFor(spot.tideStation());
            if (tide.isEmpty()) {
                logger.warn("No tide series for station {} (spot {}), tide height defaults to 0",
                        spot.tideStation(), spot.id());
            }
            out.put(spot.id(), reading.toMeasurement(tide, now));
        }
        return out;
    }

    /**
     * One spot's raw readings.
     *
     * @param driveMinutes drive time to the spot, null when unknown
     */
    public record SpotReading(String spotId,
                              double waveHeightFt,
                              double wavePeriodS,
                              double swellDirectionDeg,
                              double windSpeedMph,
                              double windDirectionDeg,
                              Double waterTempF,
                              Double airTempF,
                              Integer driveMinutes) {

        public SpotReading {
            Objects.requireNonNull(spotId, "spotId is required");
        }

        Measurement toMeasurement(final TideSeries tide, final ZonedDateTime now) {
            final LocalDateTime local = now.toLocalDateTime();
            return new Measurement.Builder()
                    .waveHeightFt(waveHeightFt)
                    .wavePeriodS(wavePeriodS)
                    .swellDirectionDeg(swellDirectionDeg)
                    .windSpeedMph(windSpeedMph)
                    .windDirectionDeg(windDirectionDeg)
                    .tideHeightFt(TideAnalyzer.currentHeight(tide, local))
                    .tidePhase(TideAnalyzer.phase(tide, local))
                    .waterTempF(waterTempF)
                    .airTempF(airTempF)
                    .build();
        }
    }
}
