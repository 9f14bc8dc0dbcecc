package ou.capstone.surf.history;

import java.time.Month;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ou.capstone.surf.config.JsonResources;

/**
 * Fixed monthly-average table for the region. Every month must be present.
 */
public final class HistoricalAverages {
    private static final Logger logger = LoggerFactory.getLogger(HistoricalAverages.class);

    public static final String RESOURCE_PATH = "/data/historical-averages.json";

    private final Map<Month, MonthlyAverage> byMonth;

    public HistoricalAverages(final Collection<MonthlyAverage> rows) {
        final Map<Month, MonthlyAverage> map = new EnumMap<>(Month.class);
        for (final MonthlyAverage row : rows) {
            if (map.put(row.month(), row) != null) {
                throw new IllegalArgumentException("Duplicate monthly average for " + row.month());
            }
        }
        if (map.size() != Month.values().length) {
            throw new IllegalArgumentException("Monthly averages must cover all 12 months, got " + map.size());
        }
        this.byMonth = Collections.unmodifiableMap(map);
    }

    /** Loads the bundled table. */
    public static HistoricalAverages loadDefault() {
        return fromJson(JsonResources.read(RESOURCE_PATH), RESOURCE_PATH);
    }

    static HistoricalAverages fromJson(final JsonNode root, final String source) {
        final List<MonthlyAverage> rows = new ArrayList<>();
        for (final JsonNode node : JsonResources.requireArray(root, "months", source)) {
            final int monthNumber = (int) JsonResources.requireDouble(node, "month", source);
            if (monthNumber < 1 || monthNumber > 12) {
                throw new IllegalStateException(source + ": month must be 1-12, got " + monthNumber);
            }
            rows.add(new MonthlyAverage(
                    Month.of(monthNumber),
                    JsonResources.requireDouble(node, "avgScore", source),
                    JsonResources.requireDouble(node, "avgWaveHeight", source),
                    JsonResources.requireDouble(node, "goodDaysPct", source)));
        }
        try {
            final HistoricalAverages table = new HistoricalAverages(rows);
            logger.info("Loaded monthly averages from {}", source);
            return table;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(source + ": " + e.getMessage(), e);
        }
    }

    public MonthlyAverage forMonth(final Month month) {
        return byMonth.get(month);
    }
}
