package ou.capstone.surf.tide;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tide predictions for one station: an hourly curve plus the discrete
 * high/low events. Both lists must be in time order.
 */
public final class TideSeries {

    private static final TideSeries EMPTY = new TideSeries(List.of(), List.of());

    private final List<TidePrediction> hourly;
    private final List<TidePrediction> highLow;

    public TideSeries(final List<TidePrediction> hourly, final List<TidePrediction> highLow) {
        this.hourly = List.copyOf(hourly);
        this.highLow = List.copyOf(highLow);
        requireOrdered(this.hourly, "hourly");
        requireOrdered(this.highLow, "highLow");
        for (final TidePrediction p : this.highLow) {
            if (p.type() == null) {
                throw new IllegalArgumentException("High/low prediction at " + p.time() + " has no H/L tag");
            }
        }
    }

    public static TideSeries empty() {
        return EMPTY;
    }

    public List<TidePrediction> hourly() {
        return hourly;
    }

    public List<TidePrediction> highLow() {
        return highLow;
    }

    public boolean isEmpty() {
        return hourly.isEmpty() && highLow.isEmpty();
    }

    /** The part of this series that falls on {@code date}. */
    public TideSeries forDate(final LocalDate date) {
        return new TideSeries(onDate(hourly, date), onDate(highLow, date));
    }

    private static List<TidePrediction> onDate(final List<TidePrediction> predictions, final LocalDate date) {
        return predictions.stream()
                .filter(p -> p.time().toLocalDate().equals(date))
                .collect(Collectors.toList());
    }

    private static void requireOrdered(final List<TidePrediction> predictions, final String name) {
        for (int i = 1; i < predictions.size(); i++) {
            if (predictions.get(i).time().isBefore(predictions.get(i - 1).time())) {
                throw new IllegalArgumentException(
                        name + " predictions out of order at " + predictions.get(i).time());
            }
        }
    }

    @Override
    public String toString() {
        return "TideSeries{hourly=" + hourly.size() + ", highLow=" + highLow.size() + '}';
    }
}
