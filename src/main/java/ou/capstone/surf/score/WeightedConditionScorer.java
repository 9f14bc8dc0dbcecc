package ou.capstone.surf.score;

import java.util.List;
import java.util.Objects;

import ou.capstone.surf.Measurement;

/**
 * Combines several ConditionScorer rules into a weighted sum.
 */
public final class WeightedConditionScorer implements ConditionScorer {

    private final List<Component> components;

    public WeightedConditionScorer(final List<Component> components) {
        this.components = List.copyOf(components);
    }

    @Override
    public double score(final Measurement measurement) {
        double total = 0.0;
        for (Component c : components) {
            total += c.weight() * c.scorer().score(measurement);
        }
        return total;
    }

    /** Sum of all weights; 1.0 for a normalized table. */
    public double totalWeight() {
        return components.stream().mapToDouble(Component::weight).sum();
    }

    /** One named, weighted contribution. */
    public record Component(String name, double weight, ConditionScorer scorer) {
        public Component {
            Objects.requireNonNull(scorer, "scorer is required");
            if (!Double.isFinite(weight) || weight < 0.0) {
                throw new IllegalArgumentException("Weight must be a non-negative number, got: " + weight);
            }
        }
    }
}
