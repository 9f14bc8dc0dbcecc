package ou.capstone.surf.score;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import ou.capstone.surf.Measurement;

@ExtendWith(MockitoExtension.class)
final class WeightedConditionScorerTest {

    @Mock
    private ConditionScorer first;

    @Mock
    private ConditionScorer second;

    @Test
    void sumsWeightedComponentScores() {
        final Measurement m = mock(Measurement.class);
        when(first.score(m)).thenReturn(80.0);
        when(second.score(m)).thenReturn(40.0);

        final WeightedConditionScorer scorer = new WeightedConditionScorer(List.of(
                new WeightedConditionScorer.Component("first", 0.75, first),
                new WeightedConditionScorer.Component("second", 0.25, second)));

        assertEquals(70.0, scorer.score(m), 1e-9);
        assertEquals(1.0, scorer.totalWeight(), 1e-9);
    }

    @Test
    void sameScorerCanAppearTwice() {
        final Measurement m = mock(Measurement.class);
        when(first.score(m)).thenReturn(50.0);

        final WeightedConditionScorer scorer = new WeightedConditionScorer(List.of(
                new WeightedConditionScorer.Component("a", 0.2, first),
                new WeightedConditionScorer.Component("b", 0.1, first)));

        assertEquals(15.0, scorer.score(m), 1e-9);
        verify(first, times(2)).score(m);
    }

    @Test
    void rejectsNegativeWeights() {
        assertThrows(IllegalArgumentException.class,
                () -> new WeightedConditionScorer.Component("bad", -0.1, first));
    }
}
