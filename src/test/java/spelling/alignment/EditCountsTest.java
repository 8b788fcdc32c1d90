package spelling.alignment;

import org.junit.jupiter.api.Test;
import spelling.Symbols;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class EditCountsTest {

    @Test
    void zeroTableAddsEpsilon() {
        EditCounts counts = EditCounts.zero(List.of("b", "a"));
        assertThat(counts.alphabet()).containsExactly(Symbols.EPSILON, "a", "b");
        assertEquals(0, counts.total());
        assertThat(counts.asMap()).hasSize(3);
        assertThat(counts.asMap().values()).allSatisfy(row -> assertThat(row).hasSize(3));
    }

    @Test
    void rowsSumToOne() {
        EditCounts counts = EditCounts.zero(Set.of("a", "b", "c"));
        counts.increment("a", "a");
        counts.increment("a", "a");
        counts.increment("a", "b");
        counts.add(new AlignedPair("c", Symbols.EPSILON));
        for (double smoothing : new double[]{1.0, 0.5, 0.01}) {
            for (String source : counts.alphabet()) {
                double sum = 0;
                for (String target : counts.alphabet()) {
                    double p = counts.probability(source, target, smoothing);
                    assertThat(p).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
                    sum += p;
                }
                assertEquals(1.0, sum, 1e-9);
            }
        }
    }

    @Test
    void smoothedProbability() {
        EditCounts counts = EditCounts.zero(Set.of("a", "b"));
        counts.increment("a", "a");
        counts.increment("a", "a");
        counts.increment("a", "b");
        assertEquals(3, counts.rowTotal("a"));
        assertEquals(3.0 / 6.0, counts.probability("a", "a", 1.0), 1e-12);
        assertEquals(2.0 / 6.0, counts.probability("a", "b", 1.0), 1e-12);
        assertEquals(1.0 / 6.0, counts.probability("a", Symbols.EPSILON, 1.0), 1e-12);
        assertEquals(1.0 / 3.0, counts.probability("b", "a", 1.0), 1e-12);
        assertEquals(1.0 - 2.0 / 6.0, counts.costFunction(1.0).cost("a", "b"), 1e-12);
    }

    @Test
    void unknownSymbols() {
        EditCounts counts = EditCounts.zero(Set.of("a"));
        assertThatThrownBy(() -> counts.increment("z", "a"))
                .isInstanceOf(UnknownSymbolException.class)
                .satisfies(e -> assertEquals("z", ((UnknownSymbolException) e).getSymbol()));
        assertThatThrownBy(() -> counts.probability("a", "z", 1.0)).isInstanceOf(UnknownSymbolException.class);
        assertThatThrownBy(() -> counts.count("a", "q")).isInstanceOf(UnknownSymbolException.class);
    }

    @Test
    void costFunctionMatchesCostAndIgnoresLaterIncrements() {
        EditCounts counts = EditCounts.zero(Set.of("a", "o", "r"));
        counts.increment("a", "o");
        counts.increment("a", "o");
        counts.increment("r", Symbols.EPSILON);
        CostFunction costs = counts.costFunction(0.5);
        for (String source : counts.alphabet()) {
            for (String target : counts.alphabet()) {
                assertEquals(counts.cost(source, target, 0.5), costs.cost(source, target), source + ":" + target);
            }
        }

        double before = costs.cost("a", "o");
        counts.increment("a", "r");
        assertEquals(before, costs.cost("a", "o"));
        assertThatThrownBy(() -> costs.cost("x", "a")).isInstanceOf(UnknownSymbolException.class);
        assertThatThrownBy(() -> costs.cost("a", "x")).isInstanceOf(UnknownSymbolException.class);
    }

    @Test
    void nonPositiveSmoothingIsRejected() {
        EditCounts counts = EditCounts.zero(Set.of("a"));
        assertThatThrownBy(() -> counts.costFunction(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> counts.costFunction(-1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeSumsCounts() {
        EditCounts left = EditCounts.zero(Set.of("a", "b"));
        left.increment("a", "b");
        EditCounts right = EditCounts.zero(Set.of("a", "b"));
        right.increment("a", "b");
        right.increment(Symbols.EPSILON, "a");
        left.merge(right);
        assertEquals(2, left.count("a", "b"));
        assertEquals(1, left.count(Symbols.EPSILON, "a"));
        assertEquals(3, left.total());

        assertThatThrownBy(() -> left.merge(EditCounts.zero(Set.of("a"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void structuralEquality() {
        EditCounts one = EditCounts.zero(Set.of("a", "b"));
        EditCounts two = EditCounts.zero(Set.of("b", "a"));
        assertEquals(one, two);
        assertEquals(one.hashCode(), two.hashCode());
        one.increment("a", "b");
        assertThat(one).isNotEqualTo(two);
        two.increment("a", "b");
        assertEquals(one, two);
    }

    @Test
    void mapViewRoundTripsAndIsReadOnly() {
        EditCounts counts = EditCounts.zero(Set.of("a", "b"));
        counts.increment("b", "a");
        counts.increment("a", Symbols.EPSILON);
        assertEquals(counts, EditCounts.fromMap(counts.asMap()));
        assertThatThrownBy(() -> counts.asMap().get("a").put("a", 5))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fromMapValidatesShape() {
        Map<String, Map<String, Integer>> noEpsilon = new TreeMap<>();
        noEpsilon.put("a", Map.of("a", 1));
        assertThatThrownBy(() -> EditCounts.fromMap(noEpsilon)).isInstanceOf(IllegalArgumentException.class);

        Map<String, Map<String, Integer>> ragged = new TreeMap<>();
        ragged.put("", Map.of("", 0, "a", 1));
        ragged.put("a", Map.of("a", 1));
        assertThatThrownBy(() -> EditCounts.fromMap(ragged)).isInstanceOf(IllegalArgumentException.class);

        Map<String, Map<String, Integer>> negative = new TreeMap<>();
        negative.put("", Map.of("", 0, "a", 1));
        negative.put("a", Map.of("", 0, "a", -1));
        assertThatThrownBy(() -> EditCounts.fromMap(negative))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }
}
