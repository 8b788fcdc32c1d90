package spelling.alignment;

import spelling.Symbols;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * How often each source symbol was aligned to each target symbol, over a fixed alphabet that always contains
 * {@link Symbols#EPSILON}.
 * <p>
 * The table is square: every symbol of the alphabet has a row, and every row has a column for every symbol. Rows are the
 * source side of the alignments (the misspelling), columns the target side (the intended word).
 * <p>
 * From the counts we derive a smoothed probability per row,
 * {@code p(b | a) = (count[a][b] + alpha) / (rowTotal(a) + alpha * |alphabet|)},
 * and the alignment cost {@code 1 - p(b | a)}. Two tables are equal when their alphabets and counts are equal.
 */
public final class EditCounts {

    private final SortedSet<String> alphabet;
    private final SortedMap<String, SortedMap<String, Integer>> counts;

    private EditCounts(SortedSet<String> alphabet) {
        this.alphabet = alphabet;
        this.counts = new TreeMap<>();
        for (String source : alphabet) {
            SortedMap<String, Integer> row = new TreeMap<>();
            for (String target : alphabet) {
                row.put(target, 0);
            }
            counts.put(source, row);
        }
    }

    /**
     * Creates an all-zero table over the given symbols plus epsilon.
     */
    public static EditCounts zero(Collection<String> symbols) {
        SortedSet<String> alphabet = new TreeSet<>(symbols);
        alphabet.add(Symbols.EPSILON);
        return new EditCounts(alphabet);
    }

    /**
     * Rebuilds a table from nested {@code source -> target -> count} maps, as written by {@link #asMap()}.
     *
     * @throws IllegalArgumentException if the rows do not form a square table over an alphabet containing epsilon, or
     *                                  if a count is negative
     */
    public static EditCounts fromMap(Map<String, ? extends Map<String, Integer>> rows) {
        SortedSet<String> alphabet = new TreeSet<>(rows.keySet());
        if (alphabet.contains(Symbols.EPSILON) == false) {
            throw new IllegalArgumentException("Cost table has no row for the empty symbol");
        }
        EditCounts table = new EditCounts(alphabet);
        for (Map.Entry<String, ? extends Map<String, Integer>> row : rows.entrySet()) {
            Map<String, Integer> columns = row.getValue();
            if (columns == null || columns.keySet().equals(alphabet) == false) {
                throw new IllegalArgumentException("Row '" + Symbols.display(row.getKey())
                        + "' does not have exactly one column per alphabet symbol");
            }
            for (Map.Entry<String, Integer> cell : columns.entrySet()) {
                Integer count = cell.getValue();
                if (count == null || count < 0) {
                    throw new IllegalArgumentException("Invalid count " + count + " for "
                            + Symbols.display(row.getKey()) + ":" + Symbols.display(cell.getKey()));
                }
                table.counts.get(row.getKey()).put(cell.getKey(), count);
            }
        }
        return table;
    }

    public SortedSet<String> alphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public void increment(String source, String target) {
        SortedMap<String, Integer> row = row(source);
        Integer current = row.get(target);
        if (current == null) {
            throw new UnknownSymbolException(target);
        }
        row.put(target, current + 1);
    }

    public void add(AlignedPair pair) {
        increment(pair.source(), pair.target());
    }

    /**
     * Adds every count of {@code other} to this table. Both tables must share one alphabet.
     */
    public EditCounts merge(EditCounts other) {
        if (alphabet.equals(other.alphabet) == false) {
            throw new IllegalArgumentException("Cannot merge count tables over different alphabets");
        }
        for (Map.Entry<String, SortedMap<String, Integer>> row : other.counts.entrySet()) {
            SortedMap<String, Integer> mine = counts.get(row.getKey());
            row.getValue().forEach((target, count) -> mine.merge(target, count, Integer::sum));
        }
        return this;
    }

    public int count(String source, String target) {
        Integer count = row(source).get(target);
        if (count == null) {
            throw new UnknownSymbolException(target);
        }
        return count;
    }

    public int rowTotal(String source) {
        int total = 0;
        for (int count : row(source).values()) {
            total += count;
        }
        return total;
    }

    public int total() {
        int total = 0;
        for (String source : alphabet) {
            total += rowTotal(source);
        }
        return total;
    }

    /**
     * Smoothed probability of rewriting {@code source} as {@code target}. Every cell is strictly positive for a positive
     * smoothing constant, and each row sums to 1.
     */
    public double probability(String source, String target, double smoothing) {
        SortedMap<String, Integer> row = row(source);
        Integer count = row.get(target);
        if (count == null) {
            throw new UnknownSymbolException(target);
        }
        return (count + smoothing) / (rowTotal(source) + smoothing * row.size());
    }

    public double cost(String source, String target, double smoothing) {
        return 1.0 - probability(source, target, smoothing);
    }

    /**
     * Returns {@link #cost} as a {@link CostFunction}. The counts and row totals are copied when the function is
     * created, so later increments to this table do not show through, and a lookup does not re-sum its row.
     */
    public CostFunction costFunction(double smoothing) {
        if (smoothing <= 0 || Double.isNaN(smoothing)) {
            throw new IllegalArgumentException("smoothing must be positive, got " + smoothing);
        }
        Map<String, Map<String, Integer>> rows = new HashMap<>();
        Map<String, Double> denominators = new HashMap<>();
        counts.forEach((source, row) -> {
            rows.put(source, new HashMap<>(row));
            denominators.put(source, rowTotal(source) + smoothing * row.size());
        });
        return (source, target) -> {
            Map<String, Integer> row = rows.get(source);
            if (row == null) {
                throw new UnknownSymbolException(source);
            }
            Integer count = row.get(target);
            if (count == null) {
                throw new UnknownSymbolException(target);
            }
            return 1.0 - (count + smoothing) / denominators.get(source);
        };
    }

    /**
     * Read-only view of the counts, keyed by source and then target symbol.
     */
    public SortedMap<String, SortedMap<String, Integer>> asMap() {
        SortedMap<String, SortedMap<String, Integer>> view = new TreeMap<>();
        counts.forEach((source, row) -> view.put(source, Collections.unmodifiableSortedMap(row)));
        return Collections.unmodifiableSortedMap(view);
    }

    private SortedMap<String, Integer> row(String source) {
        SortedMap<String, Integer> row = counts.get(source);
        if (row == null) {
            throw new UnknownSymbolException(source);
        }
        return row;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        EditCounts that = (EditCounts) o;
        return alphabet.equals(that.alphabet) && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, counts);
    }

    @Override
    public String toString() {
        return "EditCounts{alphabet=" + alphabet.size() + ", total=" + total() + "}";
    }
}
