// # Weighted alignment
//
// The aligner is the textbook edit-distance dynamic program, with one twist: the cost of each edit comes from a
// pluggable `CostFunction`. With `CostFunction.UNIFORM` every edit costs 1 and the result is the Levenshtein distance.
// With costs derived from an `EditCounts` table, frequent edits get cheap and rare edits stay close to 1.
//
// Matching symbols are never charged, even under a learned model, since the model only scores edits. The first row and
// column of the table are filled with unit increments regardless of the cost function.
package spelling.alignment;

import spelling.Symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class WeightedAligner {

    private final CostFunction costFunction;

    public WeightedAligner() {
        this(CostFunction.UNIFORM);
    }

    public WeightedAligner(CostFunction costFunction) {
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
    }

    /**
     * Returns the total cost of the cheapest alignment of {@code source} to {@code target}.
     */
    public double distance(String source, String target) {
        List<String> s1 = Symbols.split(source);
        List<String> s2 = Symbols.split(target);
        return fillTable(s1, s2)[s1.size()][s2.size()];
    }

    /**
     * Returns the cheapest alignment of {@code source} to {@code target}, in order. The non-empty sources of the
     * returned pairs spell {@code source}, the non-empty targets spell {@code target}.
     * <p>
     * When several alignments share the minimum cost, substitution wins over insertion, and insertion over deletion.
     *
     * @throws UnknownSymbolException if the cost function is backed by a table that does not know one of the symbols
     */
    public List<AlignedPair> align(String source, String target) {
        List<String> s1 = Symbols.split(source);
        List<String> s2 = Symbols.split(target);
        double[][] table = fillTable(s1, s2);

        // ## Traceback
        //
        // We walk back from the bottom-right cell, recomputing which arm of the recurrence produced each stored value.
        // That avoids keeping a second table of back-pointers. The arms are checked in tie-break order.
        List<AlignedPair> alignment = new ArrayList<>(s1.size() + s2.size());
        int i = s1.size();
        int j = s2.size();
        while (i > 0 || j > 0) {
            if (i == 0) {
                alignment.add(new AlignedPair(Symbols.EPSILON, s2.get(j - 1)));
                j--;
            } else if (j == 0) {
                alignment.add(new AlignedPair(s1.get(i - 1), Symbols.EPSILON));
                i--;
            } else {
                String ch1 = s1.get(i - 1);
                String ch2 = s2.get(j - 1);
                double value = table[i][j];
                if (ch1.equals(ch2)) {
                    alignment.add(new AlignedPair(ch1, ch2));
                    i--;
                    j--;
                } else if (substitution(table, i, j, ch1, ch2) == value) {
                    alignment.add(new AlignedPair(ch1, ch2));
                    i--;
                    j--;
                } else if (insertion(table, i, j, ch1) == value) {
                    alignment.add(new AlignedPair(Symbols.EPSILON, ch2));
                    j--;
                } else {
                    alignment.add(new AlignedPair(ch1, Symbols.EPSILON));
                    i--;
                }
            }
        }
        Collections.reverse(alignment);
        return alignment;
    }

    private double[][] fillTable(List<String> s1, List<String> s2) {
        double[][] table = new double[s1.size() + 1][s2.size() + 1];
        for (int j = 0; j <= s2.size(); j++) {
            table[0][j] = j;
        }
        for (int i = 0; i <= s1.size(); i++) {
            table[i][0] = i;
        }
        for (int i = 1; i <= s1.size(); i++) {
            String ch1 = s1.get(i - 1);
            for (int j = 1; j <= s2.size(); j++) {
                String ch2 = s2.get(j - 1);
                if (ch1.equals(ch2)) {
                    table[i][j] = table[i - 1][j - 1];
                } else {
                    double best = substitution(table, i, j, ch1, ch2);
                    double insertion = insertion(table, i, j, ch1);
                    if (insertion < best) {
                        best = insertion;
                    }
                    double deletion = deletion(table, i, j, ch1);
                    if (deletion < best) {
                        best = deletion;
                    }
                    table[i][j] = best;
                }
            }
        }
        return table;
    }

    // The three arms of the recurrence. Traceback calls them again with the same operands, so the doubles compare
    // exactly equal to what the forward pass stored.
    private double substitution(double[][] table, int i, int j, String ch1, String ch2) {
        return table[i - 1][j - 1] + costFunction.cost(ch1, ch2);
    }

    // An insertion is priced from the epsilon row at the current source symbol, not at the inserted target symbol.
    // Traceback still records it as (epsilon, inserted target symbol).
    private double insertion(double[][] table, int i, int j, String source) {
        return table[i][j - 1] + costFunction.cost(Symbols.EPSILON, source);
    }

    private double deletion(double[][] table, int i, int j, String deleted) {
        return table[i - 1][j] + costFunction.cost(deleted, Symbols.EPSILON);
    }
}
