// # Estimating edit costs
//
// We learn how expensive each character edit is from a list of (misspelling, correct word) pairs. The procedure is a
// hard-EM style loop:
//
// 1. Align every pair with uniform costs and count how often each (source, target) symbol pair shows up.
// 2. Turn those counts into smoothed costs, re-align every pair with them, and count again from scratch.
// 3. Repeat step 2 until a pass produces exactly the table it started from.
//
// Counts are never carried over from one pass to the next. Each pass only uses the previous table to steer the
// alignments. In practice the loop settles within about ten passes, but nothing guarantees that, so the number of
// passes is capped and hitting the cap is reported rather than treated as a failure.
package spelling.alignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spelling.Symbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

public class EditCostEstimator {

    private static final Logger log = LoggerFactory.getLogger(EditCostEstimator.class);

    public static final double DEFAULT_SMOOTHING = 1.0;
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final double smoothing;
    private final int maxIterations;
    private final boolean parallel;

    public EditCostEstimator() {
        this(DEFAULT_SMOOTHING, DEFAULT_MAX_ITERATIONS, false);
    }

    /**
     * @param smoothing     additive smoothing constant used when counts are turned into costs
     * @param maxIterations maximum number of re-estimation passes
     * @param parallel      whether the pairs of one pass are aligned in parallel
     */
    public EditCostEstimator(double smoothing, int maxIterations, boolean parallel) {
        if (smoothing <= 0 || Double.isNaN(smoothing)) {
            throw new IllegalArgumentException("smoothing must be positive, got " + smoothing);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.smoothing = smoothing;
        this.maxIterations = maxIterations;
        this.parallel = parallel;
    }

    /**
     * The outcome of training.
     *
     * @param counts     the last count table produced
     * @param iterations number of re-estimation passes run after the initial uniform-cost pass
     * @param converged  whether the last pass reproduced its input table
     */
    public record Estimate(EditCounts counts, int iterations, boolean converged) {
    }

    public Estimate estimate(List<TrainingPair> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        List<TrainingPair> lowerCased = new ArrayList<>(pairs.size());
        SortedSet<String> symbols = new TreeSet<>();
        for (TrainingPair pair : pairs) {
            TrainingPair lower = pair.lowerCase();
            lowerCased.add(lower);
            symbols.addAll(Symbols.split(lower.misspelling()));
            symbols.addAll(Symbols.split(lower.correct()));
        }
        log.debug("Estimating edit costs from {} pairs over {} symbols", lowerCased.size(), symbols.size() + 1);

        EditCounts previous = countEdits(lowerCased, symbols, CostFunction.UNIFORM);
        int iterations = 0;
        while (iterations < maxIterations) {
            EditCounts next = countEdits(lowerCased, symbols, previous.costFunction(smoothing));
            iterations++;
            if (next.equals(previous)) {
                log.info("Edit costs converged after {} iteration(s)", iterations);
                return new Estimate(next, iterations, true);
            }
            log.debug("Iteration {} changed the count table", iterations);
            previous = next;
        }
        log.warn("Edit costs did not converge within {} iterations; returning the last table", maxIterations);
        return new Estimate(previous, iterations, false);
    }

    /**
     * Aligns every pair with the given cost function and counts the aligned symbol pairs into a fresh table over
     * {@code symbols} plus epsilon.
     */
    public EditCounts countEdits(List<TrainingPair> pairs, SortedSet<String> symbols, CostFunction costFunction) {
        WeightedAligner aligner = new WeightedAligner(costFunction);
        Stream<TrainingPair> stream = parallel ? pairs.parallelStream() : pairs.stream();
        // Each worker fills its own table; the combiner sums them, so no table is written by two threads.
        return stream.collect(
                () -> EditCounts.zero(symbols),
                (counts, pair) -> aligner.align(pair.misspelling(), pair.correct()).forEach(counts::add),
                EditCounts::merge);
    }
}
