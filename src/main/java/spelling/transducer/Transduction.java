package spelling.transducer;

/**
 * One accepting path through a transducer.
 *
 * @param output the concatenated output symbols of the path
 * @param weight the summed arc weights of the path
 */
public record Transduction(String output, double weight) {

    /**
     * Probability-like score of the path, {@code exp(-weight)}. Higher is better.
     */
    public double score() {
        return Math.exp(-weight);
    }
}
