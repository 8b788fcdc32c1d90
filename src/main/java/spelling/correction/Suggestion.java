package spelling.correction;

/**
 * A correction candidate and its probability-like score. Higher scores rank first.
 */
public record Suggestion(String word, double score) {

    @Override
    public String toString() {
        return word + " ~ " + score;
    }
}
