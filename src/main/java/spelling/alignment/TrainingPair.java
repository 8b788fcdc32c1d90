package spelling.alignment;

import java.util.Locale;
import java.util.Objects;

/**
 * A misspelling together with the word that was meant.
 */
public record TrainingPair(String misspelling, String correct) {

    public TrainingPair {
        Objects.requireNonNull(misspelling, "misspelling");
        Objects.requireNonNull(correct, "correct");
    }

    public TrainingPair lowerCase() {
        return new TrainingPair(misspelling.toLowerCase(Locale.ROOT), correct.toLowerCase(Locale.ROOT));
    }
}
