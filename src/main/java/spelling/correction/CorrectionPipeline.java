// # Putting it together
//
// The corrector chains two machines:
//
// 1. The lexicon, a minimized automaton over the vocabulary, lifted to an identity transducer.
// 2. The error model, which rewrites intended symbols into what was typed.
//
// Composing them gives a transducer from vocabulary words to their plausible misspellings. We want the opposite
// direction, from a misspelling to vocabulary words, so the composed machine is inverted once up front. Each query is
// then a single transduction of the typed word.
package spelling.correction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spelling.alignment.EditCounts;
import spelling.automaton.Automaton;
import spelling.transducer.Transducer;
import spelling.transducer.Transduction;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public class CorrectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(CorrectionPipeline.class);

    private static final Comparator<Suggestion> RANKING = Comparator
            .comparingDouble(Suggestion::score).reversed()
            .thenComparing(Suggestion::word);

    private final Automaton lexicon;
    private final Transducer machine;

    /**
     * @param vocabulary the words that may be suggested
     * @param counts     converged edit counts
     * @param smoothing  additive smoothing constant for turning counts into probabilities
     */
    public CorrectionPipeline(Collection<String> vocabulary, EditCounts counts, double smoothing) {
        Objects.requireNonNull(vocabulary, "vocabulary");
        Objects.requireNonNull(counts, "counts");

        lexicon = new Automaton();
        lexicon.buildTrie(vocabulary);
        int trieStates = lexicon.states().size();
        lexicon.minimize();

        Transducer errorModel = ErrorModel.build(counts, smoothing);
        Transducer composed = Transducer.compose(Transducer.fromAutomaton(lexicon), errorModel);
        machine = composed.invert();

        log.info("Lexicon of {} words: {} trie states, {} after minimization; corrector has {} states and {} arcs",
                vocabulary.size(), trieStates, lexicon.states().size(), machine.states().size(), machine.numArcs());
    }

    /**
     * Returns at most {@code topK} corrections for {@code word}, best first. Paths that produce the same candidate at
     * the same weight are reported once; the same candidate reached at different weights is reported once per weight.
     * The word itself is never suggested.
     */
    public List<Suggestion> suggest(String word, int topK) {
        checkTopK(topK);
        return machine.transduce(word.toLowerCase(Locale.ROOT))
                .distinct()
                .map(t -> new Suggestion(t.output(), t.score()))
                .sorted(RANKING)
                .limit(topK)
                .collect(Collectors.toList());
    }

    /**
     * Like {@link #suggest(String, int)}, but each candidate appears once, with the score of its best path.
     */
    public List<Suggestion> suggestDistinct(String word, int topK) {
        checkTopK(topK);
        Map<String, Double> best = new LinkedHashMap<>();
        machine.transduce(word.toLowerCase(Locale.ROOT))
                .forEach(t -> best.merge(t.output(), t.score(), Math::max));
        return best.entrySet().stream()
                .map(e -> new Suggestion(e.getKey(), e.getValue()))
                .sorted(RANKING)
                .limit(topK)
                .collect(Collectors.toList());
    }

    public Automaton lexicon() {
        return lexicon;
    }

    /**
     * The inverted composition of lexicon and error model, mapping typed words to vocabulary words.
     */
    public Transducer machine() {
        return machine;
    }

    private static void checkTopK(int topK) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must not be negative, got " + topK);
        }
    }

    // Every accepted path, duplicates included.
    List<Transduction> transductions(String word) {
        return machine.transduce(word.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }
}
