// # Command-line spelling corrector
//
// Three commands, matching the three stages of the corrector:
//
// * `train <pairs.tsv> <weights.json>` learns edit counts from tab-separated (misspelling, correct) pairs and saves
//   them,
// * `suggest <vocabulary.txt> <weights.json> <word> [topK]` builds the corrector and prints ranked candidates, and
// * `dot <vocabulary.txt> [minimize]` prints the lexicon automaton in Graphviz format.
//
// Smoothing, iteration cap, default topK and parallel training come from `SpellCheckerOptions.load()`.
package spelling.tools;

import spelling.alignment.EditCostEstimator;
import spelling.alignment.EditCounts;
import spelling.alignment.TrainingPair;
import spelling.automaton.Automaton;
import spelling.correction.CorrectionPipeline;
import spelling.correction.Suggestion;
import spelling.io.CostTableStore;
import spelling.io.TrainingPairReader;
import spelling.io.VocabularyReader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class SpellChecker {

    private final SpellCheckerOptions options;
    private final PrintStream out;

    public SpellChecker(SpellCheckerOptions options, PrintStream out) {
        this.options = options;
        this.out = out;
    }

    public EditCostEstimator.Estimate train(Path pairsFile, Path weightsFile) throws IOException {
        List<TrainingPair> pairs = TrainingPairReader.read(pairsFile);
        EditCostEstimator.Estimate estimate = options.estimator().estimate(pairs);
        new CostTableStore().write(estimate.counts(), weightsFile);
        out.println("counts estimated from " + pairs.size() + " pairs");
        out.println("iterations: " + estimate.iterations() + (estimate.converged() ? "" : " (not converged)"));
        return estimate;
    }

    public List<Suggestion> suggest(Path vocabularyFile, Path weightsFile, String word, int topK) throws IOException {
        List<String> vocabulary = VocabularyReader.read(vocabularyFile);
        EditCounts counts = new CostTableStore().read(weightsFile);
        CorrectionPipeline pipeline = new CorrectionPipeline(vocabulary, counts, options.smoothing());
        List<Suggestion> suggestions = pipeline.suggest(word, topK);
        out.println("entered word: " + word);
        out.println("candidate corrections...");
        for (int i = 0; i < suggestions.size(); i++) {
            Suggestion suggestion = suggestions.get(i);
            out.println((i + 1) + ". " + suggestion.word() + " ~ " + suggestion.score());
        }
        return suggestions;
    }

    public Automaton dot(Path vocabularyFile, boolean minimize) throws IOException {
        Automaton lexicon = new Automaton();
        lexicon.buildTrie(VocabularyReader.read(vocabularyFile));
        if (minimize) {
            lexicon.minimize();
        }
        out.print(lexicon.toDot());
        return lexicon;
    }

    private static void usage(PrintStream err) {
        err.println("Usage: java spelling.tools.SpellChecker <command> ...");
        err.println("  train <pairs.tsv> <weights.json>");
        err.println("  suggest <vocabulary.txt> <weights.json> <word> [topK]");
        err.println("  dot <vocabulary.txt> [minimize]");
    }

    public static void main(String[] args) throws IOException {
        run(args, SpellCheckerOptions.load(), System.out, System.err);
    }

    /**
     * Runs one command. Returns false, after printing the usage to {@code err}, when the arguments are not understood.
     */
    static boolean run(String[] args, SpellCheckerOptions options, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 1) {
            usage(err);
            return false;
        }
        SpellChecker spellChecker = new SpellChecker(options, out);
        switch (args[0]) {
            case "train":
                if (args.length != 3) {
                    usage(err);
                    return false;
                }
                spellChecker.train(Paths.get(args[1]), Paths.get(args[2]));
                return true;
            case "suggest":
                if (args.length != 4 && args.length != 5) {
                    usage(err);
                    return false;
                }
                int topK = options.topK();
                if (args.length == 5) {
                    try {
                        topK = Integer.parseInt(args[4]);
                    } catch (NumberFormatException e) {
                        err.println("topK must be a whole number, got " + args[4]);
                        usage(err);
                        return false;
                    }
                    if (topK < 0) {
                        err.println("topK must not be negative, got " + topK);
                        usage(err);
                        return false;
                    }
                }
                spellChecker.suggest(Paths.get(args[1]), Paths.get(args[2]), args[3], topK);
                return true;
            case "dot":
                if (args.length != 2 && args.length != 3) {
                    usage(err);
                    return false;
                }
                spellChecker.dot(Paths.get(args[1]), args.length == 3 && args[2].equals("minimize"));
                return true;
            default:
                err.println("Unknown command: " + args[0]);
                usage(err);
                return false;
        }
    }
}
