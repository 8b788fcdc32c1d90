package spelling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Symbol conventions shared by the aligner, the automata and the transducers.
 * <p>
 * A symbol is a {@link String} holding a single code point. The empty string stands for epsilon: the empty side of an
 * insertion or deletion in an alignment, and a transition that does not consume (or produce) anything.
 */
public final class Symbols {

    public static final String EPSILON = "";

    private Symbols() {
    }

    public static boolean isEpsilon(String symbol) {
        return symbol.isEmpty();
    }

    /**
     * Splits a word into its code points, so that surrogate pairs stay together.
     */
    public static List<String> split(String word) {
        if (word.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    // Used by tools and logging, where epsilon would otherwise print as nothing.
    public static String display(String symbol) {
        return isEpsilon(symbol) ? "ε" : symbol;
    }
}
