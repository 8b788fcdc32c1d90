package spelling.alignment;

import spelling.Symbols;

import java.util.Objects;

/**
 * One column of an alignment. An epsilon source is an insertion, an epsilon target a deletion.
 */
public record AlignedPair(String source, String target) {

    public AlignedPair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (Symbols.isEpsilon(source) && Symbols.isEpsilon(target)) {
            throw new IllegalArgumentException("An aligned pair cannot be empty on both sides");
        }
    }

    public boolean isMatch() {
        return source.equals(target);
    }

    @Override
    public String toString() {
        return Symbols.display(source) + ":" + Symbols.display(target);
    }
}
