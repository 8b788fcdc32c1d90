package spelling.transducer;

import spelling.Symbols;

import java.util.Objects;

/**
 * The right-hand side of a transducer transition: what it writes, where it goes, and what it costs. The input symbol
 * is the key the arc is stored under.
 *
 * @param output output symbol, possibly {@link Symbols#EPSILON}
 * @param target successor state
 * @param weight additive cost, {@code -ln p} for a transition of probability {@code p}
 */
public record Arc(String output, int target, double weight) {

    public Arc {
        Objects.requireNonNull(output, "output");
    }

    @Override
    public String toString() {
        return Symbols.display(output) + "/" + weight + " -> " + target;
    }
}
