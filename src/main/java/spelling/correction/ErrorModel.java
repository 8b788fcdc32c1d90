// # The error model
//
// The error model is a one-state transducer describing how an intended symbol gets typed. For every pair of alphabet
// symbols (intended, observed) it has a loop `intended:observed`, including epsilon on either side but not on both:
//
// * `x:x` keeps a symbol,
// * `x:y` substitutes it,
// * `x:ε` drops it (the typist deleted x), and
// * `ε:y` adds a stray y.
//
// The weight of each loop is `-ln p`, where `p` is the smoothed probability from the learned count table. Rows of the
// table are the typed side of the training alignments, so the probability is read from the row of the observed symbol.
package spelling.correction;

import spelling.Symbols;
import spelling.alignment.EditCounts;
import spelling.transducer.Transducer;

public final class ErrorModel {

    public static final int STATE = 0;

    private ErrorModel() {
    }

    public static Transducer build(EditCounts counts, double smoothing) {
        if (smoothing <= 0 || Double.isNaN(smoothing)) {
            throw new IllegalArgumentException("smoothing must be positive, got " + smoothing);
        }
        Transducer model = new Transducer();
        model.setStartState(STATE);
        model.markAccepting(STATE);
        for (String intended : counts.alphabet()) {
            for (String observed : counts.alphabet()) {
                if (Symbols.isEpsilon(intended) && Symbols.isEpsilon(observed)) {
                    // An epsilon:epsilon loop would let the search spin without reading or writing anything.
                    continue;
                }
                double weight = -Math.log(counts.probability(observed, intended, smoothing));
                model.addTransition(STATE, intended, STATE, observed, weight);
            }
        }
        return model;
    }
}
