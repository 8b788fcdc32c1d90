package spelling.alignment;

/**
 * Cost of rewriting one source symbol as one target symbol. Either side may be {@link spelling.Symbols#EPSILON}:
 * an epsilon source is an insertion, an epsilon target a deletion.
 */
@FunctionalInterface
public interface CostFunction {

    /**
     * Every edit costs 1, which turns weighted alignment into plain Levenshtein distance.
     */
    CostFunction UNIFORM = (source, target) -> 1.0;

    double cost(String source, String target);
}
