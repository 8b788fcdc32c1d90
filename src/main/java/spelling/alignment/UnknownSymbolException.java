package spelling.alignment;

/**
 * Thrown when a cost is requested for a symbol outside the alphabet of an {@link EditCounts} table. The alphabet has to
 * be computed from the whole training corpus (plus epsilon) before anything is aligned against the table.
 */
public class UnknownSymbolException extends IllegalArgumentException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Symbol '" + symbol + "' is not part of the cost table alphabet");
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
