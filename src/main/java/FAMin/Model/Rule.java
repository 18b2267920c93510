package FAMin.Model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Transition rule {@code state symbol -> nextState}.
 */
public record Rule(String state, Symbol symbol, String nextState) implements Comparable<Rule> {
    private static final Comparator<Rule> ORDER = Comparator.comparing(Rule::state)
        .thenComparing(Rule::symbol)
        .thenComparing(Rule::nextState);

    public Rule {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(nextState, "nextState");
    }

    @Override
    public int compareTo(Rule o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return state + " " + symbol.toLiteral() + " -> " + nextState;
    }
}
