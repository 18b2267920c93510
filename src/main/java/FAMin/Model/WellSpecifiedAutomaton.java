package FAMin.Model;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Deterministic, complete automaton whose non-start states all have incoming rules
 * and which has at most one non-terminating state.
 */
public class WellSpecifiedAutomaton extends FiniteAutomaton {
    private final Map<String, Map<Symbol, String>> transitions;

    private WellSpecifiedAutomaton(FiniteAutomaton fa) {
        super(fa);
        this.transitions = new HashMap<>();
        for (Rule rule : rules) {
            transitions.computeIfAbsent(rule.state(), s -> new HashMap<>()).put(rule.symbol(), rule.nextState());
        }
    }

    /**
     * Check the well-specified conditions in order; the first failing one is reported.
     * @param fa - semantically valid automaton
     * @return well-specified view sharing the data of fa
     * @throws FAException - NOT_WELL_SPECIFIED with the failing condition
     */
    public static WellSpecifiedAutomaton of(FiniteAutomaton fa) throws FAException {
        if (fa instanceof WellSpecifiedAutomaton wsa) {
            return wsa;
        }
        if (!fa.deterministic()) {
            throw FAException.notWellSpecified("not deterministic");
        }
        if (!fa.complete()) {
            throw FAException.notWellSpecified("not complete");
        }
        if (!fa.allStatesAccessible()) {
            throw FAException.notWellSpecified("states are not accessible");
        }
        if (fa.nonTerminatingStates().size() > 1) {
            throw FAException.notWellSpecified("number of nonterminating states > 1");
        }
        return new WellSpecifiedAutomaton(fa);
    }

    public static WellSpecifiedAutomaton of(Collection<String> states, Collection<Symbol> alphabet,
                                            Collection<Rule> rules, String startState,
                                            Collection<String> finalStates) throws FAException {
        return of(new FiniteAutomaton(states, alphabet, rules, startState, finalStates));
    }

    /**
     * @return destination of the unique rule leaving state on symbol
     */
    public String successor(String state, Symbol symbol) {
        Map<Symbol, String> out = transitions.get(state);
        if (out == null || !out.containsKey(symbol)) {
            throw new IllegalArgumentException("no rule for " + state + " " + symbol);
        }
        return out.get(symbol);
    }
}
