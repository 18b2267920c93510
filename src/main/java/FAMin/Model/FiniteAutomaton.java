package FAMin.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finite automaton as read from the textual format: states, alphabet, rules, start state and final states.
 * Instances are immutable and only exist once every semantic check has passed.
 */
public class FiniteAutomaton {
    protected final SortedSet<String> states;
    protected final SortedSet<Symbol> alphabet;
    protected final boolean epsilonDeclared;
    protected final SortedSet<Rule> rules;
    protected final String startState;
    protected final SortedSet<String> finalStates;

    /**
     * @param states - all states, must not be empty
     * @param alphabet - input symbols; an epsilon entry only declares that rules may use epsilon
     * @param rules - transition rules
     * @param startState - start state, member of states
     * @param finalStates - subset of states
     * @throws FAException - SEMANTIC on the first violated invariant
     */
    public FiniteAutomaton(Collection<String> states, Collection<Symbol> alphabet, Collection<Rule> rules,
                           String startState, Collection<String> finalStates) throws FAException {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        TreeSet<Symbol> inputs = new TreeSet<>(alphabet);
        this.epsilonDeclared = inputs.remove(Symbol.EPSILON);
        this.alphabet = Collections.unmodifiableSortedSet(inputs);
        this.rules = Collections.unmodifiableSortedSet(new TreeSet<>(rules));
        this.startState = Objects.requireNonNull(startState, "startState");
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(finalStates));
        checkSemantic();
    }

    /**
     * Copy constructor for subclasses; the source has already been checked.
     */
    protected FiniteAutomaton(FiniteAutomaton fa) {
        this.states = fa.states;
        this.alphabet = fa.alphabet;
        this.epsilonDeclared = fa.epsilonDeclared;
        this.rules = fa.rules;
        this.startState = fa.startState;
        this.finalStates = fa.finalStates;
    }

    private void checkSemantic() throws FAException {
        if (states.isEmpty()) {
            throw FAException.semantic("states set should not be empty");
        }
        if (!states.contains(startState)) {
            throw FAException.semantic("unrecognized start state '" + startState + "'");
        }
        for (Rule rule : rules) {
            Symbol symbol = rule.symbol();
            boolean known = symbol.isEpsilon() ? epsilonDeclared : alphabet.contains(symbol);
            if (!known) {
                throw FAException.semantic(
                    "unrecognized input symbol " + symbol.toLiteral() + " in rule '" + rule + "'");
            }
            if (!states.contains(rule.state())) {
                throw FAException.semantic(
                    "unrecognized state '" + rule.state() + "' in rule '" + rule + "'");
            }
            if (!states.contains(rule.nextState())) {
                throw FAException.semantic(
                    "unrecognized next state '" + rule.nextState() + "' in rule '" + rule + "'");
            }
        }
        if (!states.containsAll(finalStates)) {
            throw FAException.semantic("final states is not subset of states");
        }
    }

    public SortedSet<String> getStates() {
        return states;
    }

    /**
     * @return input symbols, never containing epsilon
     */
    public SortedSet<Symbol> getAlphabet() {
        return alphabet;
    }

    /**
     * @return whether the alphabet section listed {@code ''}, allowing epsilon rules
     */
    public boolean isEpsilonDeclared() {
        return epsilonDeclared;
    }

    public SortedSet<Rule> getRules() {
        return rules;
    }

    public String getStartState() {
        return startState;
    }

    public SortedSet<String> getFinalStates() {
        return finalStates;
    }

    /**
     * No epsilon rules and no two rules sharing (state, symbol).
     */
    public boolean deterministic() {
        Map<String, Set<Symbol>> seen = new HashMap<>();
        for (Rule rule : rules) {
            if (rule.symbol().isEpsilon()) {
                return false;
            }
            if (!seen.computeIfAbsent(rule.state(), s -> new HashSet<>()).add(rule.symbol())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every state has outgoing rules on exactly the alphabet symbols.
     */
    public boolean complete() {
        Map<String, Set<Symbol>> outgoing = new HashMap<>();
        for (Rule rule : rules) {
            outgoing.computeIfAbsent(rule.state(), s -> new HashSet<>()).add(rule.symbol());
        }
        for (String state : states) {
            if (!alphabet.equals(outgoing.getOrDefault(state, Collections.emptySet()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every state other than the start state is the destination of some rule.
     */
    public boolean allStatesAccessible() {
        Set<String> destinations = new HashSet<>();
        for (Rule rule : rules) {
            destinations.add(rule.nextState());
        }
        for (String state : states) {
            if (!state.equals(startState) && !destinations.contains(state)) {
                return false;
            }
        }
        return true;
    }

    /**
     * States from which no final state can be reached.
     * Backward fixpoint over the rules; every rule is consumed at most once.
     */
    public SortedSet<String> nonTerminatingStates() {
        Set<String> terminating = new HashSet<>(finalStates);
        Set<Rule> pending = new HashSet<>(rules);
        while (true) {
            Set<String> added = new HashSet<>();
            Iterator<Rule> it = pending.iterator();
            while (it.hasNext()) {
                Rule rule = it.next();
                if (!terminating.contains(rule.state()) && terminating.contains(rule.nextState())) {
                    added.add(rule.state());
                    it.remove();
                }
            }
            if (added.isEmpty()) {
                break;
            }
            terminating.addAll(added);
        }
        TreeSet<String> result = new TreeSet<>(states);
        result.removeAll(terminating);
        return Collections.unmodifiableSortedSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FiniteAutomaton that)) {
            return false;
        }
        return epsilonDeclared == that.epsilonDeclared
            && states.equals(that.states)
            && alphabet.equals(that.alphabet)
            && rules.equals(that.rules)
            && startState.equals(that.startState)
            && finalStates.equals(that.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, epsilonDeclared, rules, startState, finalStates);
    }

    /**
     * Canonical textual form; parsing it again gives an equal automaton.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(\n{");
        sb.append(String.join(", ", states));
        sb.append("},\n{");
        boolean first = true;
        if (epsilonDeclared) {
            sb.append(Symbol.EPSILON.toLiteral());
            first = false;
        }
        for (Symbol symbol : alphabet) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(symbol.toLiteral());
            first = false;
        }
        sb.append("},\n{\n");
        int remaining = rules.size();
        for (Rule rule : rules) {
            sb.append(rule);
            sb.append(--remaining > 0 ? ",\n" : "\n");
        }
        sb.append("},\n");
        sb.append(startState).append(",\n{");
        sb.append(String.join(", ", finalStates));
        sb.append("}\n)");
        return sb.toString();
    }
}
