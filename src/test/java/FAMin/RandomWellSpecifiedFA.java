package FAMin;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import FAMin.Model.FAException;
import FAMin.Model.Rule;
import FAMin.Model.Symbol;
import FAMin.Model.WellSpecifiedAutomaton;

public class RandomWellSpecifiedFA {
    /**
     * Generate a random complete DFA whose states are all reachable from the start state.
     * Reachability is forced by a k-ary spanning tree (k = alphabet size); the other transitions are random.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states, named q0 .. q(size-1); q0 is the start state
     * @param alphabetSize
     *      number of symbols, '0' upwards
     * @param ad
     *      acceptance density, in (0,1]
     * @return
     *      the automaton, or null if it has more than one non-terminating state
     */
    public static WellSpecifiedAutomaton generate(Random r, int size, int alphabetSize, float ad) {
        assert size > 0 && alphabetSize > 0;
        List<String> states = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            states.add("q" + i);
        }
        List<Symbol> alphabet = new ArrayList<>(alphabetSize);
        for (int a = 0; a < alphabetSize; a++) {
            alphabet.add(Symbol.of((char) ('0' + a)));
        }

        int[][] succ = new int[size][alphabetSize];
        for (int[] row : succ) {
            for (int a = 0; a < alphabetSize; a++) {
                row[a] = r.nextInt(size);
            }
        }
        // spanning tree: state i hangs below state (i-1)/k on symbol (i-1)%k
        for (int i = 1; i < size; i++) {
            succ[(i - 1) / alphabetSize][(i - 1) % alphabetSize] = i;
        }

        List<Rule> rules = new ArrayList<>();
        for (int s = 0; s < size; s++) {
            for (int a = 0; a < alphabetSize; a++) {
                rules.add(new Rule(states.get(s), alphabet.get(a), states.get(succ[s][a])));
            }
        }
        List<String> finalStates = new ArrayList<>();
        for (String state : states) {
            if (r.nextFloat() < ad) {
                finalStates.add(state);
            }
        }

        try {
            return WellSpecifiedAutomaton.of(states, alphabet, rules, "q0", finalStates);
        } catch (FAException e) {
            return null;
        }
    }
}
