package FAMin;

import java.util.*;

import FAMin.Model.FAException;
import FAMin.Model.Rule;
import FAMin.Model.Symbol;
import FAMin.Model.WellSpecifiedAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FAMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(FAMinimizer.class);
    public static boolean DEBUG = false;
    static final String STATE_SEPARATOR = "_";

    /**
     * Minimize a well-specified automaton by partition refinement (Moore).
     * @param fa - well-specified automaton
     * @return minimal equivalent automaton; every state is named after the sorted original states it merges
     */
    public static WellSpecifiedAutomaton minimize(WellSpecifiedAutomaton fa) {
        final String[] states = fa.getStates().toArray(new String[0]);
        final Symbol[] inputs = fa.getAlphabet().toArray(new Symbol[0]);
        final int[][] succ = successorTable(fa, states, inputs);

        final int[] blockOf = new int[states.length];
        int blockCount = initialPartition(fa, states, blockOf);

        int passes = 0;
        while (true) {
            passes++;
            int refinedCount = refine(blockOf, succ);
            if (refinedCount == blockCount) {
                break;
            }
            blockCount = refinedCount;
        }
        if (DEBUG) {
            LOG.info("Partition stable after {} passes: {} -> {} states", passes, states.length, blockCount);
        }

        final WellSpecifiedAutomaton minimized = rebuild(fa, states, inputs, succ, blockOf, blockCount);
        if (DEBUG) {
            verify(fa, minimized);
        }
        return minimized;
    }

    // succ[s][a] = index of the destination of state s on inputs[a]
    private static int[][] successorTable(WellSpecifiedAutomaton fa, String[] states, Symbol[] inputs) {
        Object2IntMap<String> stateIdx = new Object2IntOpenHashMap<>(states.length);
        for (int i = 0; i < states.length; i++) {
            stateIdx.put(states[i], i);
        }
        int[][] succ = new int[states.length][inputs.length];
        for (int s = 0; s < states.length; s++) {
            for (int a = 0; a < inputs.length; a++) {
                succ[s][a] = stateIdx.getInt(fa.successor(states[s], inputs[a]));
            }
        }
        return succ;
    }

    /**
     * Final states and remaining states; an empty class does not form a block.
     * @return number of blocks
     */
    private static int initialPartition(WellSpecifiedAutomaton fa, String[] states, int[] blockOf) {
        int finalBlock = -1;
        int otherBlock = -1;
        int count = 0;
        for (int s = 0; s < states.length; s++) {
            if (fa.getFinalStates().contains(states[s])) {
                if (finalBlock < 0) {
                    finalBlock = count++;
                }
                blockOf[s] = finalBlock;
            } else {
                if (otherBlock < 0) {
                    otherBlock = count++;
                }
                blockOf[s] = otherBlock;
            }
        }
        return count;
    }

    /**
     * One refinement pass: states stay together only if they share a block and,
     * for every symbol, their destinations share a block.
     * @return number of blocks after the pass
     */
    private static int refine(int[] blockOf, int[][] succ) {
        Map<IntArrayList, Integer> signatures = new HashMap<>();
        int[] refined = new int[blockOf.length];
        for (int s = 0; s < blockOf.length; s++) {
            IntArrayList signature = new IntArrayList(succ[s].length + 1);
            signature.add(blockOf[s]);
            for (int t : succ[s]) {
                signature.add(blockOf[t]);
            }
            Integer block = signatures.get(signature);
            if (block == null) {
                block = signatures.size();
                signatures.put(signature, block);
            }
            refined[s] = block;
        }
        System.arraycopy(refined, 0, blockOf, 0, blockOf.length);
        return signatures.size();
    }

    private static WellSpecifiedAutomaton rebuild(WellSpecifiedAutomaton fa, String[] states, Symbol[] inputs,
                                                  int[][] succ, int[] blockOf, int blockCount) {
        List<List<String>> members = new ArrayList<>(blockCount);
        for (int b = 0; b < blockCount; b++) {
            members.add(new ArrayList<>());
        }
        // states are sorted, so members are too
        for (int s = 0; s < states.length; s++) {
            members.get(blockOf[s]).add(states[s]);
        }
        String[] names = new String[blockCount];
        Set<String> used = new HashSet<>();
        for (int b = 0; b < blockCount; b++) {
            names[b] = String.join(STATE_SEPARATOR, members.get(b));
            if (!used.add(names[b])) {
                throw new IllegalStateException("merged state name '" + names[b] + "' is ambiguous");
            }
        }

        Set<Rule> rules = new HashSet<>();
        Set<String> finalStates = new HashSet<>();
        String startState = null;
        for (int s = 0; s < states.length; s++) {
            String name = names[blockOf[s]];
            for (int a = 0; a < inputs.length; a++) {
                rules.add(new Rule(name, inputs[a], names[blockOf[succ[s][a]]]));
            }
            if (fa.getFinalStates().contains(states[s])) {
                finalStates.add(name);
            }
            if (states[s].equals(fa.getStartState())) {
                startState = name;
            }
        }

        List<Symbol> alphabet = new ArrayList<>(fa.getAlphabet());
        if (fa.isEpsilonDeclared()) {
            alphabet.add(Symbol.EPSILON);
        }
        try {
            return WellSpecifiedAutomaton.of(Arrays.asList(names), alphabet, rules, startState, finalStates);
        } catch (FAException e) {
            throw new IllegalStateException("Minimized automaton is not well specified: " + e.format(), e);
        }
    }

    /**
     * Sanity check against AutomataLib: both automata must accept the same language.
     * @throws IllegalStateException if they don't
     */
    static void verify(WellSpecifiedAutomaton original, WellSpecifiedAutomaton minimized) {
        final CompactDFA<Symbol> dfa = FAFormat.toCompactDFA(original);
        final CompactDFA<Symbol> result = FAFormat.toCompactDFA(minimized);
        if (!Automata.testEquivalence(dfa, result, dfa.getInputAlphabet())) {
            throw new IllegalStateException("Minimized automaton is not equivalent to the original");
        }
        final CompactDFA<Symbol> hopcroft = HopcroftMinimizer.minimizeDFA(dfa, dfa.getInputAlphabet());
        LOG.info("Minimized size: {}, Hopcroft size (reachable part): {}", minimized.getStates().size(), hopcroft.size());
    }
}
