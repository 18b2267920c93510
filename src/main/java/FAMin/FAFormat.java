package FAMin;

import FAMin.Grammar.FAGrammar;
import FAMin.Grammar.SectionParser;
import FAMin.Model.FAException;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.Rule;
import FAMin.Model.Symbol;
import FAMin.Model.WellSpecifiedAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class FAFormat {
    /**
     * Parse the textual format into a semantically checked automaton.
     * The states section is checked for emptiness before the remaining sections are parsed.
     */
    public static FiniteAutomaton parse(String content) throws FAException {
        final FAGrammar.Sections sections = FAGrammar.split(content);

        Set<String> states = SectionParser.parseStates(sections.states());
        if (states.isEmpty()) {
            throw FAException.semantic("states set should not be empty");
        }
        Set<Symbol> alphabet = SectionParser.parseAlphabet(sections.alphabet());
        Set<Rule> rules = SectionParser.parseRules(sections.rules());
        String startState = SectionParser.parseStartState(sections.startState());
        Set<String> finalStates = SectionParser.parseFinalStates(sections.finalStates());

        return new FiniteAutomaton(states, alphabet, rules, startState, finalStates);
    }

    public static String serialize(FiniteAutomaton fa) {
        return fa.toString();
    }

    public static String read(InputStream is) throws IOException {
        return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }

    static String readFAFile(String filePath) throws IOException {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        }
    }

    static void writeFAFile(String filePath, String content) throws IOException {
        try (Writer w = new OutputStreamWriter(new FileOutputStream(filePath), StandardCharsets.UTF_8)) {
            w.write(content);
        }
    }

    /**
     * Convert to an AutomataLib DFA over the automaton's symbols.
     * State i of the result is the i-th state in sorted order; the start state is initial.
     */
    public static CompactDFA<Symbol> toCompactDFA(WellSpecifiedAutomaton fa) {
        final Alphabet<Symbol> alphabet = Alphabets.fromCollection(fa.getAlphabet());
        final CompactDFA<Symbol> dfa = new CompactDFA<>(alphabet, fa.getStates().size());

        Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        for (String state : fa.getStates()) {
            int id = dfa.addState(fa.getFinalStates().contains(state));
            ids.put(state, id);
        }
        dfa.setInitialState(ids.getInt(fa.getStartState()));
        for (Rule rule : fa.getRules()) {
            int symbolIdx = alphabet.getSymbolIndex(rule.symbol());
            dfa.setTransition(ids.getInt(rule.state()), symbolIdx, ids.getInt(rule.nextState()));
        }
        return dfa;
    }
}
