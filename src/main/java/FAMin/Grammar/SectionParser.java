package FAMin.Grammar;

import java.util.HashSet;
import java.util.Set;

import FAMin.Model.FAException;
import FAMin.Model.Rule;
import FAMin.Model.Symbol;

/**
 * Recursive-descent parser for the content of a single section.
 * Each section is a comma separated list; a blank section is the empty list.
 */
public class SectionParser {
    private static final char QUOTE = Symbol.APOSTROPHE;
    private static final String RESERVED_LITERAL = "'''";

    private final String text;
    private final String badDefinition;
    private int pos;

    private SectionParser(String text, String sectionName) {
        this.text = text;
        this.badDefinition = "bad " + sectionName + " definition";
    }

    public static Set<String> parseStates(String content) throws FAException {
        return new SectionParser(content, "states").stateList();
    }

    public static Set<String> parseFinalStates(String content) throws FAException {
        return new SectionParser(content, "final states").stateList();
    }

    /**
     * @return decoded symbols; may contain {@link Symbol#EPSILON}
     */
    public static Set<Symbol> parseAlphabet(String content) throws FAException {
        return new SectionParser(content, "alphabet").symbolList();
    }

    public static Set<Rule> parseRules(String content) throws FAException {
        return new SectionParser(content, "rules").ruleList();
    }

    public static String parseStartState(String content) throws FAException {
        SectionParser parser = new SectionParser(content, "start state");
        parser.skipWhitespace();
        String state = parser.identifier();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error();
        }
        return state;
    }

    /**
     * Decode a quoted literal: {@code ''} is epsilon, {@code 'x'} is x, {@code ''''} is the apostrophe.
     * @return decoded symbol, or null for the reserved literal {@code '''}
     * @throws IllegalArgumentException if the text is not a literal at all
     */
    public static Symbol decodeSymbol(String literal) {
        switch (literal) {
            case "''":
                return Symbol.EPSILON;
            case RESERVED_LITERAL:
                return null;
            case "''''":
                return Symbol.of(QUOTE);
            default:
                int last = literal.length() - 1;
                if (last >= 2 && literal.charAt(0) == QUOTE && literal.charAt(last) == QUOTE
                    && literal.charAt(1) != QUOTE && literal.codePointCount(1, last) == 1) {
                    return Symbol.ofCodePoint(literal.codePointAt(1));
                }
                throw new IllegalArgumentException("not a symbol literal: " + literal);
        }
    }

    /**
     * Length in chars of the quoted token starting at an apostrophe: {@code 'x'} including a
     * surrogate pair for x, otherwise the apostrophe run.
     */
    static int literalLength(String s, int start) {
        if (start + 2 < s.length() && s.charAt(start + 1) != QUOTE) {
            int close = start + 1 + Character.charCount(s.codePointAt(start + 1));
            if (close < s.length() && s.charAt(close) == QUOTE) {
                return close - start + 1;
            }
        }
        int end = start;
        while (end < s.length() && s.charAt(end) == QUOTE) {
            end++;
        }
        return end - start;
    }

    private Set<String> stateList() throws FAException {
        Set<String> states = new HashSet<>();
        if (text.isBlank()) {
            return states;
        }
        do {
            skipWhitespace();
            states.add(identifier());
            skipWhitespace();
        } while (comma());
        if (!atEnd()) {
            throw error();
        }
        return states;
    }

    private Set<Symbol> symbolList() throws FAException {
        Set<Symbol> symbols = new HashSet<>();
        if (text.isBlank()) {
            return symbols;
        }
        do {
            skipWhitespace();
            String literal = literal();
            Symbol symbol = decodeSymbol(literal);
            if (symbol == null) {
                throw FAException.syntax("bad symbol \"" + literal + "\"");
            }
            symbols.add(symbol);
            skipWhitespace();
        } while (comma());
        if (!atEnd()) {
            throw error();
        }
        return symbols;
    }

    private Set<Rule> ruleList() throws FAException {
        Set<Rule> rules = new HashSet<>();
        if (text.isBlank()) {
            return rules;
        }
        do {
            skipWhitespace();
            rules.add(rule());
            skipWhitespace();
        } while (comma());
        if (!atEnd()) {
            throw error();
        }
        return rules;
    }

    // state literal -> state
    private Rule rule() throws FAException {
        int start = pos;
        String state = identifier();
        skipWhitespace();
        String literal = literal();
        skipWhitespace();
        if (!text.startsWith("->", pos)) {
            throw error();
        }
        pos += 2;
        skipWhitespace();
        String nextState = identifier();
        Symbol symbol = decodeSymbol(literal);
        if (symbol == null) {
            throw FAException.syntax("in rule '" + text.substring(start, pos)
                + "' bad symbol definition \"" + literal + "\"");
        }
        return new Rule(state, symbol, nextState);
    }

    // [a-zA-Z]([a-zA-Z0-9_]*[a-zA-Z0-9])?
    private String identifier() throws FAException {
        int start = pos;
        if (atEnd() || !isAsciiLetter(text.charAt(pos))) {
            throw error();
        }
        pos++;
        while (!atEnd() && (isAsciiLetter(text.charAt(pos)) || isAsciiDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        if (text.charAt(pos - 1) == '_') {
            throw error();
        }
        return text.substring(start, pos);
    }

    private String literal() throws FAException {
        if (atEnd() || text.charAt(pos) != QUOTE) {
            throw error();
        }
        int length = literalLength(text, pos);
        if (length < 2 || length > 4) {
            throw error();
        }
        String literal = text.substring(pos, pos + length);
        pos += length;
        return literal;
    }

    private boolean comma() {
        if (!atEnd() && text.charAt(pos) == ',') {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private FAException error() {
        return FAException.syntax(badDefinition);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
