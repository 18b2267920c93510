package FAMin.Grammar;

import FAMin.Model.FAException;

/**
 * Top level of the textual format:
 * <pre>( {states}, {alphabet}, {rules}, start, {final states} )</pre>
 * Only splits the text into its five raw sections; section contents are handled by {@link SectionParser}.
 */
public class FAGrammar {
    static final String BAD_FORMAT = "bad finite automata format";

    public record Sections(String states, String alphabet, String rules, String startState, String finalStates) { }

    private final String text;
    private int pos;

    private FAGrammar(String text) {
        this.text = text;
    }

    /**
     * Remove line comments. A '#' directly after an apostrophe is the start of a symbol, not a comment.
     */
    public static String stripComments(String content) {
        StringBuilder sb = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '#' && (i == 0 || content.charAt(i - 1) != '\'')) {
                while (i < content.length() && content.charAt(i) != '\n') {
                    i++;
                }
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Strip comments and split into sections.
     * @throws FAException - SYNTAX if the overall shape does not match
     */
    public static Sections split(String content) throws FAException {
        FAGrammar grammar = new FAGrammar(stripComments(content));
        return grammar.sections();
    }

    private Sections sections() throws FAException {
        expect('(');
        String states = braced();
        expect(',');
        String alphabet = braced();
        expect(',');
        String rules = braced();
        expect(',');
        String start = upTo(',');
        expect(',');
        String finals = braced();
        expect(')');
        skipWhitespace();
        if (pos != text.length()) {
            throw FAException.syntax(BAD_FORMAT);
        }
        return new Sections(states, alphabet, rules, start, finals);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char c) throws FAException {
        skipWhitespace();
        if (pos >= text.length() || text.charAt(pos) != c) {
            throw FAException.syntax(BAD_FORMAT);
        }
        pos++;
    }

    // content between '{' and the matching '}', quoted literals skipped
    private String braced() throws FAException {
        expect('{');
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '}') {
                String content = text.substring(start, pos);
                pos++;
                return content;
            }
            if (c == '\'') {
                pos += SectionParser.literalLength(text, pos);
            } else {
                pos++;
            }
        }
        throw FAException.syntax(BAD_FORMAT);
    }

    private String upTo(char delimiter) throws FAException {
        int start = pos;
        int end = text.indexOf(delimiter, pos);
        if (end < 0) {
            throw FAException.syntax(BAD_FORMAT);
        }
        pos = end;
        String token = text.substring(start, end).strip();
        if (token.isEmpty()) {
            throw FAException.syntax(BAD_FORMAT);
        }
        return token;
    }
}
