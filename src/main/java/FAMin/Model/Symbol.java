package FAMin.Model;

/**
 * Input symbol of a finite automaton: a single character (any Unicode code point) or epsilon.
 */
public final class Symbol implements Comparable<Symbol> {
    public static final Symbol EPSILON = new Symbol("");
    public static final char APOSTROPHE = '\'';

    // "" for epsilon, otherwise exactly one code point (one or two chars)
    private final String text;

    private Symbol(String text) {
        this.text = text;
    }

    public static Symbol of(char c) {
        return new Symbol(String.valueOf(c));
    }

    public static Symbol ofCodePoint(int codePoint) {
        return new Symbol(new String(Character.toChars(codePoint)));
    }

    public boolean isEpsilon() {
        return text.isEmpty();
    }

    /**
     * @return the code point of a non-epsilon symbol
     * @throws IllegalStateException for epsilon
     */
    public int getCodePoint() {
        if (isEpsilon()) {
            throw new IllegalStateException("epsilon has no character");
        }
        return text.codePointAt(0);
    }

    /**
     * Quoted form used by the textual format: {@code ''} for epsilon, {@code ''''} for the apostrophe.
     */
    public String toLiteral() {
        if (isEpsilon()) {
            return "''";
        }
        if (text.charAt(0) == APOSTROPHE) {
            return "''''";
        }
        return APOSTROPHE + text + APOSTROPHE;
    }

    /**
     * Epsilon first, then by code point.
     */
    @Override
    public int compareTo(Symbol o) {
        if (isEpsilon() || o.isEpsilon()) {
            return Boolean.compare(!isEpsilon(), !o.isEpsilon());
        }
        return Integer.compare(getCodePoint(), o.getCodePoint());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return text.equals(((Symbol) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return toLiteral();
    }
}
