package FAMin.Model;

/**
 * Recoverable error raised while reading or checking a finite automaton.
 * The kind decides both the message prefix and the exit status used by the command line.
 */
public class FAException extends Exception {

    public enum Kind {
        SYNTAX(60, "syntax error: "),
        SEMANTIC(61, "semantic error: "),
        NOT_WELL_SPECIFIED(62, "not well specified: ");

        private final int code;
        private final String prefix;

        Kind(int code, String prefix) {
            this.code = code;
            this.prefix = prefix;
        }

        public int getCode() {
            return code;
        }
    }

    private static final String BASE_MESSAGE = "fa file error: ";

    private final Kind kind;

    public FAException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static FAException syntax(String message) {
        return new FAException(Kind.SYNTAX, message);
    }

    public static FAException semantic(String message) {
        return new FAException(Kind.SEMANTIC, message);
    }

    public static FAException notWellSpecified(String reason) {
        return new FAException(Kind.NOT_WELL_SPECIFIED, reason);
    }

    public Kind getKind() {
        return kind;
    }

    public int getCode() {
        return kind.getCode();
    }

    /**
     * @return message as shown to the user, e.g. {@code fa file error: syntax error: bad rules definition}
     */
    public String format() {
        return BASE_MESSAGE + kind.prefix + getMessage();
    }
}
