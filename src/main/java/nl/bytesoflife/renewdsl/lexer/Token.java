package nl.bytesoflife.renewdsl.lexer;

/**
 * A lexical token. String tokens keep their surrounding quotes and escapes as written.
 *
 * @param type   token kind
 * @param text   source text of the token
 * @param line   1-based line
 * @param column 1-based column
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Human-readable form for error messages.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "start of indented block";
            case DEDENT -> "end of indented block";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
