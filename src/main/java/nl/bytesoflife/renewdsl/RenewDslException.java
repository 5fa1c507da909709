package nl.bytesoflife.renewdsl;

/**
 * Base class for every failure reported while parsing a document.
 * Line and column are 1-based; 0 means the position is not known.
 */
public class RenewDslException extends RuntimeException {

    private final int line;
    private final int column;

    public RenewDslException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public RenewDslException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (line <= 0) {
            return base;
        }
        return base + " (line " + line + (column > 0 ? ", column " + column : "") + ")";
    }
}
