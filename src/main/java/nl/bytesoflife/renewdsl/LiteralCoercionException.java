package nl.bytesoflife.renewdsl;

/**
 * A literal that passed the grammar could not be turned into its typed value.
 */
public class LiteralCoercionException extends RenewDslException {

    public LiteralCoercionException(String message, int line, int column) {
        super(message, line, column);
    }

    public LiteralCoercionException(String message, int line, int column, Throwable cause) {
        super(message, line, column, cause);
    }
}
