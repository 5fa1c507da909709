package nl.bytesoflife.renewdsl;

/**
 * The input does not match the grammar: unexpected token, missing block,
 * unknown attribute or an enumerated literal outside its fixed set.
 */
public class DslSyntaxException extends RenewDslException {

    public DslSyntaxException(String message, int line, int column) {
        super(message, line, column);
    }
}
