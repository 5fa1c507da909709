package nl.bytesoflife.renewdsl.lexer;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    // Unit symbol that is not a plain identifier, e.g. kWh/m²/day
    UNIT,
    DEGREE,
    COLON,
    COMMA,
    STAR,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
