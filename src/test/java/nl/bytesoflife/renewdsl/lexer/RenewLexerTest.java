package nl.bytesoflife.renewdsl.lexer;

import nl.bytesoflife.renewdsl.DslSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenewLexerTest {

    private final RenewLexer lexer = new RenewLexer();

    private List<TokenType> types(String content) {
        return lexer.tokenize(content).stream().map(Token::type).toList();
    }

    @Test
    void tokenizeSectionHeader() {
        List<Token> tokens = lexer.tokenize("site \"Solar One\":");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.STRING, TokenType.COLON,
                TokenType.NEWLINE, TokenType.EOF), tokens.stream().map(Token::type).toList());
        assertEquals("\"Solar One\"", tokens.get(1).text());
        assertEquals(6, tokens.get(1).column());
    }

    @Test
    void tokenizeCoordinate() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.DEGREE, TokenType.IDENTIFIER, TokenType.COMMA,
                        TokenType.NUMBER, TokenType.DEGREE, TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF),
                types("10.0°N, 20.0°E"));
    }

    @Test
    void quantityWithAndWithoutSpace() {
        List<Token> attached = lexer.tokenize("400kW");
        List<Token> spaced = lexer.tokenize("400 kW");
        assertEquals("400", attached.get(0).text());
        assertEquals("kW", attached.get(1).text());
        assertEquals(attached.get(1).type(), spaced.get(1).type());
        assertEquals(attached.get(1).text(), spaced.get(1).text());
    }

    @Test
    void compoundUnitIsSingleToken() {
        List<Token> tokens = lexer.tokenize("6.2 kWh/m²/day");
        assertEquals(TokenType.UNIT, tokens.get(1).type());
        assertEquals("kWh/m²/day", tokens.get(1).text());
    }

    @Test
    void numberStopsAtSecondDot() {
        assertThrows(DslSyntaxException.class, () -> lexer.tokenize("1.5.3"));
    }

    @Test
    void trailingDotBelongsToNumber() {
        assertEquals("5.", lexer.tokenize("5.").get(0).text());
    }

    @Test
    void markersBecomeBlockTokens() {
        List<TokenType> types = types("a:\n<INDENT>b\n<DEDENT>c");
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.EOF), types);
    }

    @Test
    void columnsIgnoreMarkers() {
        List<Token> tokens = lexer.tokenize("a:\n<INDENT>    tilt: 10°");
        Token tilt = tokens.get(4);
        assertEquals("tilt", tilt.text());
        assertEquals(2, tilt.line());
        assertEquals(5, tilt.column());
    }

    @Test
    void markerOnlyLineHasNoNewline() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.DEDENT, TokenType.EOF),
                types("a\n<DEDENT>"));
    }

    @Test
    void blankLinesAndCommentsProduceNothing() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF),
                types("\n   \n# comment\na # trailing\n"));
    }

    @Test
    void stringKeepsQuotesAndEscapes() {
        Token token = lexer.tokenize("\"say \\\"hi\\\"\"").get(0);
        assertEquals(TokenType.STRING, token.type());
        assertEquals("\"say \\\"hi\\\"\"", token.text());
    }

    @Test
    void hashInsideStringIsNotAComment() {
        Token token = lexer.tokenize("\"row #3\"").get(0);
        assertEquals("\"row #3\"", token.text());
    }

    @Test
    void unterminatedStringFails() {
        DslSyntaxException e = assertThrows(DslSyntaxException.class, () -> lexer.tokenize("a\n\"open"));
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void unexpectedCharacterFails() {
        DslSyntaxException e = assertThrows(DslSyntaxException.class, () -> lexer.tokenize("tilt: 30%"));
        assertEquals(9, e.getColumn());
    }

    @Test
    void punctuation() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.STAR, TokenType.NUMBER, TokenType.LBRACKET,
                        TokenType.RBRACKET, TokenType.LPAREN, TokenType.RPAREN, TokenType.NEWLINE, TokenType.EOF),
                types("P1 * 200 [] ()"));
    }

    @Test
    void carriageReturnsAreIgnored() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF), types("a:\r\nb\r\n"));
    }
}
