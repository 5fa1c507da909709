package nl.bytesoflife.renewdsl.lexer;

import nl.bytesoflife.renewdsl.DslSyntaxException;
import nl.bytesoflife.renewdsl.model.Unit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes marker-annotated text produced by {@link IndentPreprocessor}.
 * <p>
 * Keywords are not reserved: they come out as identifiers and the parser decides from
 * context. A {@link TokenType#NEWLINE} follows every line that produced at least one
 * real token, so blank lines and marker-only lines never yield one.
 */
public class RenewLexer {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("[0-9]+(?:\\.[0-9]*)?");

    // Unit symbols that would otherwise split into several tokens
    private static final List<String> COMPOUND_UNITS = Arrays.stream(Unit.values())
            .map(Unit::symbol)
            .filter(s -> s.length() > 1 && !IDENTIFIER.matcher(s).matches())
            .toList();

    public List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        String[] lines = content.split("\n", -1);
        int lineNum = 0;

        for (String line : lines) {
            lineNum++;
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            tokenizeLine(line, lineNum, tokens);
        }

        int lastLine = Math.max(1, lines.length);
        tokens.add(new Token(TokenType.EOF, "", lastLine, lines[lines.length - 1].length() + 1));
        return tokens;
    }

    private void tokenizeLine(String line, int lineNum, List<Token> tokens) {
        boolean hasContent = false;
        int pos = 0;
        // block markers are not part of the source text, columns skip them
        int markerWidth = 0;

        while (pos < line.length()) {
            char c = line.charAt(pos);
            int column = pos + 1 - markerWidth;

            if (c == ' ' || c == '\t') {
                pos++;
                continue;
            }
            if (c == '#') {
                break;
            }
            if (line.startsWith(IndentPreprocessor.INDENT, pos)) {
                tokens.add(new Token(TokenType.INDENT, IndentPreprocessor.INDENT, lineNum, column));
                pos += IndentPreprocessor.INDENT.length();
                markerWidth += IndentPreprocessor.INDENT.length();
                continue;
            }
            if (line.startsWith(IndentPreprocessor.DEDENT, pos)) {
                tokens.add(new Token(TokenType.DEDENT, IndentPreprocessor.DEDENT, lineNum, column));
                pos += IndentPreprocessor.DEDENT.length();
                markerWidth += IndentPreprocessor.DEDENT.length();
                continue;
            }

            hasContent = true;

            if (c == '"') {
                int end = scanString(line, pos, lineNum, column);
                tokens.add(new Token(TokenType.STRING, line.substring(pos, end), lineNum, column));
                pos = end;
                continue;
            }

            Matcher number = NUMBER.matcher(line).region(pos, line.length());
            if (number.lookingAt()) {
                tokens.add(new Token(TokenType.NUMBER, number.group(), lineNum, column));
                pos = number.end();
                continue;
            }

            String unit = compoundUnitAt(line, pos);
            if (unit != null) {
                tokens.add(new Token(TokenType.UNIT, unit, lineNum, column));
                pos += unit.length();
                continue;
            }

            Matcher identifier = IDENTIFIER.matcher(line).region(pos, line.length());
            if (identifier.lookingAt()) {
                tokens.add(new Token(TokenType.IDENTIFIER, identifier.group(), lineNum, column));
                pos = identifier.end();
                continue;
            }

            TokenType type = switch (c) {
                case '°' -> TokenType.DEGREE;
                case ':' -> TokenType.COLON;
                case ',' -> TokenType.COMMA;
                case '*' -> TokenType.STAR;
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                case '[' -> TokenType.LBRACKET;
                case ']' -> TokenType.RBRACKET;
                default -> throw new DslSyntaxException("Unexpected character '" + c + "'", lineNum, column);
            };
            tokens.add(new Token(type, String.valueOf(c), lineNum, column));
            pos++;
        }

        if (hasContent) {
            tokens.add(new Token(TokenType.NEWLINE, "\n", lineNum, line.length() + 1 - markerWidth));
        }
    }

    /**
     * Returns the index just past the closing quote of the string starting at {@code start}.
     */
    private int scanString(String line, int start, int lineNum, int column) {
        int pos = start + 1;
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (c == '\\' && pos + 1 < line.length()) {
                pos += 2;
                continue;
            }
            if (c == '"') {
                return pos + 1;
            }
            pos++;
        }
        throw new DslSyntaxException("Unterminated string literal", lineNum, column);
    }

    private String compoundUnitAt(String line, int pos) {
        for (String unit : COMPOUND_UNITS) {
            if (line.startsWith(unit, pos)) {
                return unit;
            }
        }
        return null;
    }
}
