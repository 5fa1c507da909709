package nl.bytesoflife.renewdsl.parser;

import nl.bytesoflife.renewdsl.DslSyntaxException;
import nl.bytesoflife.renewdsl.lexer.Token;
import nl.bytesoflife.renewdsl.lexer.TokenType;
import nl.bytesoflife.renewdsl.model.EquipmentType;
import nl.bytesoflife.renewdsl.model.ObjectiveMode;
import nl.bytesoflife.renewdsl.model.Orientation;
import nl.bytesoflife.renewdsl.model.TrackingMode;
import nl.bytesoflife.renewdsl.model.Unit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Recursive-descent parser over the token stream, one token of lookahead.
 * <p>
 * Grammar, with {@code NL}, {@code INDENT} and {@code DEDENT} from the lexer:
 * <pre>
 * document     := statement+ EOF
 * statement    := site | equipment | layout | simulate | optimize
 * site         := "site" STRING ":" NL INDENT site_attr+ DEDENT
 * site_attr    := ("location" ":" coordinate | "area" ":" quantity | "terrain" ":" STRING
 *                 | "irradiance" ":" quantity | "elevation" ":" quantity) NL
 * coordinate   := NUMBER "°" ("N"|"S") "," NUMBER "°" ("E"|"W")
 * equipment    := "equipment" ":" NL INDENT item+ DEDENT
 * item         := ("panel"|"inverter"|"turbine"|"battery") STRING (":" NL INDENT spec+ DEDENT | NL)
 * spec         := IDENTIFIER ":" (quantity | NUMBER | STRING) NL
 * layout       := "layout" STRING ":" NL INDENT layout_attr+ DEDENT
 * layout_attr  := ("panels"|"inverters"|"turbines") ":" ref NL
 *               | "orientation" ":" ("south"|"north"|"east"|"west") NL
 *               | "tilt" ":" NUMBER "°" NL
 *               | "row_spacing" ":" quantity NL
 *               | "tracking" ":" ("fixed"|"single_axis"|"dual_axis") NL
 * ref          := IDENTIFIER ("*" NUMBER)?
 * simulate     := "simulate" ":" NL INDENT sim_attr+ DEDENT
 * sim_attr     := ("weather" ":" IDENTIFIER "(" STRING ("," STRING)* ")"
 *                 | ("duration"|"timestep") ":" NUMBER unit
 *                 | "outputs" ":" name_list) NL
 * optimize     := "optimize" ":" NL INDENT opt_attr+ DEDENT
 * opt_attr     := ("objective" ":" ("maximize"|"minimize") "(" IDENTIFIER ")"
 *                 | "variables" ":" name_list | "algorithm" ":" STRING) NL
 * name_list    := "[" IDENTIFIER ("," IDENTIFIER)* "]"
 * quantity     := NUMBER unit
 * </pre>
 * An instance walks one token list once and is then spent.
 */
public class SyntaxParser {

    private static final List<String> SECTIONS = List.of("site", "equipment", "layout", "simulate", "optimize");
    private static final List<String> SITE_ATTRS = List.of("location", "area", "terrain", "irradiance", "elevation");
    private static final List<String> LAYOUT_ATTRS =
            List.of("panels", "inverters", "turbines", "orientation", "tilt", "row_spacing", "tracking");
    private static final List<String> SIMULATE_ATTRS = List.of("weather", "duration", "timestep", "outputs");
    private static final List<String> OPTIMIZE_ATTRS = List.of("objective", "variables", "algorithm");

    private static final List<String> EQUIPMENT_TYPES = keywords(EquipmentType.values(), EquipmentType::keyword);
    private static final List<String> ORIENTATIONS = keywords(Orientation.values(), Orientation::keyword);
    private static final List<String> TRACKING_MODES = keywords(TrackingMode.values(), TrackingMode::keyword);
    private static final List<String> OBJECTIVE_MODES = keywords(ObjectiveMode.values(), ObjectiveMode::keyword);
    private static final List<String> LATITUDE_HEMISPHERES = List.of("N", "S");
    private static final List<String> LONGITUDE_HEMISPHERES = List.of("E", "W");

    private final List<Token> tokens;
    private int pos;

    public SyntaxParser(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public ParseNode.Branch parseDocument() {
        Token first = peek();
        List<ParseNode> statements = new ArrayList<>();
        do {
            statements.add(parseStatement());
        } while (!peek().is(TokenType.EOF));
        return branch(Rule.DOCUMENT, statements, first);
    }

    private ParseNode.Branch parseStatement() {
        Token keyword = expectWord(SECTIONS, "section keyword");
        return switch (keyword.text()) {
            case "site" -> parseSite(keyword);
            case "equipment" -> parseEquipmentSection(keyword);
            case "layout" -> parseLayout(keyword);
            case "simulate" -> branch(Rule.SIMULATE, parseBlockHeaderAndBody("simulate", this::parseSimulateAttr), keyword);
            default -> branch(Rule.OPTIMIZE, parseBlockHeaderAndBody("optimize", this::parseOptimizeAttr), keyword);
        };
    }

    // --- site ---

    private ParseNode.Branch parseSite(Token keyword) {
        List<ParseNode> children = new ArrayList<>();
        children.add(leaf(expect(TokenType.STRING, "a quoted site name")));
        children.addAll(parseBlockHeaderAndBody("site", this::parseSiteAttr));
        return branch(Rule.SITE, children, keyword);
    }

    private ParseNode parseSiteAttr() {
        Token keyword = expectWord(SITE_ATTRS, "site attribute");
        expect(TokenType.COLON, "':'");
        ParseNode value = switch (keyword.text()) {
            case "location" -> parseCoordinate();
            case "terrain" -> leaf(expect(TokenType.STRING, "a quoted terrain description"));
            default -> parseMeasure(Rule.QUANTITY);
        };
        expectEndOfLine();
        return branch(Rule.SITE_ATTR, List.of(leaf(keyword), value), keyword);
    }

    private ParseNode parseCoordinate() {
        Token start = peek();
        Token latitude = expect(TokenType.NUMBER, "a latitude");
        expect(TokenType.DEGREE, "'°'");
        Token ns = expectWord(LATITUDE_HEMISPHERES, "latitude hemisphere");
        expect(TokenType.COMMA, "','");
        Token longitude = expect(TokenType.NUMBER, "a longitude");
        expect(TokenType.DEGREE, "'°'");
        Token ew = expectWord(LONGITUDE_HEMISPHERES, "longitude hemisphere");
        return branch(Rule.COORDINATE, List.of(leaf(latitude), leaf(ns), leaf(longitude), leaf(ew)), start);
    }

    // --- equipment ---

    private ParseNode.Branch parseEquipmentSection(Token keyword) {
        expect(TokenType.COLON, "':'");
        return branch(Rule.EQUIPMENT_SECTION, parseBlock("equipment", this::parseEquipmentItem), keyword);
    }

    private ParseNode parseEquipmentItem() {
        Token type = expectWord(EQUIPMENT_TYPES, "equipment type");
        List<ParseNode> children = new ArrayList<>();
        children.add(leaf(type));
        children.add(leaf(expect(TokenType.STRING, "a quoted equipment name")));
        if (peek().is(TokenType.COLON)) {
            Token colon = advance();
            children.add(branch(Rule.SPEC_BLOCK, parseBlock("equipment spec", this::parseEquipmentSpec), colon));
        } else {
            expectEndOfLine();
        }
        return branch(Rule.EQUIPMENT_ITEM, children, type);
    }

    private ParseNode parseEquipmentSpec() {
        Token key = expect(TokenType.IDENTIFIER, "a spec name");
        expect(TokenType.COLON, "':'");
        ParseNode value;
        if (peek().is(TokenType.STRING)) {
            value = leaf(advance());
        } else if (peekAhead(1).is(TokenType.NEWLINE)) {
            value = leaf(expect(TokenType.NUMBER, "a number, quantity or string"));
        } else {
            value = parseMeasure(Rule.QUANTITY);
        }
        expectEndOfLine();
        return branch(Rule.EQUIPMENT_SPEC, List.of(leaf(key), value), key);
    }

    // --- layout ---

    private ParseNode.Branch parseLayout(Token keyword) {
        List<ParseNode> children = new ArrayList<>();
        children.add(leaf(expect(TokenType.STRING, "a quoted layout name")));
        children.addAll(parseBlockHeaderAndBody("layout", this::parseLayoutAttr));
        return branch(Rule.LAYOUT, children, keyword);
    }

    private ParseNode parseLayoutAttr() {
        Token keyword = expectWord(LAYOUT_ATTRS, "layout attribute");
        expect(TokenType.COLON, "':'");
        ParseNode value = switch (keyword.text()) {
            case "panels", "inverters", "turbines" -> parseEquipmentRef();
            case "orientation" -> leaf(expectWord(ORIENTATIONS, "orientation"));
            case "tracking" -> leaf(expectWord(TRACKING_MODES, "tracking mode"));
            case "tilt" -> parseAngle();
            default -> parseMeasure(Rule.QUANTITY);
        };
        expectEndOfLine();
        return branch(Rule.LAYOUT_ATTR, List.of(leaf(keyword), value), keyword);
    }

    private ParseNode parseEquipmentRef() {
        Token name = expect(TokenType.IDENTIFIER, "an equipment name");
        List<ParseNode> children = new ArrayList<>();
        children.add(leaf(name));
        if (peek().is(TokenType.STAR)) {
            advance();
            children.add(leaf(expect(TokenType.NUMBER, "a unit count")));
        }
        return branch(Rule.EQUIPMENT_REF, children, name);
    }

    private ParseNode parseAngle() {
        Token value = expect(TokenType.NUMBER, "an angle");
        expect(TokenType.DEGREE, "'°'");
        return branch(Rule.ANGLE, List.of(leaf(value)), value);
    }

    // --- simulate ---

    private ParseNode parseSimulateAttr() {
        Token keyword = expectWord(SIMULATE_ATTRS, "simulate attribute");
        expect(TokenType.COLON, "':'");
        ParseNode value = switch (keyword.text()) {
            case "weather" -> parseWeatherSource();
            case "outputs" -> parseNameList();
            default -> parseMeasure(Rule.DURATION);
        };
        expectEndOfLine();
        return branch(Rule.SIMULATE_ATTR, List.of(leaf(keyword), value), keyword);
    }

    private ParseNode parseWeatherSource() {
        Token provider = expect(TokenType.IDENTIFIER, "a weather provider");
        List<ParseNode> children = new ArrayList<>();
        children.add(leaf(provider));
        expect(TokenType.LPAREN, "'('");
        children.add(leaf(expect(TokenType.STRING, "a quoted argument")));
        while (peek().is(TokenType.COMMA)) {
            advance();
            children.add(leaf(expect(TokenType.STRING, "a quoted argument")));
        }
        expect(TokenType.RPAREN, "')'");
        return branch(Rule.WEATHER_SOURCE, children, provider);
    }

    // --- optimize ---

    private ParseNode parseOptimizeAttr() {
        Token keyword = expectWord(OPTIMIZE_ATTRS, "optimize attribute");
        expect(TokenType.COLON, "':'");
        ParseNode value = switch (keyword.text()) {
            case "objective" -> parseObjective();
            case "variables" -> parseNameList();
            default -> leaf(expect(TokenType.STRING, "a quoted algorithm name"));
        };
        expectEndOfLine();
        return branch(Rule.OPTIMIZE_ATTR, List.of(leaf(keyword), value), keyword);
    }

    private ParseNode parseObjective() {
        Token mode = expectWord(OBJECTIVE_MODES, "objective mode");
        expect(TokenType.LPAREN, "'('");
        Token target = expect(TokenType.IDENTIFIER, "an objective target");
        expect(TokenType.RPAREN, "')'");
        return branch(Rule.OBJECTIVE, List.of(leaf(mode), leaf(target)), mode);
    }

    // --- shared productions ---

    private ParseNode parseNameList() {
        Token open = expect(TokenType.LBRACKET, "'['");
        List<ParseNode> names = new ArrayList<>();
        names.add(leaf(expect(TokenType.IDENTIFIER, "a name")));
        while (peek().is(TokenType.COMMA)) {
            advance();
            names.add(leaf(expect(TokenType.IDENTIFIER, "a name")));
        }
        expect(TokenType.RBRACKET, "']'");
        return branch(Rule.NAME_LIST, names, open);
    }

    /**
     * {@code NUMBER unit}, used for quantities and durations alike.
     */
    private ParseNode parseMeasure(Rule rule) {
        Token value = expect(TokenType.NUMBER, "a number");
        Token unit = peek();
        boolean isUnit = unit.is(TokenType.DEGREE) || unit.is(TokenType.UNIT)
                || (unit.is(TokenType.IDENTIFIER) && Unit.isKnown(unit.text()));
        if (!isUnit) {
            throw unexpected(unit, "a unit " + unitSymbols());
        }
        advance();
        return branch(rule, List.of(leaf(value), leaf(unit)), value);
    }

    private List<ParseNode> parseBlockHeaderAndBody(String section, Supplier<ParseNode> item) {
        expect(TokenType.COLON, "':'");
        return parseBlock(section, item);
    }

    /**
     * {@code NL INDENT item+ DEDENT}
     */
    private List<ParseNode> parseBlock(String what, Supplier<ParseNode> item) {
        expectEndOfLine();
        expect(TokenType.INDENT, "an indented " + what + " block");
        List<ParseNode> items = new ArrayList<>();
        do {
            items.add(item.get());
        } while (!peek().is(TokenType.DEDENT));
        advance();
        return items;
    }

    // --- token helpers ---

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type, String expected) {
        Token token = peek();
        if (!token.is(type)) {
            throw unexpected(token, expected);
        }
        return advance();
    }

    private void expectEndOfLine() {
        expect(TokenType.NEWLINE, "end of line");
    }

    private Token expectWord(List<String> allowed, String what) {
        Token token = peek();
        if (!token.is(TokenType.IDENTIFIER)) {
            throw unexpected(token, "a " + what + " " + allowed);
        }
        if (!allowed.contains(token.text())) {
            throw new DslSyntaxException("Unknown " + what + " '" + token.text() + "', expected one of " + allowed,
                    token.line(), token.column());
        }
        return advance();
    }

    private static DslSyntaxException unexpected(Token token, String expected) {
        return new DslSyntaxException("Expected " + expected + " but found " + token.describe(),
                token.line(), token.column());
    }

    private static ParseNode.Leaf leaf(Token token) {
        return new ParseNode.Leaf(token);
    }

    private static ParseNode.Branch branch(Rule rule, List<ParseNode> children, Token at) {
        return new ParseNode.Branch(rule, children, at.line(), at.column());
    }

    private static String unitSymbols() {
        return Arrays.stream(Unit.values()).map(Unit::symbol).toList().toString();
    }

    private static <E> List<String> keywords(E[] values, Function<E, String> keyword) {
        return Arrays.stream(values).map(keyword).toList();
    }
}
