package nl.bytesoflife.renewdsl.parser;

import nl.bytesoflife.renewdsl.LiteralCoercionException;
import nl.bytesoflife.renewdsl.ParserOptions;
import nl.bytesoflife.renewdsl.geometry.SiteGeometryConverter;
import nl.bytesoflife.renewdsl.lexer.TokenType;
import nl.bytesoflife.renewdsl.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns a parse tree into a {@link Model}.
 * <p>
 * Each section is reduced to its record and returned; the document reduction collects
 * those records into the model. Repeated attributes inside a block and repeated
 * site/simulate/optimize sections resolve to the last one. The transformer keeps no
 * state between calls.
 */
public class ModelTransformer {

    private static final Logger log = LoggerFactory.getLogger(ModelTransformer.class);

    private final ParserOptions options;

    public ModelTransformer(ParserOptions options) {
        this.options = options;
    }

    public Model transform(ParseNode.Branch document) {
        expectRule(document, Rule.DOCUMENT);

        Site site = null;
        List<Equipment> equipment = new ArrayList<>();
        List<Layout> layouts = new ArrayList<>();
        Simulation simulation = null;
        Optimization optimization = null;

        for (ParseNode node : document.children()) {
            ParseNode.Branch statement = asBranch(node);
            switch (statement.rule()) {
                case SITE -> {
                    if (site != null) {
                        log.debug("site redeclared at line {}, replacing '{}'", statement.line(), site.name());
                    }
                    site = site(statement);
                }
                case EQUIPMENT_SECTION -> equipment.addAll(equipmentSection(statement));
                case LAYOUT -> layouts.add(layout(statement));
                case SIMULATE -> {
                    if (simulation != null) {
                        log.debug("simulate redeclared at line {}, replacing previous", statement.line());
                    }
                    simulation = simulation(statement);
                }
                case OPTIMIZE -> {
                    if (optimization != null) {
                        log.debug("optimize redeclared at line {}, replacing previous", statement.line());
                    }
                    optimization = optimization(statement);
                }
                default -> throw malformed(statement);
            }
        }

        return new Model(site, equipment, layouts, simulation, optimization);
    }

    // --- sections ---

    Site site(ParseNode.Branch node) {
        expectRule(node, Rule.SITE);
        String name = string(child(node, 0));
        Map<String, Object> attrs = attributes(node.children().subList(1, node.children().size()), Rule.SITE_ATTR);
        return new Site(
                name,
                get(attrs, "location", Coordinate.class),
                get(attrs, "area", Quantity.class),
                get(attrs, "terrain", String.class),
                get(attrs, "irradiance", Quantity.class),
                get(attrs, "elevation", Quantity.class));
    }

    List<Equipment> equipmentSection(ParseNode.Branch node) {
        expectRule(node, Rule.EQUIPMENT_SECTION);
        List<Equipment> items = new ArrayList<>();
        for (ParseNode child : node.children()) {
            items.add(equipmentItem(asBranch(child)));
        }
        return items;
    }

    private Equipment equipmentItem(ParseNode.Branch node) {
        expectRule(node, Rule.EQUIPMENT_ITEM);
        EquipmentType type = keyword(child(node, 0), EquipmentType::fromKeyword);
        String name = string(child(node, 1));

        Map<String, SpecValue> specs = new LinkedHashMap<>();
        if (node.children().size() > 2) {
            ParseNode.Branch block = asBranch(child(node, 2));
            expectRule(block, Rule.SPEC_BLOCK);
            for (ParseNode specNode : block.children()) {
                ParseNode.Branch spec = asBranch(specNode);
                expectRule(spec, Rule.EQUIPMENT_SPEC);
                specs.put(asLeaf(child(spec, 0)).text(), specValue(child(spec, 1)));
            }
        }
        return new Equipment(type, name, specs);
    }

    Layout layout(ParseNode.Branch node) {
        expectRule(node, Rule.LAYOUT);
        String name = string(child(node, 0));
        Map<String, Object> attrs = attributes(node.children().subList(1, node.children().size()), Rule.LAYOUT_ATTR);
        return new Layout(
                name,
                get(attrs, "panels", EquipmentRef.class),
                get(attrs, "inverters", EquipmentRef.class),
                get(attrs, "turbines", EquipmentRef.class),
                get(attrs, "orientation", Orientation.class),
                get(attrs, "tilt", Double.class),
                get(attrs, "row_spacing", Quantity.class),
                get(attrs, "tracking", TrackingMode.class));
    }

    @SuppressWarnings("unchecked")
    Simulation simulation(ParseNode.Branch node) {
        expectRule(node, Rule.SIMULATE);
        Map<String, Object> attrs = attributes(node.children(), Rule.SIMULATE_ATTR);
        return new Simulation(
                get(attrs, "weather", WeatherSource.class),
                get(attrs, "duration", String.class),
                get(attrs, "timestep", String.class),
                (List<String>) get(attrs, "outputs", List.class));
    }

    @SuppressWarnings("unchecked")
    Optimization optimization(ParseNode.Branch node) {
        expectRule(node, Rule.OPTIMIZE);
        Map<String, Object> attrs = attributes(node.children(), Rule.OPTIMIZE_ATTR);
        return new Optimization(
                get(attrs, "objective", Objective.class),
                (List<String>) get(attrs, "variables", List.class),
                List.of(),
                get(attrs, "algorithm", String.class));
    }

    /**
     * Collects {@code keyword value} attribute nodes into a map. A repeated keyword
     * silently replaces the earlier value.
     */
    private Map<String, Object> attributes(List<ParseNode> nodes, Rule attrRule) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        for (ParseNode node : nodes) {
            ParseNode.Branch attr = asBranch(node);
            expectRule(attr, attrRule);
            String keyword = asLeaf(child(attr, 0)).text();
            attrs.put(keyword, attributeValue(keyword, child(attr, 1)));
        }
        return attrs;
    }

    private Object attributeValue(String keyword, ParseNode value) {
        if (value instanceof ParseNode.Leaf leaf) {
            return switch (leaf.token().type()) {
                case STRING -> string(leaf);
                case IDENTIFIER -> switch (keyword) {
                    case "orientation" -> keyword(leaf, Orientation::fromKeyword);
                    case "tracking" -> keyword(leaf, TrackingMode::fromKeyword);
                    default -> throw malformed(leaf);
                };
                default -> throw malformed(leaf);
            };
        }

        ParseNode.Branch branch = (ParseNode.Branch) value;
        return switch (branch.rule()) {
            case COORDINATE -> coordinate(branch);
            case QUANTITY -> quantity(branch);
            case DURATION -> duration(branch);
            case ANGLE -> number(child(branch, 0));
            case EQUIPMENT_REF -> equipmentRef(branch);
            case WEATHER_SOURCE -> weatherSource(branch);
            case NAME_LIST -> nameList(branch);
            case OBJECTIVE -> objective(branch);
            default -> throw malformed(branch);
        };
    }

    // --- literals ---

    Coordinate coordinate(ParseNode.Branch node) {
        expectRule(node, Rule.COORDINATE);
        double latitude = number(child(node, 0));
        double longitude = number(child(node, 2));
        // + 0.0 turns -0.0 into 0.0 so 0°S and 0°N compare equal
        if ("S".equals(asLeaf(child(node, 1)).text())) {
            latitude = -latitude + 0.0;
        }
        if ("W".equals(asLeaf(child(node, 3)).text())) {
            longitude = -longitude + 0.0;
        }
        Coordinate coordinate = new Coordinate(latitude, longitude);
        if (options.validateCoordinates() && !SiteGeometryConverter.isWithinWorldBounds(coordinate)) {
            throw new LiteralCoercionException("Coordinate out of range: " + coordinate, node.line(), node.column());
        }
        return coordinate;
    }

    Quantity quantity(ParseNode.Branch node) {
        expectRule(node, Rule.QUANTITY);
        return new Quantity(number(child(node, 0)), unit(child(node, 1)));
    }

    /**
     * Durations keep the composed text, e.g. {@code 1 year} becomes {@code "1.0year"}.
     * The value is always written in plain decimal notation.
     */
    private String duration(ParseNode.Branch node) {
        expectRule(node, Rule.DURATION);
        return plainDecimal(number(child(node, 0))) + unit(child(node, 1));
    }

    private static String plainDecimal(double value) {
        String plain = new BigDecimal(Double.toString(value)).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    EquipmentRef equipmentRef(ParseNode.Branch node) {
        expectRule(node, Rule.EQUIPMENT_REF);
        String name = asLeaf(child(node, 0)).text();
        Integer count = node.children().size() > 1 ? count(asLeaf(child(node, 1))) : null;
        return new EquipmentRef(name, count);
    }

    /**
     * Multipliers truncate toward zero, so {@code 2.9} counts as 2.
     */
    private int count(ParseNode.Leaf leaf) {
        double value = number(leaf);
        if (value >= (double) Integer.MAX_VALUE + 1) {
            throw new LiteralCoercionException("Count out of range: " + leaf.text(), leaf.line(), leaf.column());
        }
        return (int) value;
    }

    private WeatherSource weatherSource(ParseNode.Branch node) {
        String provider = asLeaf(child(node, 0)).text();
        List<String> args = new ArrayList<>();
        for (ParseNode arg : node.children().subList(1, node.children().size())) {
            args.add(string(arg));
        }
        return new WeatherSource(provider, args);
    }

    private List<String> nameList(ParseNode.Branch node) {
        List<String> names = new ArrayList<>();
        for (ParseNode name : node.children()) {
            names.add(asLeaf(name).text());
        }
        return names;
    }

    private Objective objective(ParseNode.Branch node) {
        ObjectiveMode mode = keyword(child(node, 0), ObjectiveMode::fromKeyword);
        return new Objective(mode, asLeaf(child(node, 1)).text());
    }

    private SpecValue specValue(ParseNode node) {
        if (node instanceof ParseNode.Branch branch) {
            return quantity(branch);
        }
        ParseNode.Leaf leaf = asLeaf(node);
        if (leaf.token().is(TokenType.STRING)) {
            return new SpecValue.Text(string(leaf));
        }
        return new SpecValue.Number(number(leaf));
    }

    double number(ParseNode node) {
        ParseNode.Leaf leaf = asLeaf(node);
        try {
            return Double.parseDouble(leaf.text());
        } catch (NumberFormatException e) {
            throw new LiteralCoercionException("Not a number: '" + leaf.text() + "'", leaf.line(), leaf.column(), e);
        }
    }

    private String unit(ParseNode node) {
        ParseNode.Leaf leaf = asLeaf(node);
        if (!Unit.isKnown(leaf.text())) {
            throw new LiteralCoercionException("Unknown unit '" + leaf.text() + "'", leaf.line(), leaf.column());
        }
        return leaf.text();
    }

    /**
     * Strips the quotes and decodes {@code \"}, {@code \\}, {@code \n}, {@code \t} and
     * {@code \r}. Any other escaped character stands for itself.
     */
    String string(ParseNode node) {
        ParseNode.Leaf leaf = asLeaf(node);
        String raw = leaf.text();
        if (raw.length() < 2 || raw.charAt(0) != '"' || raw.charAt(raw.length() - 1) != '"') {
            throw new LiteralCoercionException("Not a quoted string: " + raw, leaf.line(), leaf.column());
        }
        StringBuilder sb = new StringBuilder(raw.length());
        int end = raw.length() - 1;
        for (int i = 1; i < end; i++) {
            char c = raw.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= end) {
                throw new LiteralCoercionException("Dangling escape in " + raw, leaf.line(), leaf.column() + i);
            }
            char escaped = raw.charAt(++i);
            sb.append(switch (escaped) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                default -> escaped;
            });
        }
        return sb.toString();
    }

    private <E> E keyword(ParseNode node, Function<String, E> lookup) {
        ParseNode.Leaf leaf = asLeaf(node);
        try {
            return lookup.apply(leaf.text());
        } catch (IllegalArgumentException e) {
            throw new LiteralCoercionException(e.getMessage(), leaf.line(), leaf.column(), e);
        }
    }

    // --- tree access ---

    private static <T> T get(Map<String, Object> attrs, String key, Class<T> type) {
        Object value = attrs.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Attribute '" + key + "' has " + value.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private static ParseNode child(ParseNode.Branch node, int index) {
        if (index >= node.children().size()) {
            throw malformed(node);
        }
        return node.children().get(index);
    }

    private static ParseNode.Branch asBranch(ParseNode node) {
        if (node instanceof ParseNode.Branch branch) {
            return branch;
        }
        throw malformed(node);
    }

    private static ParseNode.Leaf asLeaf(ParseNode node) {
        if (node instanceof ParseNode.Leaf leaf) {
            return leaf;
        }
        throw malformed(node);
    }

    private static void expectRule(ParseNode.Branch node, Rule rule) {
        if (node.rule() != rule) {
            throw new IllegalStateException("Malformed parse tree: expected " + rule + " but got " + node.rule()
                    + " at line " + node.line());
        }
    }

    private static IllegalStateException malformed(ParseNode node) {
        return new IllegalStateException("Malformed parse tree at line " + node.line() + ": " + node);
    }
}
