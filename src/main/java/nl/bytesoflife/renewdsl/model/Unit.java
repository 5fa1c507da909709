package nl.bytesoflife.renewdsl.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed vocabulary of unit tags a quantity may carry.
 * Units are never converted into each other; the enum only classifies them.
 */
public enum Unit {
    METER("m", Dimension.LENGTH),
    KILOMETER("km", Dimension.LENGTH),
    HECTARE("hectares", Dimension.AREA),
    KILOWATT("kW", Dimension.POWER),
    MEGAWATT("MW", Dimension.POWER),
    KWH_PER_M2_DAY("kWh/m²/day", Dimension.ENERGY_DENSITY),
    DEGREE("°", Dimension.ANGLE),
    H("h", Dimension.TIME),
    HOUR("hour", Dimension.TIME),
    DAY("day", Dimension.TIME),
    YEAR("year", Dimension.TIME);

    public enum Dimension {
        LENGTH,
        AREA,
        POWER,
        ENERGY_DENSITY,
        ANGLE,
        TIME
    }

    private static final Map<String, Unit> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Unit::symbol, Function.identity()));

    private final String symbol;
    private final Dimension dimension;

    Unit(String symbol, Dimension dimension) {
        this.symbol = symbol;
        this.dimension = dimension;
    }

    public String symbol() {
        return symbol;
    }

    public Dimension dimension() {
        return dimension;
    }

    public static boolean isKnown(String symbol) {
        return BY_SYMBOL.containsKey(symbol);
    }

    public static Unit fromSymbol(String symbol) {
        Unit unit = BY_SYMBOL.get(symbol);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown unit: " + symbol);
        }
        return unit;
    }
}
