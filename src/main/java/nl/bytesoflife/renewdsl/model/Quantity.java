package nl.bytesoflife.renewdsl.model;

/**
 * A magnitude with its verbatim unit tag.
 *
 * @param value magnitude as written in the document
 * @param unit  unit symbol, one of {@link Unit}'s symbols
 */
public record Quantity(double value, String unit) implements SpecValue {

    public Quantity {
        if (unit == null || !Unit.isKnown(unit)) {
            throw new IllegalArgumentException("Unknown unit: " + unit);
        }
    }

    public Unit.Dimension dimension() {
        return Unit.fromSymbol(unit).dimension();
    }

    @Override
    public String toString() {
        return value + unit;
    }
}
