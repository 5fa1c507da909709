package nl.bytesoflife.renewdsl.model;

/**
 * Value of a single equipment spec line: a quantity, a bare number or a string.
 */
public sealed interface SpecValue permits Quantity, SpecValue.Number, SpecValue.Text {

    record Number(double value) implements SpecValue {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Text(String value) implements SpecValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("Text value must not be null");
            }
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
}
