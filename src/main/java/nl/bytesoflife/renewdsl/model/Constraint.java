package nl.bytesoflife.renewdsl.model;

/**
 * An optimization bound such as {@code tilt <= 40}. The language has no syntax for
 * constraints yet, so parsed documents never contain one.
 */
public record Constraint(String variable, String operator, SpecValue value) {

    @Override
    public String toString() {
        return variable + " " + operator + " " + value;
    }
}
