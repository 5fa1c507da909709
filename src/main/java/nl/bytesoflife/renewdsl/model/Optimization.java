package nl.bytesoflife.renewdsl.model;

import java.util.List;

public record Optimization(Objective objective, List<String> variables, List<Constraint> constraints, String algorithm) {

    public static final String DEFAULT_ALGORITHM = "gradient";

    public Optimization {
        variables = variables == null ? List.of() : List.copyOf(variables);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        algorithm = algorithm == null ? DEFAULT_ALGORITHM : algorithm;
    }

    @Override
    public String toString() {
        return "Optimization{objective=" + objective + ", vars=" + variables.size() + "}";
    }
}
