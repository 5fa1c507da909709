package nl.bytesoflife.renewdsl.model;

public record Objective(ObjectiveMode mode, String target) {

    @Override
    public String toString() {
        return mode.keyword() + "(" + target + ")";
    }
}
