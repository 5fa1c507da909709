package nl.bytesoflife.renewdsl.model;

public enum ObjectiveMode {
    MAXIMIZE,
    MINIMIZE;

    public String keyword() {
        return name().toLowerCase();
    }

    public static ObjectiveMode fromKeyword(String keyword) {
        return switch (keyword) {
            case "maximize" -> MAXIMIZE;
            case "minimize" -> MINIMIZE;
            default -> throw new IllegalArgumentException("Unknown objective mode: " + keyword);
        };
    }
}
