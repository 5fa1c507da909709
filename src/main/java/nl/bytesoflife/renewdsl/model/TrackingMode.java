package nl.bytesoflife.renewdsl.model;

public enum TrackingMode {
    FIXED,
    SINGLE_AXIS,
    DUAL_AXIS;

    public String keyword() {
        return name().toLowerCase();
    }

    public static TrackingMode fromKeyword(String keyword) {
        return switch (keyword) {
            case "fixed" -> FIXED;
            case "single_axis" -> SINGLE_AXIS;
            case "dual_axis" -> DUAL_AXIS;
            default -> throw new IllegalArgumentException("Unknown tracking mode: " + keyword);
        };
    }
}
