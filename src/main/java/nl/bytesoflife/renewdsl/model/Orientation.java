package nl.bytesoflife.renewdsl.model;

public enum Orientation {
    SOUTH,
    NORTH,
    EAST,
    WEST;

    public String keyword() {
        return name().toLowerCase();
    }

    public static Orientation fromKeyword(String keyword) {
        return switch (keyword) {
            case "south" -> SOUTH;
            case "north" -> NORTH;
            case "east" -> EAST;
            case "west" -> WEST;
            default -> throw new IllegalArgumentException("Unknown orientation: " + keyword);
        };
    }
}
