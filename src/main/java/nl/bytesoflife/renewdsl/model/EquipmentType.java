package nl.bytesoflife.renewdsl.model;

public enum EquipmentType {
    PANEL("panel"),
    INVERTER("inverter"),
    TURBINE("turbine"),
    BATTERY("battery");

    private final String keyword;

    EquipmentType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static EquipmentType fromKeyword(String keyword) {
        for (EquipmentType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown equipment type: " + keyword);
    }
}
