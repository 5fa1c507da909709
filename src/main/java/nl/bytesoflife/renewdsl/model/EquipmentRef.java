package nl.bytesoflife.renewdsl.model;

/**
 * Reference from a layout to an equipment entry by name. Not resolved during parsing.
 *
 * @param name  equipment name
 * @param count unit multiplier, or null when the layout gives none
 */
public record EquipmentRef(String name, Integer count) {

    public EquipmentRef {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Equipment reference name must not be empty");
        }
    }

    public EquipmentRef(String name) {
        this(name, null);
    }

    @Override
    public String toString() {
        return count != null ? name + " * " + count : name;
    }
}
