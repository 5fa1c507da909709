package nl.bytesoflife.renewdsl.model;

/**
 * Physical arrangement of equipment on the site. Any field but {@code name} may be null.
 *
 * @param name        layout label
 * @param panels      panel reference
 * @param inverters   inverter reference
 * @param turbines    turbine reference
 * @param orientation facing direction
 * @param tilt        tilt in degrees
 * @param rowSpacing  distance between rows
 * @param tracking    mounting mode
 */
public record Layout(
        String name,
        EquipmentRef panels,
        EquipmentRef inverters,
        EquipmentRef turbines,
        Orientation orientation,
        Double tilt,
        Quantity rowSpacing,
        TrackingMode tracking
) {
    public Layout {
        if (name == null) {
            throw new IllegalArgumentException("Layout name must not be null");
        }
    }

    @Override
    public String toString() {
        return "Layout{name='" + name + "', panels=" + panels + "}";
    }
}
