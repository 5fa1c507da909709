package nl.bytesoflife.renewdsl.model;

/**
 * The physical site a document describes. Every field except {@code name} may be null
 * when the document leaves it out.
 *
 * @param name       free-form label, not required to be unique
 * @param location   site position
 * @param area       site area, e.g. {@code 50hectares}
 * @param terrain    free-form terrain description
 * @param irradiance average irradiance, e.g. {@code 6.2kWh/m²/day}
 * @param elevation  height above sea level
 */
public record Site(
        String name,
        Coordinate location,
        Quantity area,
        String terrain,
        Quantity irradiance,
        Quantity elevation
) {
    public Site {
        if (name == null) {
            throw new IllegalArgumentException("Site name must not be null");
        }
    }

    @Override
    public String toString() {
        return "Site{name='" + name + "', location=" + location + "}";
    }
}
