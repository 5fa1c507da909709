package nl.bytesoflife.renewdsl.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing one document. Built once per parse and immutable afterwards.
 *
 * @param site         the site, or null when the document declares none
 * @param equipment    equipment entries in declaration order
 * @param layouts      layouts in declaration order
 * @param simulation   simulation request, or null
 * @param optimization optimization request, or null
 */
public record Model(
        Site site,
        List<Equipment> equipment,
        List<Layout> layouts,
        Simulation simulation,
        Optimization optimization
) {
    public Model {
        equipment = equipment == null ? List.of() : List.copyOf(equipment);
        layouts = layouts == null ? List.of() : List.copyOf(layouts);
    }

    /**
     * First equipment entry with the given name. Names are not unique, and layout
     * references are never checked against the catalog while parsing.
     */
    public Optional<Equipment> findEquipment(String name) {
        return equipment.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Model{");
        if (site != null) sb.append("site=").append(site.name()).append(", ");
        sb.append("equipment=").append(equipment.size());
        sb.append(", layouts=").append(layouts.size());
        if (simulation != null) sb.append(", simulation");
        if (optimization != null) sb.append(", optimization");
        return sb.append('}').toString();
    }
}
