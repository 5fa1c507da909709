package nl.bytesoflife.renewdsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A catalog entry. The spec keys are free-form; nothing ties them to the equipment type.
 */
public record Equipment(EquipmentType type, String name, Map<String, SpecValue> specs) {

    public Equipment {
        if (type == null) {
            throw new IllegalArgumentException("Equipment type must not be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("Equipment name must not be null");
        }
        specs = specs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public SpecValue spec(String key) {
        return specs.get(key);
    }

    @Override
    public String toString() {
        return "Equipment{type=" + type.keyword() + ", name='" + name + "', specs=" + specs.size() + "}";
    }
}
