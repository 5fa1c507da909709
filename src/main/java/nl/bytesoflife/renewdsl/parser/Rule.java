package nl.bytesoflife.renewdsl.parser;

/**
 * Grammar productions that appear as branch nodes in the parse tree.
 */
public enum Rule {
    DOCUMENT,
    SITE,
    SITE_ATTR,
    COORDINATE,
    EQUIPMENT_SECTION,
    EQUIPMENT_ITEM,
    SPEC_BLOCK,
    EQUIPMENT_SPEC,
    LAYOUT,
    LAYOUT_ATTR,
    EQUIPMENT_REF,
    ANGLE,
    QUANTITY,
    SIMULATE,
    SIMULATE_ATTR,
    WEATHER_SOURCE,
    DURATION,
    NAME_LIST,
    OPTIMIZE,
    OPTIMIZE_ATTR,
    OBJECTIVE
}
