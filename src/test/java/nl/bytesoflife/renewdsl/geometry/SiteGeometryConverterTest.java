package nl.bytesoflife.renewdsl.geometry;

import nl.bytesoflife.renewdsl.model.Coordinate;
import nl.bytesoflife.renewdsl.model.Site;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Point;

import static org.junit.jupiter.api.Assertions.*;

class SiteGeometryConverterTest {

    private final SiteGeometryConverter converter = new SiteGeometryConverter();

    @Test
    void pointUsesLongitudeAsX() {
        Point point = converter.toPoint(new Coordinate(35.0, -115.0));
        assertEquals(-115.0, point.getX(), 1e-9);
        assertEquals(35.0, point.getY(), 1e-9);
        assertEquals(SiteGeometryConverter.WGS84_SRID, point.getSRID());
    }

    @Test
    void siteWithoutLocationIsEmptyPoint() {
        Site site = new Site("S", null, null, "flat", null, null);
        assertTrue(converter.toPoint(site).isEmpty());
    }

    @Test
    void siteWithLocation() {
        Site site = new Site("S", new Coordinate(-33.9, 18.4), null, null, null, null);
        Point point = converter.toPoint(site);
        assertFalse(point.isEmpty());
        assertEquals(18.4, point.getX(), 1e-9);
    }

    @Test
    void worldBounds() {
        assertTrue(SiteGeometryConverter.isWithinWorldBounds(new Coordinate(90.0, -180.0)));
        assertTrue(SiteGeometryConverter.isWithinWorldBounds(new Coordinate(-45.5, 120.0)));
        assertFalse(SiteGeometryConverter.isWithinWorldBounds(new Coordinate(90.5, 0.0)));
        assertFalse(SiteGeometryConverter.isWithinWorldBounds(new Coordinate(0.0, 181.0)));
    }
}
