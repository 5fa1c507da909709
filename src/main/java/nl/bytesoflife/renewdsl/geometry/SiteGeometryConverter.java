package nl.bytesoflife.renewdsl.geometry;

import nl.bytesoflife.renewdsl.model.Coordinate;
import nl.bytesoflife.renewdsl.model.Site;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Converts parsed site locations to JTS geometry in WGS84 longitude/latitude.
 */
public class SiteGeometryConverter {

    public static final int WGS84_SRID = 4326;

    // x = longitude, y = latitude
    public static final Envelope WORLD_BOUNDS = new Envelope(-180.0, 180.0, -90.0, 90.0);

    private final GeometryFactory factory = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    public Point toPoint(Coordinate coordinate) {
        return factory.createPoint(new org.locationtech.jts.geom.Coordinate(
                coordinate.longitude(), coordinate.latitude()));
    }

    /**
     * Returns an empty point when the site has no location.
     */
    public Point toPoint(Site site) {
        if (site.location() == null) {
            return factory.createPoint();
        }
        return toPoint(site.location());
    }

    public static boolean isWithinWorldBounds(Coordinate coordinate) {
        return WORLD_BOUNDS.contains(coordinate.longitude(), coordinate.latitude());
    }
}
