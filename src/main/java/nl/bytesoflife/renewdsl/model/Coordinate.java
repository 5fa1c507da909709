package nl.bytesoflife.renewdsl.model;

/**
 * Geographic position in signed degrees. North and East are positive.
 */
public record Coordinate(double latitude, double longitude) {

    @Override
    public String toString() {
        String ns = latitude >= 0 ? "N" : "S";
        String ew = longitude >= 0 ? "E" : "W";
        return Math.abs(latitude) + "°" + ns + ", " + Math.abs(longitude) + "°" + ew;
    }
}
