package ou.capstone.surf.geo;

import java.util.Locale;

/**
 * A surf spot's position in decimal degrees, as listed in the spot table
 * ({@code "coordinates": {"lat": .., "lng": ..}}).
 */
public final class Coordinate {

    private final double lat;
    private final double lng;

    /**
     * @param lat degrees north, -90 to 90
     * @param lng degrees east, -180 to 180 (California is negative)
     * @throws IllegalArgumentException if either value is out of range or NaN
     */
    public Coordinate(final double lat, final double lng) {
        if (!(lat >= -90.0 && lat <= 90.0)) {
            throw new IllegalArgumentException("Latitude out of range [-90, 90]: " + lat);
        }
        if (!(lng >= -180.0 && lng <= 180.0)) {
            throw new IllegalArgumentException("Longitude out of range [-180, 180]: " + lng);
        }
        this.lat = lat;
        this.lng = lng;
    }

    public double getLatitude() {
        return lat;
    }

    public double getLongitude() {
        return lng;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate)) return false;
        final Coordinate other = (Coordinate) o;
        return Double.compare(lat, other.lat) == 0 && Double.compare(lng, other.lng) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lat) + Double.hashCode(lng);
    }

    /** "(37.494000, -122.501000)" */
    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", lat, lng);
    }
}
