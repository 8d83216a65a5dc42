package org.geopublichealth.blurring.utilities;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Geometry operations the blurring engine depends on.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 * @see JtsGeometryOps
 */
public interface GeometryOps {

    /**
     * Builds a polygon approximating the disk of the given radius.
     *
     * @param center   disk center
     * @param radius   disk radius
     * @param segments number of polygon vertices
     * @return a polygon whose vertices lie on the circle
     */
    Polygon buffer(Coordinate center, double radius, int segments);

    Point point(Coordinate coordinate);

    /**
     * Exact intersection test between two geometries.
     */
    boolean intersects(Geometry a, Geometry b);

    /**
     * Returns the bounding box used for spatial index queries.
     */
    default Envelope boundingBox(Geometry geometry) {
        return geometry.getEnvelopeInternal();
    }
}
