package org.geopublichealth.blurring.utilities;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.util.GeometricShapeFactory;

/**
 * {@link GeometryOps} backed by the JTS Topology Suite.
 * <p>
 * Stateless apart from the immutable geometry factory, so a single instance
 * can be shared between threads.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class JtsGeometryOps implements GeometryOps {

    private final GeometryFactory factory;

    public JtsGeometryOps() {
        this(new GeometryFactory());
    }

    public JtsGeometryOps(GeometryFactory factory) {
        this.factory = factory;
    }

    @Override
    public Polygon buffer(Coordinate center, double radius, int segments) {
        // GeometricShapeFactory is mutable, one per call
        GeometricShapeFactory shapes = new GeometricShapeFactory(factory);
        shapes.setCentre(center);
        shapes.setSize(2.0 * radius);
        shapes.setNumPoints(segments);
        return shapes.createCircle();
    }

    @Override
    public Point point(Coordinate coordinate) {
        return factory.createPoint(coordinate);
    }

    @Override
    public boolean intersects(Geometry a, Geometry b) {
        return a.intersects(b);
    }
}
