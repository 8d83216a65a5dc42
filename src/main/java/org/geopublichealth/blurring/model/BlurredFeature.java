package org.geopublichealth.blurring.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The released form of a sensitive point: a disk-shaped uncertainty polygon
 * around a randomly displaced center.
 * <p>
 * The polygon always contains the original point, and no point of the polygon
 * lies farther than {@link #maxDisplacement()} from it.
 *
 * @param sourceId   identifier of the point feature this was produced from
 * @param geometry   the uncertainty polygon
 * @param center     the accepted displaced center
 * @param radius     blurring radius in map units
 * @param attributes original attributes followed by any exported fields
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record BlurredFeature(String sourceId,
                             Polygon geometry,
                             Coordinate center,
                             double radius,
                             Map<String, Object> attributes) {

    public BlurredFeature {
        Objects.requireNonNull(sourceId, "Source id is required");
        Objects.requireNonNull(geometry, "Geometry is required");
        center = new Coordinate(Objects.requireNonNull(center, "Center is required"));
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public Coordinate center() {
        return new Coordinate(center);
    }

    /**
     * Upper bound on the distance between the original point and any point of
     * the released polygon.
     */
    public double maxDisplacement() {
        return 2.0 * radius;
    }
}
