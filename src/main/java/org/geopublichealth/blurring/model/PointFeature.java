package org.geopublichealth.blurring.model;

import org.locationtech.jts.geom.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A sensitive point location with its attribute record.
 *
 * @param id         source feature identifier, used in failure reports
 * @param geometry   the point location
 * @param attributes attribute values in field order; null values are allowed
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record PointFeature(String id, Point geometry, Map<String, Object> attributes) {

    public PointFeature {
        Objects.requireNonNull(id, "Feature id is required");
        attributes = attributes == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public PointFeature(String id, Point geometry) {
        this(id, geometry, Map.of());
    }
}
