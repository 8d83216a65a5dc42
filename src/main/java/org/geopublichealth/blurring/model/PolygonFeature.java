package org.geopublichealth.blurring.model;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A polygonal feature of an envelope (mask) layer or of a reference layer
 * such as buildings.
 *
 * @param id         source feature identifier
 * @param geometry   polygon or multipolygon geometry
 * @param attributes attribute values in field order
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record PolygonFeature(String id, Geometry geometry, Map<String, Object> attributes) {

    public PolygonFeature {
        Objects.requireNonNull(id, "Feature id is required");
        attributes = attributes == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public PolygonFeature(String id, Geometry geometry) {
        this(id, geometry, Map.of());
    }
}
