package org.geopublichealth.blurring.model;

import java.util.List;
import java.util.Objects;

/**
 * A named set of features sharing one coordinate reference system.
 *
 * @param name     display name of the layer
 * @param crs      coordinate reference system tag, e.g. "EPSG:2154"
 * @param features the features, in source order
 * @param <F>      feature type
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record FeatureLayer<F>(String name, String crs, List<F> features) {

    public FeatureLayer {
        Objects.requireNonNull(name, "Layer name is required");
        Objects.requireNonNull(crs, "Layer CRS is required");
        features = List.copyOf(features);
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }
}
