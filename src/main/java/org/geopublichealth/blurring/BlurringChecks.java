package org.geopublichealth.blurring;

import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.FeatureLayer;
import org.geopublichealth.blurring.model.PointFeature;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Validation utilities run before a blurring or quality-assessment batch.
 * <p>
 * All checks fail fast with {@link InvalidParameterException}: a failing
 * check means the run is mis-specified, not that one feature is an outlier.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public final class BlurringChecks {

    private static final Logger logger = LoggerFactory.getLogger(BlurringChecks.class);

    private BlurringChecks() {
        // Utility class - no instantiation
    }

    /**
     * Checks that two layers declare the same coordinate reference system.
     * <p>
     * Radius, points, envelope and reference geometries are compared in one
     * planar CRS; no reprojection is attempted.
     *
     * @param first  first layer
     * @param second second layer
     * @throws InvalidParameterException if the CRS tags differ
     */
    public static void checkSameCrs(FeatureLayer<?> first, FeatureLayer<?> second) {
        if (!first.crs().equalsIgnoreCase(second.crs())) {
            logger.error("CRS mismatch: {} is {} but {} is {}",
                    first.name(), first.crs(), second.name(), second.crs());
            throw new InvalidParameterException(String.format(
                    "Layers must share a CRS: %s (%s) and %s (%s)",
                    first.name(), first.crs(), second.name(), second.crs()));
        }
    }

    /**
     * Checks that a layer holds at least one feature.
     *
     * @param layer the layer
     * @throws InvalidParameterException if the layer is empty
     */
    public static void checkNotEmpty(FeatureLayer<?> layer) {
        if (layer.isEmpty()) {
            throw new InvalidParameterException("Layer " + layer.name() + " has no features");
        }
    }

    /**
     * Checks that every point feature carries a non-empty geometry, so that a
     * batch fails before any point is sampled.
     *
     * @param features the points to blur
     * @throws InvalidParameterException naming the first feature without a usable geometry
     */
    public static void checkPointGeometries(List<PointFeature> features) {
        for (PointFeature feature : features) {
            Point point = feature.geometry();
            if (point == null || point.isEmpty()) {
                logger.error("Feature {} has a missing or empty point geometry", feature.id());
                throw new InvalidParameterException(
                        "Feature " + feature.id() + " has a missing or empty point geometry", feature.id());
            }
        }
    }

    /**
     * Checks that the blurred layer is not also used as the reference layer.
     * Layers are compared by identity; distinct layers sharing a name are accepted.
     *
     * @param blurred   blurred layer
     * @param reference reference layer
     * @throws InvalidParameterException if both are the same layer
     */
    public static void checkDistinctLayers(FeatureLayer<?> blurred, FeatureLayer<?> reference) {
        if (blurred == reference) {
            throw new InvalidParameterException(
                    "The reference layer must differ from the blurred layer: " + blurred.name());
        }
    }
}
