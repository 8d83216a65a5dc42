package org.geopublichealth.blurring.exceptions;

/**
 * Raised when a spatial index cannot be built, typically because the geometry
 * set is empty or contains a missing or empty geometry.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class SpatialIndexBuildException extends BlurringException {

    public SpatialIndexBuildException(String message, String featureId) {
        super(message, featureId, Stage.INDEX_BUILD);
    }
}
