package org.geopublichealth.blurring.model;

import org.geopublichealth.blurring.exceptions.PointOutsideEnvelopeException;

import java.util.List;

/**
 * Outcome of blurring a batch of points.
 * <p>
 * When the batch was cancelled, {@code features} and {@code failures} hold
 * what was produced before cancellation; that partial output is valid.
 *
 * @param features  blurred features, in input order
 * @param failures  points that could not be placed inside the envelope, in input order
 * @param processed number of input points handled before the batch ended
 * @param total     number of input points
 * @param cancelled whether the batch stopped early on request
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record BlurBatchResult(List<BlurredFeature> features,
                              List<PointOutsideEnvelopeException> failures,
                              int processed,
                              int total,
                              boolean cancelled) {

    public BlurBatchResult {
        features = List.copyOf(features);
        failures = List.copyOf(failures);
    }

    /**
     * Returns the ids of the points that could not be blurred.
     */
    public List<String> failedFeatureIds() {
        return failures.stream()
                .map(PointOutsideEnvelopeException::getFeatureId)
                .toList();
    }

    /**
     * Returns a one-line summary suitable for logs and status bars.
     */
    public String summary() {
        return String.format("%s: %d/%d point(s) processed, %d blurred, %d outside envelope",
                cancelled ? "Blurring cancelled" : "Blurring completed",
                processed, total, features.size(), failures.size());
    }
}
