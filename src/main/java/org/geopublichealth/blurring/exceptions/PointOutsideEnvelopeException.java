package org.geopublichealth.blurring.exceptions;

/**
 * Raised when no displaced point inside the envelope could be found for a
 * feature within the configured number of attempts.
 * <p>
 * This is a per-feature outcome: batch operations collect it alongside the
 * successful results instead of aborting.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class PointOutsideEnvelopeException extends BlurringException {

    private final int attempts;

    public PointOutsideEnvelopeException(String featureId, int attempts) {
        super(String.format("Feature %s: no displaced point intersects the envelope after %d attempts",
                featureId, attempts), featureId, Stage.CONSTRAINT_CHECK);
        this.attempts = attempts;
    }

    /**
     * Returns the number of samples drawn before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
