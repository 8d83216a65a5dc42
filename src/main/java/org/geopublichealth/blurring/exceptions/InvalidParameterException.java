package org.geopublichealth.blurring.exceptions;

/**
 * Raised when a run is mis-specified: non-positive radius, empty required
 * layer, malformed geometry, mismatching coordinate reference systems.
 * <p>
 * Always raised before any sampling begins and aborts the whole operation.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class InvalidParameterException extends BlurringException {

    public InvalidParameterException(String message) {
        super(message, null, Stage.VALIDATION);
    }

    public InvalidParameterException(String message, String featureId) {
        super(message, featureId, Stage.VALIDATION);
    }
}
