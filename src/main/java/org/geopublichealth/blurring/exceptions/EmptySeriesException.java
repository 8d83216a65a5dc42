package org.geopublichealth.blurring.exceptions;

/**
 * Raised when descriptive statistics are requested over a series that holds
 * too few values.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class EmptySeriesException extends BlurringException {

    public EmptySeriesException(String message) {
        super(message, null, Stage.STATISTICS);
    }
}
