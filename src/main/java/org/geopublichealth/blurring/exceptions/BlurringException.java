package org.geopublichealth.blurring.exceptions;

/**
 * Base class for all failures raised by the blurring engine and its
 * quality-assessment subsystem.
 * <p>
 * Every failure records the identifier of the feature being processed (when
 * one is known) and the processing stage where it occurred, so that batch
 * reports can point at the offending input.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class BlurringException extends RuntimeException {

    /**
     * Processing stage at which a failure occurred.
     */
    public enum Stage {
        /** Parameter and input validation, before any work starts */
        VALIDATION,
        /** Construction of a spatial index over envelope or reference geometries */
        INDEX_BUILD,
        /** Random displacement of a point */
        SAMPLING,
        /** Containment test of a displaced point against the envelope */
        CONSTRAINT_CHECK,
        /** Intersection counting against the reference layer */
        QUALITY_ASSESSMENT,
        /** Descriptive statistics over a finished batch */
        STATISTICS
    }

    private final String featureId;
    private final Stage stage;

    public BlurringException(String message, String featureId, Stage stage) {
        super(message);
        this.featureId = featureId;
        this.stage = stage;
    }

    public BlurringException(String message, String featureId, Stage stage, Throwable cause) {
        super(message, cause);
        this.featureId = featureId;
        this.stage = stage;
    }

    /**
     * Returns the identifier of the failing feature.
     *
     * @return feature id, or null when the failure is not tied to one feature
     */
    public String getFeatureId() {
        return featureId;
    }

    public Stage getStage() {
        return stage;
    }
}
