package org.geopublichealth.blurring.scripting;

import org.geopublichealth.blurring.controller.BlurWorkflow;
import org.geopublichealth.blurring.controller.QualityWorkflow;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.BlurBatchResult;
import org.geopublichealth.blurring.model.BlurConfig;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.FeatureLayer;
import org.geopublichealth.blurring.model.PointFeature;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.preferences.BlurPreferences;
import org.geopublichealth.blurring.utilities.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scripting API for blurring and rating point layers.
 * <p>
 * Settings not passed explicitly come from {@link BlurPreferences}; an
 * explicit configuration becomes the stored default for the next run.
 *
 * <h3>Usage Examples</h3>
 * <pre>{@code
 * def cases = new FeatureLayer("cases", "EPSG:2154", points)
 * def result = BlurScripts.blur(cases, 300)
 * println result.summary()
 *
 * def blurred = BlurScripts.asLayer(cases, result)
 * println BlurScripts.qualityTable(blurred, buildings)
 * }</pre>
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class BlurScripts {

    private static final Logger logger = LoggerFactory.getLogger(BlurScripts.class);

    private BlurScripts() {
        // Utility class
    }

    /**
     * Blurs a point layer with the given radius.
     *
     * @param points point layer
     * @param radius radius in map units
     * @return the batch result
     */
    public static BlurBatchResult blur(FeatureLayer<PointFeature> points, double radius) {
        return blur(points, null, radius);
    }

    /**
     * Blurs a point layer, keeping displaced centers inside an envelope.
     *
     * @param points   point layer
     * @param envelope envelope layer, or null for none
     * @param radius   radius in map units
     * @return the batch result
     */
    public static BlurBatchResult blur(FeatureLayer<PointFeature> points,
                                       FeatureLayer<PolygonFeature> envelope,
                                       double radius) {
        BlurConfig config = BlurPreferences.toConfigBuilder()
                .radius(radius)
                .build();
        return blur(points, envelope, config);
    }

    /**
     * Blurs a point layer with an explicit configuration. The configuration
     * is remembered as the default for later runs.
     *
     * @param points   point layer
     * @param envelope envelope layer, or null for none
     * @param config   blurring configuration
     * @return the batch result
     */
    public static BlurBatchResult blur(FeatureLayer<PointFeature> points,
                                       FeatureLayer<PolygonFeature> envelope,
                                       BlurConfig config) {
        BlurBatchResult result = BlurWorkflow.builder()
                .points(points)
                .envelope(envelope)
                .config(config)
                .build()
                .run();
        if (!result.failures().isEmpty()) {
            logger.warn("{} point(s) could not be blurred inside the envelope: {}",
                    result.failures().size(), result.failedFeatureIds());
        }
        BlurPreferences.remember(config);
        return result;
    }

    /**
     * Sets the number of threads used by later quality assessments.
     *
     * @param parallelism number of worker threads, at least 1
     */
    public static void setQualityParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new InvalidParameterException("Parallelism must be at least 1, got " + parallelism);
        }
        BlurPreferences.setQualityParallelism(parallelism);
    }

    /**
     * Wraps blurred features in a layer carrying the source layer's CRS.
     *
     * @param source the layer that was blurred
     * @param result the blurring result
     * @return a layer named after the source with a "_blurred" suffix
     */
    public static FeatureLayer<BlurredFeature> asLayer(FeatureLayer<PointFeature> source, BlurBatchResult result) {
        return new FeatureLayer<>(source.name() + "_blurred", source.crs(), result.features());
    }

    /**
     * Summarizes how many reference features each blurred feature intersects.
     *
     * @param blurred   blurred layer
     * @param reference reference layer
     * @return the intersection-count summary
     */
    public static StatsSummary assessQuality(FeatureLayer<BlurredFeature> blurred,
                                             FeatureLayer<PolygonFeature> reference) {
        return runQuality(blurred, reference).summary();
    }

    /**
     * Returns the statistics table as CSV text.
     *
     * @param blurred   blurred layer
     * @param reference reference layer
     * @return "parameter,values" CSV text
     */
    public static String qualityTable(FeatureLayer<BlurredFeature> blurred,
                                      FeatureLayer<PolygonFeature> reference) {
        QualityReport report = runQuality(blurred, reference).report();
        return report.toCsv();
    }

    private static QualityWorkflow.QualityResult runQuality(FeatureLayer<BlurredFeature> blurred,
                                                            FeatureLayer<PolygonFeature> reference) {
        return QualityWorkflow.builder()
                .blurred(blurred)
                .reference(reference)
                .parallelism(BlurPreferences.getQualityParallelism())
                .build()
                .run();
    }
}
