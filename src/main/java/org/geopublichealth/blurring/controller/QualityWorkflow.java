package org.geopublichealth.blurring.controller;

import org.geopublichealth.blurring.BlurringChecks;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.BatchProgress;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.FeatureLayer;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.service.QualityAssessor;
import org.geopublichealth.blurring.utilities.DescriptiveStats;
import org.geopublichealth.blurring.utilities.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Workflow for rating a blurred layer against a reference layer.
 * <p>
 * Counts, for every blurred polygon, the reference features it intersects,
 * and summarizes the distribution. Typical reference layers are buildings or
 * address points: the counts approximate how many real-world candidates each
 * released region could correspond to.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class QualityWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(QualityWorkflow.class);

    private QualityWorkflow() {
    }

    /**
     * Result of a quality assessment.
     *
     * @param counts         intersection count per blurred feature, in input order
     * @param blurredCount   number of features in the blurred layer
     * @param referenceCount number of features in the reference layer
     * @param cancelled      whether the run stopped early; counts then cover a prefix of the layer
     */
    public record QualityResult(List<Integer> counts,
                                int blurredCount,
                                int referenceCount,
                                boolean cancelled) {

        public QualityResult {
            counts = List.copyOf(counts);
        }

        /**
         * Summarizes the counts with population variance.
         *
         * @throws org.geopublichealth.blurring.exceptions.EmptySeriesException if no count was produced
         */
        public StatsSummary summary() {
            return DescriptiveStats.summarize(counts);
        }

        /**
         * Builds the statistics table for display or export.
         *
         * @throws org.geopublichealth.blurring.exceptions.EmptySeriesException if no count was produced
         */
        public QualityReport report() {
            return new QualityReport(counts, blurredCount, referenceCount);
        }
    }

    public static QualityBuilder builder() {
        return new QualityBuilder();
    }

    /**
     * Builder for configuring quality assessments.
     */
    public static class QualityBuilder {
        private FeatureLayer<BlurredFeature> blurred;
        private FeatureLayer<PolygonFeature> reference;
        private int parallelism = 1;
        private Consumer<BatchProgress> progressCallback;
        private Supplier<Boolean> cancelledCheck;

        private QualityBuilder() {}

        /** Sets the blurred layer to rate (required). */
        public QualityBuilder blurred(FeatureLayer<BlurredFeature> blurred) {
            this.blurred = blurred;
            return this;
        }

        /** Sets the reference layer, e.g. buildings (required). */
        public QualityBuilder reference(FeatureLayer<PolygonFeature> reference) {
            this.reference = reference;
            return this;
        }

        /**
         * Sets the number of worker threads. With more than one thread,
         * progress and cancellation callbacks are not used.
         */
        public QualityBuilder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public QualityBuilder progress(Consumer<BatchProgress> progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public QualityBuilder cancelled(Supplier<Boolean> cancelledCheck) {
            this.cancelledCheck = cancelledCheck;
            return this;
        }

        /**
         * Validates parameters and builds a {@link QualityRunner}.
         *
         * @return a runner ready to assess
         * @throws InvalidParameterException if a layer is missing or empty, the
         *                                   layers are the same, or the CRS differ
         */
        public QualityRunner build() {
            if (blurred == null || reference == null) {
                throw new InvalidParameterException("Both a blurred layer and a reference layer are required");
            }
            BlurringChecks.checkNotEmpty(blurred);
            BlurringChecks.checkNotEmpty(reference);
            BlurringChecks.checkSameCrs(blurred, reference);
            BlurringChecks.checkDistinctLayers(blurred, reference);
            if (parallelism < 1) {
                throw new InvalidParameterException("Parallelism must be at least 1, got " + parallelism);
            }
            return new QualityRunner(blurred, reference, parallelism, progressCallback, cancelledCheck);
        }
    }

    /**
     * Executes a configured quality assessment.
     */
    public static class QualityRunner {
        private final FeatureLayer<BlurredFeature> blurred;
        private final FeatureLayer<PolygonFeature> reference;
        private final int parallelism;
        private final Consumer<BatchProgress> progressCallback;
        private final Supplier<Boolean> cancelledCheck;

        private QualityRunner(FeatureLayer<BlurredFeature> blurred,
                              FeatureLayer<PolygonFeature> reference,
                              int parallelism,
                              Consumer<BatchProgress> progressCallback,
                              Supplier<Boolean> cancelledCheck) {
            this.blurred = blurred;
            this.reference = reference;
            this.parallelism = parallelism;
            this.progressCallback = progressCallback;
            this.cancelledCheck = cancelledCheck;
        }

        /**
         * Runs the assessment synchronously.
         *
         * @return per-feature counts and layer sizes
         */
        public QualityResult run() {
            logger.info("Rating {} ({} features) against {} ({} features)",
                    blurred.name(), blurred.size(), reference.name(), reference.size());

            QualityAssessor assessor = new QualityAssessor();
            List<Integer> counts;
            if (parallelism > 1) {
                counts = assessor.assessInParallel(blurred.features(), reference.features(), parallelism);
            } else {
                counts = assessor.assess(blurred.features(), reference.features(),
                        progressCallback, cancelledCheck);
            }

            boolean cancelled = counts.size() < blurred.size();
            QualityResult result = new QualityResult(counts, blurred.size(), reference.size(), cancelled);
            if (!counts.isEmpty()) {
                int min = (int) result.summary().min();
                if (min <= 1) {
                    logger.warn("At least one blurred feature intersects {} reference feature(s); "
                            + "consider a larger radius", min);
                }
            }
            return result;
        }
    }
}
