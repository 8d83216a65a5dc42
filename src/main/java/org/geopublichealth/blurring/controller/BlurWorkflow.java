package org.geopublichealth.blurring.controller;

import org.geopublichealth.blurring.BlurringChecks;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.exceptions.SpatialIndexBuildException;
import org.geopublichealth.blurring.model.BatchProgress;
import org.geopublichealth.blurring.model.BlurBatchResult;
import org.geopublichealth.blurring.model.BlurConfig;
import org.geopublichealth.blurring.model.FeatureLayer;
import org.geopublichealth.blurring.model.PointFeature;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.service.BlurEngine;
import org.geopublichealth.blurring.service.FeatureSink;
import org.geopublichealth.blurring.service.SpatialIndex;
import org.geopublichealth.blurring.service.StrTreeSpatialIndex;
import org.geopublichealth.blurring.utilities.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Workflow for blurring a point layer.
 * <p>
 * This workflow:
 * <ol>
 *   <li>Validates the layers (non-empty, matching CRS)</li>
 *   <li>Builds the envelope index once, when an envelope is supplied</li>
 *   <li>Blurs every point (or the selected ones) in input order</li>
 *   <li>Streams results to an optional sink and returns them with the failures</li>
 * </ol>
 * Long batches should run off any interactive thread; progress is reported
 * after each point and cancellation is checked between points.
 *
 * <pre>{@code
 * BlurBatchResult result = BlurWorkflow.builder()
 *     .points(caseLayer)
 *     .envelope(urbanAreas)
 *     .config(BlurConfig.builder().radius(250).exportRadius(true).build())
 *     .progress(p -> bar.setValue(p.percent()))
 *     .build()
 *     .run();
 * }</pre>
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class BlurWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(BlurWorkflow.class);

    private BlurWorkflow() {
    }

    public static BlurBuilder builder() {
        return new BlurBuilder();
    }

    /**
     * Builder for configuring blurring runs.
     */
    public static class BlurBuilder {
        private FeatureLayer<PointFeature> points;
        private FeatureLayer<PolygonFeature> envelope;
        private BlurConfig config;
        private RandomSource random;
        private Set<String> selectedIds;
        private FeatureSink sink;
        private Consumer<BatchProgress> progressCallback;
        private Supplier<Boolean> cancelledCheck;

        private BlurBuilder() {}

        /** Sets the point layer to blur (required). */
        public BlurBuilder points(FeatureLayer<PointFeature> points) {
            this.points = points;
            return this;
        }

        /** Sets the envelope layer constraining displaced centers (optional). */
        public BlurBuilder envelope(FeatureLayer<PolygonFeature> envelope) {
            this.envelope = envelope;
            return this;
        }

        /** Sets the blurring configuration (required). */
        public BlurBuilder config(BlurConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the random source. Defaults to {@link RandomSource#threadLocal()};
         * use {@link RandomSource#seeded(long)} for reproducible output.
         */
        public BlurBuilder random(RandomSource random) {
            this.random = random;
            return this;
        }

        /** Restricts blurring to the features with these ids. */
        public BlurBuilder selectedOnly(Set<String> selectedIds) {
            this.selectedIds = selectedIds;
            return this;
        }

        /** Sets a sink receiving each blurred feature as it is produced. */
        public BlurBuilder sink(FeatureSink sink) {
            this.sink = sink;
            return this;
        }

        public BlurBuilder progress(Consumer<BatchProgress> progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public BlurBuilder cancelled(Supplier<Boolean> cancelledCheck) {
            this.cancelledCheck = cancelledCheck;
            return this;
        }

        /**
         * Validates parameters and builds a {@link BlurRunner}.
         *
         * @return a runner ready to blur
         * @throws InvalidParameterException if a layer is missing or empty, the
         *                                   CRS differ, no feature is selected, or a
         *                                   point to blur has no usable geometry
         */
        public BlurRunner build() {
            Objects.requireNonNull(config, "BlurConfig is required");
            if (points == null) {
                throw new InvalidParameterException("A point layer is required");
            }
            BlurringChecks.checkNotEmpty(points);
            if (envelope != null) {
                BlurringChecks.checkNotEmpty(envelope);
                BlurringChecks.checkSameCrs(points, envelope);
            }

            List<PointFeature> features = points.features();
            if (selectedIds != null) {
                features = features.stream()
                        .filter(f -> selectedIds.contains(f.id()))
                        .toList();
                if (features.isEmpty()) {
                    throw new InvalidParameterException("No features to blur: none of the selected ids is in "
                            + points.name());
                }
            }
            BlurringChecks.checkPointGeometries(features);

            return new BlurRunner(features, envelope, config,
                    random != null ? random : RandomSource.threadLocal(),
                    sink, progressCallback, cancelledCheck);
        }
    }

    /**
     * Executes a configured blurring run.
     */
    public static class BlurRunner {
        private final List<PointFeature> features;
        private final FeatureLayer<PolygonFeature> envelope;
        private final BlurConfig config;
        private final RandomSource random;
        private final FeatureSink sink;
        private final Consumer<BatchProgress> progressCallback;
        private final Supplier<Boolean> cancelledCheck;

        private BlurRunner(List<PointFeature> features,
                           FeatureLayer<PolygonFeature> envelope,
                           BlurConfig config,
                           RandomSource random,
                           FeatureSink sink,
                           Consumer<BatchProgress> progressCallback,
                           Supplier<Boolean> cancelledCheck) {
            this.features = features;
            this.envelope = envelope;
            this.config = config;
            this.random = random;
            this.sink = sink;
            this.progressCallback = progressCallback;
            this.cancelledCheck = cancelledCheck;
        }

        public int getFeatureCount() {
            return features.size();
        }

        /**
         * Runs the blurring synchronously.
         *
         * @return blurred features, failures, and whether the run was cancelled
         * @throws SpatialIndexBuildException if the envelope contains a missing or empty geometry
         */
        public BlurBatchResult run() {
            SpatialIndex<PolygonFeature> envelopeIndex = null;
            if (envelope != null) {
                logger.info("Preparing envelope index over {} ({} polygons)", envelope.name(), envelope.size());
                try {
                    envelopeIndex = StrTreeSpatialIndex.ofFeatures(envelope.features());
                } catch (SpatialIndexBuildException e) {
                    logger.error("Blurring aborted, envelope {} cannot be indexed", envelope.name(), e);
                    throw e;
                }
            }

            BlurEngine engine = new BlurEngine(config, random, envelopeIndex);
            return engine.blurAll(features, sink, progressCallback, cancelledCheck);
        }
    }
}
