package org.geopublichealth.blurring.service;

import org.geopublichealth.blurring.exceptions.BlurringException;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.BatchProgress;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.utilities.DescriptiveStats;
import org.geopublichealth.blurring.utilities.GeometryOps;
import org.geopublichealth.blurring.utilities.JtsGeometryOps;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Measures the anonymity achieved by a blurred layer.
 * <p>
 * For each blurred polygon, counts the reference features (e.g. buildings)
 * that intersect it. Candidates come from a spatial index over the reference
 * layer, built once per assessment, and are confirmed with an exact
 * intersection test.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class QualityAssessor {

    private static final Logger logger = LoggerFactory.getLogger(QualityAssessor.class);

    /** Polygons per fork-join leaf task. */
    private static final int PARALLEL_BATCH_SIZE = 64;

    private final GeometryOps geometryOps;

    public QualityAssessor() {
        this(new JtsGeometryOps());
    }

    public QualityAssessor(GeometryOps geometryOps) {
        this.geometryOps = geometryOps;
    }

    /**
     * Counts reference features intersecting each blurred feature.
     *
     * @param blurredFeatures   released polygons
     * @param referenceFeatures reference layer
     * @return one count per blurred feature, in input order
     */
    public List<Integer> assess(List<BlurredFeature> blurredFeatures, List<PolygonFeature> referenceFeatures) {
        return assess(blurredFeatures, referenceFeatures, null, null);
    }

    /**
     * Counts reference features intersecting each blurred feature, reporting
     * progress and honouring cancellation between features.
     *
     * @param blurredFeatures   released polygons
     * @param referenceFeatures reference layer
     * @param progressCallback  receives progress after each feature (nullable)
     * @param cancelledCheck    returns true when the assessment should stop (nullable)
     * @return counts for the features processed before completion or cancellation, in input order
     * @throws InvalidParameterException if the reference layer is empty
     */
    public List<Integer> assess(List<BlurredFeature> blurredFeatures,
                                List<PolygonFeature> referenceFeatures,
                                Consumer<BatchProgress> progressCallback,
                                Supplier<Boolean> cancelledCheck) {
        SpatialIndex<PolygonFeature> index = buildReferenceIndex(referenceFeatures);

        int total = blurredFeatures.size();
        List<Integer> counts = new ArrayList<>(total);
        for (BlurredFeature feature : blurredFeatures) {
            if (cancelledCheck != null && Boolean.TRUE.equals(cancelledCheck.get())) {
                logger.info("Quality assessment cancelled after {}/{} feature(s)", counts.size(), total);
                break;
            }
            counts.add(countIntersections(feature.geometry(), index));
            if (progressCallback != null) {
                progressCallback.accept(new BatchProgress(counts.size(), total));
            }
        }

        logger.info("Assessed {} blurred feature(s) against {} reference feature(s)",
                counts.size(), referenceFeatures.size());
        return counts;
    }

    /**
     * Counts reference features intersecting each blurred feature on a
     * fork-join pool. The reference index is shared read-only by all workers;
     * the counts are returned in input order.
     *
     * @param blurredFeatures   released polygons
     * @param referenceFeatures reference layer
     * @param parallelism       number of worker threads
     * @return one count per blurred feature, in input order
     */
    public List<Integer> assessInParallel(List<BlurredFeature> blurredFeatures,
                                          List<PolygonFeature> referenceFeatures,
                                          int parallelism) {
        if (parallelism < 1) {
            throw new InvalidParameterException("Parallelism must be at least 1, got " + parallelism);
        }
        SpatialIndex<PolygonFeature> index = buildReferenceIndex(referenceFeatures);

        int[] counts = new int[blurredFeatures.size()];
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            pool.submit(new CountTask(blurredFeatures, index, counts, 0, counts.length)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlurringException("Quality assessment interrupted", null,
                    BlurringException.Stage.QUALITY_ASSESSMENT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BlurringException blurringException) {
                throw blurringException;
            }
            throw new BlurringException("Quality assessment failed: " + cause.getMessage(), null,
                    BlurringException.Stage.QUALITY_ASSESSMENT, cause);
        } finally {
            pool.shutdown();
        }

        logger.info("Assessed {} blurred feature(s) against {} reference feature(s) on {} thread(s)",
                counts.length, referenceFeatures.size(), parallelism);
        return Arrays.stream(counts).boxed().toList();
    }

    /**
     * Counts the indexed features whose geometry intersects a region.
     *
     * @param region the released polygon
     * @param index  index over the reference layer
     * @return number of true intersections
     */
    public int countIntersections(Geometry region, SpatialIndex<PolygonFeature> index) {
        int count = 0;
        for (PolygonFeature candidate : index.query(geometryOps.boundingBox(region))) {
            if (geometryOps.intersects(candidate.geometry(), region)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Summarizes an intersection-count distribution.
     *
     * @param counts per-feature intersection counts
     * @return the summary
     * @throws org.geopublichealth.blurring.exceptions.EmptySeriesException if there are no counts
     */
    public StatsSummary summarize(List<Integer> counts) {
        return DescriptiveStats.summarize(counts);
    }

    private SpatialIndex<PolygonFeature> buildReferenceIndex(List<PolygonFeature> referenceFeatures) {
        if (referenceFeatures == null || referenceFeatures.isEmpty()) {
            throw new InvalidParameterException("The reference layer has no features");
        }
        logger.info("Creating index on the reference layer ({} features)", referenceFeatures.size());
        return StrTreeSpatialIndex.ofFeatures(referenceFeatures);
    }

    /**
     * Splits the blurred features in halves until a slice is small enough to
     * count directly.
     */
    private class CountTask extends RecursiveAction {

        private final List<BlurredFeature> features;
        private final SpatialIndex<PolygonFeature> index;
        private final int[] counts;
        private final int from;
        private final int to;

        CountTask(List<BlurredFeature> features, SpatialIndex<PolygonFeature> index,
                  int[] counts, int from, int to) {
            this.features = features;
            this.index = index;
            this.counts = counts;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from <= PARALLEL_BATCH_SIZE) {
                for (int i = from; i < to; i++) {
                    counts[i] = countIntersections(features.get(i).geometry(), index);
                }
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new CountTask(features, index, counts, from, mid),
                    new CountTask(features, index, counts, mid, to));
        }
    }
}
