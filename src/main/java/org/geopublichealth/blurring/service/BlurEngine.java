package org.geopublichealth.blurring.service;

import org.geopublichealth.blurring.BlurringChecks;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.exceptions.PointOutsideEnvelopeException;
import org.geopublichealth.blurring.model.BatchProgress;
import org.geopublichealth.blurring.model.BlurBatchResult;
import org.geopublichealth.blurring.model.BlurConfig;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.PointFeature;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.utilities.GeometryOps;
import org.geopublichealth.blurring.utilities.JtsGeometryOps;
import org.geopublichealth.blurring.utilities.RandomDiskSampler;
import org.geopublichealth.blurring.utilities.RandomSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Hides sensitive point locations behind randomly placed disk polygons.
 * <p>
 * For each point:
 * <ol>
 *   <li>A center is drawn uniformly in a disk around the point</li>
 *   <li>If an envelope is configured, the center must intersect one of its
 *       polygons; otherwise a new center is drawn, up to the configured number
 *       of attempts</li>
 *   <li>The released polygon is a disk of the blurring radius around the
 *       accepted center</li>
 * </ol>
 * The original point is always inside the released polygon and at most twice
 * the radius away from any of its points.
 * <p>
 * An engine holds one random source and is meant to be used by a single
 * worker. The envelope index may be shared between engines.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class BlurEngine {

    private static final Logger logger = LoggerFactory.getLogger(BlurEngine.class);

    /** Attribute holding the blurring radius. */
    public static final String RADIUS_FIELD = "Radius";
    /** Attribute holding the X coordinate of the exported centroid. */
    public static final String X_CENTROID_FIELD = "X_centroid";
    /** Attribute holding the Y coordinate of the exported centroid. */
    public static final String Y_CENTROID_FIELD = "Y_centroid";

    private final BlurConfig config;
    private final RandomDiskSampler sampler;
    private final SpatialIndex<PolygonFeature> envelopeIndex;
    private final GeometryOps geometryOps;

    /**
     * Creates an engine without an envelope.
     *
     * @param config blurring configuration
     * @param random random source for displacement
     */
    public BlurEngine(BlurConfig config, RandomSource random) {
        this(config, random, null, new JtsGeometryOps());
    }

    /**
     * Creates an engine constrained by an envelope.
     *
     * @param config        blurring configuration
     * @param random        random source for displacement
     * @param envelopeIndex index over the envelope polygons, or null for no constraint
     */
    public BlurEngine(BlurConfig config, RandomSource random, SpatialIndex<PolygonFeature> envelopeIndex) {
        this(config, random, envelopeIndex, new JtsGeometryOps());
    }

    public BlurEngine(BlurConfig config, RandomSource random,
                      SpatialIndex<PolygonFeature> envelopeIndex, GeometryOps geometryOps) {
        this.config = Objects.requireNonNull(config, "BlurConfig is required");
        this.sampler = new RandomDiskSampler(random);
        this.envelopeIndex = envelopeIndex;
        this.geometryOps = Objects.requireNonNull(geometryOps, "GeometryOps is required");
    }

    public BlurConfig getConfig() {
        return config;
    }

    public boolean hasEnvelope() {
        return envelopeIndex != null;
    }

    /**
     * Blurs a single point feature.
     *
     * @param feature the sensitive point
     * @return the blurred feature
     * @throws InvalidParameterException     if the feature has no usable point geometry
     * @throws PointOutsideEnvelopeException if no center inside the envelope was found
     */
    public BlurredFeature blur(PointFeature feature) throws PointOutsideEnvelopeException {
        Point point = feature.geometry();
        if (point == null || point.isEmpty()) {
            throw new InvalidParameterException(
                    "Feature " + feature.id() + " has a missing or empty point geometry", feature.id());
        }

        Coordinate center = displace(feature.id(), point.getCoordinate());
        Polygon polygon = geometryOps.buffer(center, config.getRadius(), config.getSegments());

        return new BlurredFeature(feature.id(), polygon, center, config.getRadius(),
                enrichAttributes(feature.attributes(), center, polygon));
    }

    /**
     * Draws displaced centers until one satisfies the envelope constraint.
     *
     * @param featureId identifier used in failure reports
     * @param origin    the original location
     * @return the accepted center
     * @throws PointOutsideEnvelopeException if every attempt fell outside the envelope
     */
    Coordinate displace(String featureId, Coordinate origin) throws PointOutsideEnvelopeException {
        double samplingRadius = config.getSamplingRadius();
        if (envelopeIndex == null) {
            return sampler.sample(origin, samplingRadius);
        }

        int attempts = 0;
        while (attempts < config.getMaxAttempts()) {
            Coordinate candidate = sampler.sample(origin, samplingRadius);
            attempts++;
            if (insideEnvelope(candidate)) {
                logger.debug("Feature {}: center accepted after {} attempt(s)", featureId, attempts);
                return candidate;
            }
        }
        throw new PointOutsideEnvelopeException(featureId, attempts);
    }

    private boolean insideEnvelope(Coordinate candidate) {
        Point point = geometryOps.point(candidate);
        for (PolygonFeature polygon : envelopeIndex.query(geometryOps.boundingBox(point))) {
            if (geometryOps.intersects(point, polygon.geometry())) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> enrichAttributes(Map<String, Object> original, Coordinate center, Polygon polygon) {
        Map<String, Object> attributes = new LinkedHashMap<>(original);
        if (config.isExportRadius()) {
            attributes.put(RADIUS_FIELD, config.getRadius());
        }
        if (config.isExportCentroid()) {
            Coordinate centroid = switch (config.getCentroidSource()) {
                case DISPLACED_CENTER -> center;
                case POLYGON_CENTROID -> polygon.getCentroid().getCoordinate();
            };
            attributes.put(X_CENTROID_FIELD, centroid.x);
            attributes.put(Y_CENTROID_FIELD, centroid.y);
        }
        return attributes;
    }

    /**
     * Blurs a batch of points sequentially.
     *
     * @param features points to blur
     * @return blurred features in input order plus per-point failures
     */
    public BlurBatchResult blurAll(List<PointFeature> features) {
        return blurAll(features, null, null, null);
    }

    /**
     * Blurs a batch of points sequentially, preserving input order.
     * <p>
     * Points that cannot be placed inside the envelope are collected as
     * failures and the batch continues. Cancellation is checked before each
     * point; results produced before cancellation are returned.
     *
     * @param features         points to blur
     * @param sink             receives each blurred feature as it is produced (nullable)
     * @param progressCallback receives progress after each point (nullable)
     * @param cancelledCheck   returns true when the batch should stop (nullable)
     * @return the batch result
     * @throws InvalidParameterException if any point has no usable geometry; raised
     *                                   before the first point is sampled
     */
    public BlurBatchResult blurAll(List<PointFeature> features,
                                   FeatureSink sink,
                                   Consumer<BatchProgress> progressCallback,
                                   Supplier<Boolean> cancelledCheck) {
        BlurringChecks.checkPointGeometries(features);
        int total = features.size();
        logger.info("Blurring {} point(s): {}, envelope={}", total, config, hasEnvelope());

        List<BlurredFeature> blurred = new ArrayList<>(total);
        List<PointOutsideEnvelopeException> failures = new ArrayList<>();
        int processed = 0;
        boolean cancelled = false;

        for (PointFeature feature : features) {
            if (cancelledCheck != null && Boolean.TRUE.equals(cancelledCheck.get())) {
                logger.info("Blurring cancelled after {}/{} point(s)", processed, total);
                cancelled = true;
                break;
            }

            try {
                BlurredFeature result = blur(feature);
                blurred.add(result);
                if (sink != null) {
                    sink.accept(result.geometry(), result.attributes());
                }
            } catch (PointOutsideEnvelopeException e) {
                logger.warn("Skipping feature {}: {}", feature.id(), e.getMessage());
                failures.add(e);
            }

            processed++;
            if (progressCallback != null) {
                progressCallback.accept(new BatchProgress(processed, total));
            }
        }

        BlurBatchResult result = new BlurBatchResult(blurred, failures, processed, total, cancelled);
        logger.info(result.summary());
        return result;
    }
}
