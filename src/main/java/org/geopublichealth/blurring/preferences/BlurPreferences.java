package org.geopublichealth.blurring.preferences;

import org.geopublichealth.blurring.model.BlurConfig;
import org.geopublichealth.blurring.model.BlurConfig.CentroidSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Persistent preferences for the blurring tools.
 * <p>
 * Values are stored with {@link Preferences} under the user node
 * {@code geopublichealth/blurring} and persist across sessions. They seed the
 * defaults of new runs; every run still receives an explicit
 * {@link BlurConfig}.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public final class BlurPreferences {

    private static final Logger logger = LoggerFactory.getLogger(BlurPreferences.class);

    private static final String NODE = "geopublichealth/blurring";

    private static final String KEY_RADIUS = "radius";
    private static final String KEY_MAX_ATTEMPTS = "maxAttempts";
    private static final String KEY_SEGMENTS = "segments";
    private static final String KEY_EXPORT_RADIUS = "exportRadius";
    private static final String KEY_EXPORT_CENTROID = "exportCentroid";
    private static final String KEY_CENTROID_SOURCE = "centroidSource";
    private static final String KEY_QUALITY_PARALLELISM = "qualityParallelism";

    private static volatile Preferences activeNode = Preferences.userRoot().node(NODE);

    private BlurPreferences() {
        // Utility class - no instantiation
    }

    private static Preferences node() {
        return activeNode;
    }

    /**
     * Stores and reads preferences under another node, e.g. one owned by an
     * embedding application.
     *
     * @param preferences the node to use from now on
     */
    public static void useNode(Preferences preferences) {
        activeNode = Objects.requireNonNull(preferences, "Preferences node is required");
    }

    /**
     * Goes back to the default user node {@code geopublichealth/blurring}.
     */
    public static void resetNode() {
        activeNode = Preferences.userRoot().node(NODE);
    }

    // ==================== Blurring ====================

    public static double getRadius() {
        return node().getDouble(KEY_RADIUS, BlurConfig.DEFAULT_RADIUS);
    }

    public static void setRadius(double radius) {
        node().putDouble(KEY_RADIUS, radius);
    }

    public static int getMaxAttempts() {
        return node().getInt(KEY_MAX_ATTEMPTS, BlurConfig.DEFAULT_MAX_ATTEMPTS);
    }

    public static void setMaxAttempts(int maxAttempts) {
        node().putInt(KEY_MAX_ATTEMPTS, maxAttempts);
    }

    public static int getSegments() {
        return node().getInt(KEY_SEGMENTS, BlurConfig.DEFAULT_SEGMENTS);
    }

    public static void setSegments(int segments) {
        node().putInt(KEY_SEGMENTS, segments);
    }

    public static boolean isExportRadius() {
        return node().getBoolean(KEY_EXPORT_RADIUS, false);
    }

    public static void setExportRadius(boolean exportRadius) {
        node().putBoolean(KEY_EXPORT_RADIUS, exportRadius);
    }

    public static boolean isExportCentroid() {
        return node().getBoolean(KEY_EXPORT_CENTROID, false);
    }

    public static void setExportCentroid(boolean exportCentroid) {
        node().putBoolean(KEY_EXPORT_CENTROID, exportCentroid);
    }

    /**
     * Returns the stored centroid source, falling back to
     * {@link CentroidSource#DISPLACED_CENTER} for unknown values.
     */
    public static CentroidSource getCentroidSource() {
        String value = node().get(KEY_CENTROID_SOURCE, CentroidSource.DISPLACED_CENTER.name());
        try {
            return CentroidSource.valueOf(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown centroid source '{}' in preferences, using {}",
                    value, CentroidSource.DISPLACED_CENTER);
            return CentroidSource.DISPLACED_CENTER;
        }
    }

    public static void setCentroidSource(CentroidSource centroidSource) {
        node().put(KEY_CENTROID_SOURCE, centroidSource.name());
    }

    // ==================== Quality assessment ====================

    public static int getQualityParallelism() {
        return node().getInt(KEY_QUALITY_PARALLELISM, 1);
    }

    public static void setQualityParallelism(int parallelism) {
        node().putInt(KEY_QUALITY_PARALLELISM, parallelism);
    }

    // ==================== Conversion ====================

    /**
     * Returns a config builder populated with the stored values.
     */
    public static BlurConfig.Builder toConfigBuilder() {
        return BlurConfig.builder()
                .radius(getRadius())
                .maxAttempts(getMaxAttempts())
                .segments(getSegments())
                .exportRadius(isExportRadius())
                .exportCentroid(isExportCentroid())
                .centroidSource(getCentroidSource());
    }

    /**
     * Stores the values of a config as the defaults for the next run.
     *
     * @param config the config that was just used
     */
    public static void remember(BlurConfig config) {
        setRadius(config.getRadius());
        setMaxAttempts(config.getMaxAttempts());
        setSegments(config.getSegments());
        setExportRadius(config.isExportRadius());
        setExportCentroid(config.isExportCentroid());
        setCentroidSource(config.getCentroidSource());
        try {
            node().flush();
        } catch (BackingStoreException e) {
            logger.warn("Failed to flush blurring preferences: {}", e.getMessage());
        }
    }
}
