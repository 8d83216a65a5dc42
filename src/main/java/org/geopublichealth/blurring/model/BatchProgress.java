package org.geopublichealth.blurring.model;

/**
 * Progress of a batch operation, reported after each processed item.
 *
 * @param completed number of items processed so far
 * @param total     number of items in the batch
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record BatchProgress(int completed, int total) {

    /**
     * Returns the completed fraction in [0, 1].
     */
    public double fraction() {
        return total == 0 ? 1.0 : (double) completed / total;
    }

    /**
     * Returns the completed percentage, rounded down.
     */
    public int percent() {
        return total == 0 ? 100 : (int) (completed * 100L / total);
    }
}
