package org.geopublichealth.blurring.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.model.StatsSummary.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics table describing how well a blurred layer anonymizes its points.
 * <p>
 * The minimum intersection count is the worst-case anonymity-set size: a
 * minimum of 0 or 1 means at least one released polygon covers at most one
 * reference unit and likely fails to hide its subject.
 *
 * <h3>Export Format</h3>
 * <pre>
 * parameter,values
 * Count(blurred),120
 * Count(stats),5310
 * Min,3
 * Average,41.250000
 * ...
 * </pre>
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class QualityReport {

    private static final String CSV_HEADER = "parameter,values";

    private final List<Integer> counts;
    private final int blurredCount;
    private final int referenceCount;
    private final StatsSummary summary;
    private final Gson gson;

    /**
     * Creates a report over per-feature intersection counts.
     *
     * @param counts         intersection count of each blurred feature
     * @param blurredCount   number of features in the blurred layer
     * @param referenceCount number of features in the reference layer
     * @throws org.geopublichealth.blurring.exceptions.EmptySeriesException if there are no counts
     */
    public QualityReport(List<Integer> counts, int blurredCount, int referenceCount) {
        this.counts = List.copyOf(counts);
        this.blurredCount = blurredCount;
        this.referenceCount = referenceCount;
        this.summary = DescriptiveStats.summarize(this.counts);
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public StatsSummary getSummary() {
        return summary;
    }

    public List<Integer> getCounts() {
        return counts;
    }

    /**
     * Returns the worst-case anonymity-set size.
     */
    public int getMinimumAnonymitySetSize() {
        return (int) summary.min();
    }

    /**
     * Returns the table rows: layer sizes followed by the summary statistics.
     */
    public List<Row> rows() {
        List<Row> rows = new ArrayList<>();
        rows.add(new Row("Count(blurred)", Integer.toString(blurredCount)));
        rows.add(new Row("Count(stats)", Integer.toString(referenceCount)));
        for (Row row : summary.toRows()) {
            if (!"Count".equals(row.label())) {
                rows.add(row);
            }
        }
        return rows;
    }

    /**
     * Renders the table as CSV text.
     */
    public String toCsv() {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (Row row : rows()) {
            sb.append(row.label()).append(',').append(row.value()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the per-feature counts as CSV text under the table header, one
     * value per blurred feature.
     */
    public String countsToCsv() {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (Integer count : counts) {
            sb.append(count).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the report as pretty-printed JSON.
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("blurredCount", blurredCount);
        root.addProperty("referenceCount", referenceCount);

        JsonObject stats = new JsonObject();
        stats.addProperty("count", summary.count());
        stats.addProperty("min", summary.min());
        stats.addProperty("max", summary.max());
        stats.addProperty("mean", summary.mean());
        stats.addProperty("median", summary.median());
        stats.addProperty("variance", summary.variance());
        stats.addProperty("stdDev", summary.stdDev());
        stats.addProperty("range", summary.range());
        root.add("summary", stats);

        JsonArray values = new JsonArray();
        counts.forEach(values::add);
        root.add("intersectionCounts", values);

        return gson.toJson(root);
    }
}
