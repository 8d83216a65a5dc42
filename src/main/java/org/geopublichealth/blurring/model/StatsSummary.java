package org.geopublichealth.blurring.model;

import java.util.List;
import java.util.Locale;

/**
 * Descriptive summary of a numeric series.
 *
 * @param count    number of values
 * @param min      smallest value
 * @param max      largest value
 * @param mean     arithmetic mean
 * @param median   middle value, or the average of the two middle values
 * @param variance variance with the degrees of freedom the summary was computed with
 * @param stdDev   square root of the variance
 * @param range    max minus min
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public record StatsSummary(int count,
                           double min,
                           double max,
                           double mean,
                           double median,
                           double variance,
                           double stdDev,
                           double range) {

    /**
     * One labelled line of a statistics table.
     *
     * @param label parameter name
     * @param value formatted value
     */
    public record Row(String label, String value) {}

    /**
     * Formats the summary as key-value rows for display or export.
     * <p>
     * Extremes keep their natural form (counts print without decimals);
     * moments are printed with six decimals.
     */
    public List<Row> toRows() {
        return List.of(
                new Row("Count", Integer.toString(count)),
                new Row("Min", formatValue(min)),
                new Row("Average", formatDecimal(mean)),
                new Row("Max", formatValue(max)),
                new Row("Median", formatDecimal(median)),
                new Row("Range", formatValue(range)),
                new Row("Variance", formatDecimal(variance)),
                new Row("Standard deviation", formatDecimal(stdDev)));
    }

    /**
     * Formats a value without decimals when it is integral.
     */
    public static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return formatDecimal(value);
    }

    public static String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
