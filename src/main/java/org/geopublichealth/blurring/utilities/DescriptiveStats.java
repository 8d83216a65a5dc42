package org.geopublichealth.blurring.utilities;

import org.geopublichealth.blurring.exceptions.EmptySeriesException;
import org.geopublichealth.blurring.model.StatsSummary;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics over a numeric series.
 *
 * <h3>Variance</h3>
 * Population variance (divisor n, {@code ddof = 0}) is used unless sample
 * variance (divisor n - 1, {@code ddof = 1}) is requested.
 *
 * <h3>Empty input</h3>
 * An empty series raises {@link EmptySeriesException}; no default value is
 * ever substituted.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public final class DescriptiveStats {

    /** Delta degrees of freedom for population variance. */
    public static final int POPULATION = 0;

    /** Delta degrees of freedom for sample variance. */
    public static final int SAMPLE = 1;

    private DescriptiveStats() {
        // Utility class - no instantiation
    }

    /**
     * Summarizes a series using population variance.
     *
     * @param values the series
     * @return the summary
     * @throws EmptySeriesException if the series is empty
     */
    public static StatsSummary summarize(double[] values) {
        return summarize(values, POPULATION);
    }

    /**
     * Summarizes a series.
     *
     * @param values the series
     * @param ddof   {@link #POPULATION} or {@link #SAMPLE}
     * @return the summary
     * @throws EmptySeriesException if the series holds no more than {@code ddof} values
     */
    public static StatsSummary summarize(double[] values, int ddof) {
        requireValues(values, ddof);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double min = sorted[0];
        double max = sorted[sorted.length - 1];
        double mean = mean(values);
        double variance = variance(values, ddof);

        return new StatsSummary(
                values.length,
                min,
                max,
                mean,
                medianOfSorted(sorted),
                variance,
                Math.sqrt(variance),
                max - min);
    }

    /**
     * Summarizes a collection of numbers using population variance.
     */
    public static StatsSummary summarize(Collection<? extends Number> values) {
        return summarize(toArray(values), POPULATION);
    }

    public static StatsSummary summarize(Collection<? extends Number> values, int ddof) {
        return summarize(toArray(values), ddof);
    }

    public static double mean(double[] values) {
        requireValues(values, 0);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Returns the median: the middle value for an odd count, the average of
     * the two middle values otherwise.
     */
    public static double median(double[] values) {
        requireValues(values, 0);
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return medianOfSorted(sorted);
    }

    /**
     * Computes the variance with two passes over the data.
     *
     * @param values the series
     * @param ddof   delta degrees of freedom
     * @return sum of squared deviations divided by {@code n - ddof}
     */
    public static double variance(double[] values, int ddof) {
        requireValues(values, ddof);
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return sumSq / (values.length - ddof);
    }

    private static double medianOfSorted(double[] sorted) {
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static void requireValues(double[] values, int ddof) {
        if (ddof != POPULATION && ddof != SAMPLE) {
            throw new IllegalArgumentException("ddof must be 0 or 1, got " + ddof);
        }
        if (values == null || values.length == 0) {
            throw new EmptySeriesException("Cannot compute statistics on an empty series");
        }
        if (values.length <= ddof) {
            throw new EmptySeriesException(String.format(
                    "Sample statistics need at least %d values, got %d", ddof + 1, values.length));
        }
    }

    private static double[] toArray(Collection<? extends Number> values) {
        if (values == null) {
            return new double[0];
        }
        return values.stream().mapToDouble(Number::doubleValue).toArray();
    }
}
