package org.geopublichealth.blurring.utilities;

import org.geopublichealth.blurring.exceptions.EmptySeriesException;
import org.geopublichealth.blurring.model.StatsSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptiveStatsTest {

    @Test
    void testSummarizeOneToFive() {
        StatsSummary s = DescriptiveStats.summarize(new double[]{1, 2, 3, 4, 5});

        assertEquals(5, s.count());
        assertEquals(1.0, s.min());
        assertEquals(5.0, s.max());
        assertEquals(3.0, s.mean(), 1e-12);
        assertEquals(3.0, s.median(), 1e-12);
        assertEquals(2.0, s.variance(), 1e-12);
        assertEquals(1.4142, s.stdDev(), 1e-4);
        assertEquals(4.0, s.range());
    }

    @Test
    void testSampleVariance() {
        StatsSummary s = DescriptiveStats.summarize(new double[]{1, 2, 3, 4, 5}, DescriptiveStats.SAMPLE);

        assertEquals(2.5, s.variance(), 1e-12);
        assertEquals(Math.sqrt(2.5), s.stdDev(), 1e-12);
    }

    @Test
    void testMedianOfEvenCountAveragesMiddleValues() {
        assertEquals(2.5, DescriptiveStats.median(new double[]{4, 1, 3, 2}), 1e-12);
        assertEquals(7.0, DescriptiveStats.median(new double[]{7}), 1e-12);
    }

    @Test
    void testUnsortedInputIsNotModified() {
        double[] values = {5, 1, 4};
        StatsSummary s = DescriptiveStats.summarize(values);

        assertArrayEquals(new double[]{5, 1, 4}, values);
        assertEquals(4.0, s.median());
        assertEquals(1.0, s.min());
    }

    @Test
    void testSummarizeIntegerCollection() {
        StatsSummary s = DescriptiveStats.summarize(List.of(3, 3, 3));

        assertEquals(3, s.count());
        assertEquals(0.0, s.variance());
        assertEquals(0.0, s.range());
    }

    @Test
    void testEmptySeriesRejected() {
        assertThrows(EmptySeriesException.class, () -> DescriptiveStats.summarize(new double[0]));
        assertThrows(EmptySeriesException.class, () -> DescriptiveStats.summarize(List.of()));
        assertThrows(EmptySeriesException.class, () -> DescriptiveStats.mean(new double[0]));
    }

    @Test
    void testSampleVarianceNeedsTwoValues() {
        assertThrows(EmptySeriesException.class,
                () -> DescriptiveStats.summarize(new double[]{1}, DescriptiveStats.SAMPLE));
    }

    @Test
    void testInvalidDdofRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DescriptiveStats.variance(new double[]{1, 2}, 2));
    }

    @Test
    void testRowsFormatting() {
        StatsSummary s = DescriptiveStats.summarize(List.of(1, 2, 3, 4, 5));
        List<StatsSummary.Row> rows = s.toRows();

        assertEquals(new StatsSummary.Row("Count", "5"), rows.get(0));
        assertEquals(new StatsSummary.Row("Min", "1"), rows.get(1));
        assertEquals(new StatsSummary.Row("Average", "3.000000"), rows.get(2));
        assertEquals(new StatsSummary.Row("Standard deviation", "1.414214"), rows.get(7));
    }
}
