package org.geopublichealth.blurring.service;

import org.geopublichealth.blurring.exceptions.EmptySeriesException;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.BlurConfig;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.PointFeature;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.utilities.JtsGeometryOps;
import org.geopublichealth.blurring.utilities.RandomSource;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class QualityAssessorTest {

    private static final GeometryFactory GF = new GeometryFactory();
    private static final JtsGeometryOps OPS = new JtsGeometryOps(GF);

    private static BlurredFeature disk(String id, double x, double y, double radius) {
        Coordinate center = new Coordinate(x, y);
        return new BlurredFeature(id, OPS.buffer(center, radius, 36), center, radius, Map.of());
    }

    private static PolygonFeature square(String id, double minX, double minY, double maxX, double maxY) {
        return new PolygonFeature(id, GF.toGeometry(new Envelope(minX, maxX, minY, maxY)));
    }

    private static List<PolygonFeature> buildingsAroundOrigin() {
        return List.of(
                square("inside", -1, -1, 1, 1),
                square("edge", 9, -1, 11, 1),
                // bounding boxes overlap but the corner stays outside the circle
                square("corner", 8, 8, 10, 10),
                square("far", 100, 100, 101, 101));
    }

    @Test
    void testCountsOnlyTrueIntersections() {
        QualityAssessor assessor = new QualityAssessor();

        List<Integer> counts = assessor.assess(
                List.of(disk("a", 0, 0, 10), disk("b", 100.5, 100.5, 2), disk("c", 50, 50, 1)),
                buildingsAroundOrigin());

        assertEquals(List.of(2, 1, 0), counts);
    }

    @Test
    void testExactTestOnlyRunsOnIndexCandidates() {
        JtsGeometryOps ops = spy(new JtsGeometryOps(GF));
        QualityAssessor assessor = new QualityAssessor(ops);

        assessor.assess(List.of(disk("a", 0, 0, 10)), buildingsAroundOrigin());

        // inside, edge and corner share the bounding box; far does not
        verify(ops, times(3)).intersects(any(Geometry.class), any(Geometry.class));
    }

    @Test
    void testParallelMatchesSequential() {
        List<PolygonFeature> buildings = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            for (int j = 0; j < 40; j++) {
                buildings.add(square("b" + i + "_" + j, i * 25, j * 25, i * 25 + 10, j * 25 + 10));
            }
        }
        BlurEngine engine = new BlurEngine(BlurConfig.builder().radius(30).build(), RandomSource.seeded(21));
        RandomSource positions = RandomSource.seeded(22);
        List<BlurredFeature> blurred = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            double x = positions.nextDouble() * 1000;
            double y = positions.nextDouble() * 1000;
            blurred.add(engine.blur(new PointFeature("p" + i, GF.createPoint(new Coordinate(x, y)))));
        }
        QualityAssessor assessor = new QualityAssessor();

        List<Integer> sequential = assessor.assess(blurred, buildings);
        List<Integer> parallel = assessor.assessInParallel(blurred, buildings, 4);

        assertEquals(500, parallel.size());
        assertEquals(sequential, parallel);
    }

    @Test
    void testEmptyReferenceRejected() {
        QualityAssessor assessor = new QualityAssessor();
        List<BlurredFeature> blurred = List.of(disk("a", 0, 0, 10));

        assertThrows(InvalidParameterException.class, () -> assessor.assess(blurred, List.of()));
        assertThrows(InvalidParameterException.class, () -> assessor.assessInParallel(blurred, List.of(), 2));
    }

    @Test
    void testInvalidParallelismRejected() {
        QualityAssessor assessor = new QualityAssessor();

        assertThrows(InvalidParameterException.class,
                () -> assessor.assessInParallel(List.of(disk("a", 0, 0, 10)), buildingsAroundOrigin(), 0));
    }

    @Test
    void testCancellationReturnsPrefix() {
        QualityAssessor assessor = new QualityAssessor();
        List<BlurredFeature> blurred = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            blurred.add(disk("d" + i, 0, 0, 10));
        }
        AtomicInteger done = new AtomicInteger();

        List<Integer> counts = assessor.assess(blurred, buildingsAroundOrigin(),
                p -> done.set(p.completed()),
                () -> done.get() >= 2);

        assertEquals(List.of(2, 2), counts);
    }

    @Test
    void testSummarizeCounts() {
        StatsSummary summary = new QualityAssessor().summarize(List.of(3, 1, 4, 1, 5));

        assertEquals(5, summary.count());
        assertEquals(1.0, summary.min());
        assertEquals(5.0, summary.max());
        assertEquals(2.8, summary.mean(), 1e-12);
        assertEquals(3.0, summary.median());
        assertEquals(4.0, summary.range());
    }

    @Test
    void testSummarizeEmptyCountsFails() {
        assertThrows(EmptySeriesException.class, () -> new QualityAssessor().summarize(List.of()));
    }
}
