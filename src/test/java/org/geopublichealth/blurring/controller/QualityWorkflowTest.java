package org.geopublichealth.blurring.controller;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.geopublichealth.blurring.model.BlurredFeature;
import org.geopublichealth.blurring.model.FeatureLayer;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.geopublichealth.blurring.model.StatsSummary;
import org.geopublichealth.blurring.utilities.JtsGeometryOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QualityWorkflowTest {

    private static final GeometryFactory GF = new GeometryFactory();
    private static final JtsGeometryOps OPS = new JtsGeometryOps(GF);
    private static final String CRS = "EPSG:2154";

    private FeatureLayer<BlurredFeature> blurred;
    private FeatureLayer<PolygonFeature> buildings;

    @BeforeEach
    void setUp() {
        // a row of 10x10 buildings every 20 units along the x axis
        List<PolygonFeature> squares = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            squares.add(new PolygonFeature("b" + i, GF.toGeometry(new Envelope(i * 20, i * 20 + 10, 0, 10))));
        }
        buildings = new FeatureLayer<>("buildings", CRS, squares);

        // disks centered on building 0, 5 and 10 with growing radii
        List<BlurredFeature> disks = new ArrayList<>();
        double[] radii = {4, 16, 36};
        for (int i = 0; i < radii.length; i++) {
            Coordinate center = new Coordinate(i * 100 + 5, 5);
            disks.add(new BlurredFeature("c" + i, OPS.buffer(center, radii[i], 36), center, radii[i], Map.of()));
        }
        blurred = new FeatureLayer<>("cases_blurred", CRS, disks);
    }

    @Test
    void testCountsAndSummary() {
        QualityWorkflow.QualityResult result = QualityWorkflow.builder()
                .blurred(blurred)
                .reference(buildings)
                .build()
                .run();

        assertEquals(List.of(1, 3, 5), result.counts());
        assertFalse(result.cancelled());
        assertEquals(3, result.blurredCount());
        assertEquals(20, result.referenceCount());

        StatsSummary summary = result.summary();
        assertEquals(3.0, summary.mean(), 1e-12);
        assertEquals(3.0, summary.median());
        assertEquals(8.0 / 3.0, summary.variance(), 1e-12);
    }

    @Test
    void testParallelPathGivesSameCounts() {
        QualityWorkflow.QualityResult sequential = QualityWorkflow.builder()
                .blurred(blurred).reference(buildings).build().run();
        QualityWorkflow.QualityResult parallel = QualityWorkflow.builder()
                .blurred(blurred).reference(buildings).parallelism(3).build().run();

        assertEquals(sequential.counts(), parallel.counts());
        assertFalse(parallel.cancelled());
    }

    @Test
    void testReportJson() {
        QualityWorkflow.QualityResult result = QualityWorkflow.builder()
                .blurred(blurred).reference(buildings).build().run();

        JsonObject json = JsonParser.parseString(result.report().toJson()).getAsJsonObject();

        assertEquals(3, json.get("blurredCount").getAsInt());
        assertEquals(20, json.get("referenceCount").getAsInt());
        assertEquals(1.0, json.getAsJsonObject("summary").get("min").getAsDouble());
        assertEquals(3, json.getAsJsonArray("intersectionCounts").size());
    }

    @Test
    void testCancelledRunKeepsPrefix() {
        AtomicInteger done = new AtomicInteger();

        QualityWorkflow.QualityResult result = QualityWorkflow.builder()
                .blurred(blurred)
                .reference(buildings)
                .progress(p -> done.set(p.completed()))
                .cancelled(() -> done.get() >= 1)
                .build()
                .run();

        assertTrue(result.cancelled());
        assertEquals(List.of(1), result.counts());
    }

    @Test
    void testDistinctLayersSharingANameAccepted() {
        FeatureLayer<BlurredFeature> namedLayer = new FeatureLayer<>("layer", CRS, blurred.features().subList(0, 1));
        FeatureLayer<PolygonFeature> alsoNamedLayer = new FeatureLayer<>("layer", CRS,
                buildings.features().subList(5, 6));

        QualityWorkflow.QualityResult result = QualityWorkflow.builder()
                .blurred(namedLayer)
                .reference(alsoNamedLayer)
                .build()
                .run();

        assertEquals(List.of(0), result.counts());
    }

    @Test
    void testCrsMismatchRejected() {
        FeatureLayer<PolygonFeature> other = new FeatureLayer<>("buildings", "EPSG:3857", buildings.features());

        assertThrows(InvalidParameterException.class,
                () -> QualityWorkflow.builder().blurred(blurred).reference(other).build());
    }

    @Test
    void testMissingOrEmptyLayersRejected() {
        assertThrows(InvalidParameterException.class,
                () -> QualityWorkflow.builder().blurred(blurred).build());
        assertThrows(InvalidParameterException.class,
                () -> QualityWorkflow.builder()
                        .blurred(blurred)
                        .reference(new FeatureLayer<>("buildings", CRS, List.of()))
                        .build());
    }

    @Test
    void testInvalidParallelismRejected() {
        assertThrows(InvalidParameterException.class,
                () -> QualityWorkflow.builder().blurred(blurred).reference(buildings).parallelism(0).build());
    }
}
