package org.geopublichealth.blurring.utilities;

import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.locationtech.jts.geom.Coordinate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RandomDiskSampler distribution and determinism.
 */
@ExtendWith(MockitoExtension.class)
class RandomDiskSamplerTest {

    @Mock
    private RandomSource random;

    @Test
    @DisplayName("Offset follows radius*sqrt(U1) and angle 2*pi*U2")
    void testSampleUsesSquareRootOfFirstDraw() {
        when(random.nextDouble()).thenReturn(0.25, 0.5);
        RandomDiskSampler sampler = new RandomDiskSampler(random);

        Coordinate sample = sampler.sample(new Coordinate(10, 20), 100);

        // rho = 100 * sqrt(0.25) = 50, theta = pi
        assertEquals(-40.0, sample.x, 1e-9);
        assertEquals(20.0, sample.y, 1e-9);
        verify(random, times(2)).nextDouble();
    }

    @Test
    void testSamplesStayWithinRadius() {
        RandomDiskSampler sampler = new RandomDiskSampler(RandomSource.seeded(7));
        Coordinate center = new Coordinate(1000, -500);

        for (int i = 0; i < 5000; i++) {
            Coordinate sample = sampler.sample(center, 250);
            assertTrue(sample.distance(center) <= 250 + 1e-9, "Sample outside the disk: " + sample);
        }
    }

    @Test
    @DisplayName("Squared offset distance is uniform over [0, r^2]")
    void testSquaredDistanceIsUniform() {
        RandomDiskSampler sampler = new RandomDiskSampler(RandomSource.seeded(42));
        Coordinate center = new Coordinate(0, 0);
        double radius = 100;
        int n = 20_000;

        double[] normalized = new double[n];
        for (int i = 0; i < n; i++) {
            Coordinate sample = sampler.sample(center, radius);
            double d = sample.distance(center);
            normalized[i] = (d * d) / (radius * radius);
        }

        double pValue = new KolmogorovSmirnovTest()
                .kolmogorovSmirnovTest(new UniformRealDistribution(0, 1), normalized);
        assertTrue(pValue > 0.001, "Squared distances are not uniform, p=" + pValue);
    }

    @Test
    void testLinearRadiusSamplingWouldBeRejected() {
        // Center-biased sampling (rho = r * U) must fail the same test
        RandomSource source = RandomSource.seeded(42);
        int n = 20_000;
        double[] normalized = new double[n];
        for (int i = 0; i < n; i++) {
            double u = source.nextDouble();
            normalized[i] = u * u;
        }

        double pValue = new KolmogorovSmirnovTest()
                .kolmogorovSmirnovTest(new UniformRealDistribution(0, 1), normalized);
        assertTrue(pValue < 1e-6, "Goodness-of-fit test should detect center bias");
    }

    @Test
    void testSeededSamplersAreReproducible() {
        RandomDiskSampler a = new RandomDiskSampler(RandomSource.seeded(123));
        RandomDiskSampler b = new RandomDiskSampler(RandomSource.seeded(123));
        Coordinate center = new Coordinate(5, 5);

        for (int i = 0; i < 100; i++) {
            assertEquals(a.sample(center, 10), b.sample(center, 10));
        }
    }

    @Test
    void testNonPositiveRadiusRejected() {
        RandomDiskSampler sampler = new RandomDiskSampler(RandomSource.seeded(1));
        Coordinate center = new Coordinate(0, 0);

        assertThrows(InvalidParameterException.class, () -> sampler.sample(center, 0));
        assertThrows(InvalidParameterException.class, () -> sampler.sample(center, -5));
        assertThrows(InvalidParameterException.class, () -> sampler.sample(center, Double.NaN));
    }
}
