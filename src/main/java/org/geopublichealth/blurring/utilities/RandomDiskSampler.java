package org.geopublichealth.blurring.utilities;

import org.geopublichealth.blurring.exceptions.InvalidParameterException;
import org.locationtech.jts.geom.Coordinate;

import java.util.Objects;

/**
 * Draws points uniformly distributed over the area of a disk.
 * <p>
 * The distance from the center is {@code radius * sqrt(U1)} rather than
 * {@code radius * U1}; the latter would concentrate samples near the center
 * and make the true location easier to guess.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public class RandomDiskSampler {

    private final RandomSource random;

    public RandomDiskSampler(RandomSource random) {
        this.random = Objects.requireNonNull(random, "Random source is required");
    }

    /**
     * Samples a point in the disk of the given radius around a center.
     * Consumes exactly two values from the random source.
     *
     * @param center disk center
     * @param radius disk radius, must be positive
     * @return a new coordinate at most {@code radius} away from the center
     * @throws InvalidParameterException if the radius is not positive
     */
    public Coordinate sample(Coordinate center, double radius) {
        if (!(radius > 0)) {
            throw new InvalidParameterException("Sampling radius must be positive, got " + radius);
        }
        double rho = radius * Math.sqrt(random.nextDouble());
        double theta = 2.0 * Math.PI * random.nextDouble();
        return new Coordinate(
                center.x + rho * Math.cos(theta),
                center.y + rho * Math.sin(theta));
    }
}
