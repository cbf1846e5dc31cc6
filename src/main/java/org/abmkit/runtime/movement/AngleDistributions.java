package org.abmkit.runtime.movement;

import org.apache.commons.math3.distribution.RealDistribution;

import java.util.Objects;

/**
 * Built-in angle distributions.
 */
public final class AngleDistributions {

    private AngleDistributions() {}

    /**
     * Uniform on {@code [a, b)}.
     *
     * @throws IllegalArgumentException unless {@code a < b} and both are finite
     */
    public static IAngleDistribution uniform(double a, double b) {
        if (!Double.isFinite(a) || !Double.isFinite(b) || !(a < b)) {
            throw new IllegalArgumentException("Uniform angle distribution requires finite a < b, got [" + a + ", " + b + ")");
        }
        return random -> a + (b - a) * random.nextDouble();
    }

    /**
     * {@code acos(U)} with {@code U} uniform on {@code [a, b)}. With {@code a = -1, b = 1} this
     * is the azimuthal angle of a direction uniformly distributed over the sphere.
     *
     * @throws IllegalArgumentException unless {@code -1 <= a < b <= 1}
     */
    public static IAngleDistribution arccos(double a, double b) {
        if (!(a >= -1 && b <= 1 && a < b)) {
            throw new IllegalArgumentException("Arccos angle distribution requires -1 <= a < b <= 1, got [" + a + ", " + b + ")");
        }
        return random -> Math.acos(a + (b - a) * random.nextDouble());
    }

    /**
     * Always returns {@code angle}.
     */
    public static IAngleDistribution constant(double angle) {
        if (!Double.isFinite(angle)) {
            throw new IllegalArgumentException("Angle must be finite, got " + angle);
        }
        return random -> angle;
    }

    /**
     * Adapts a commons-math distribution. The distribution samples from its own generator,
     * not from the model's random source; build it on
     * {@link org.abmkit.runtime.spi.IRandomProvider#asRandomGenerator()} to keep runs reproducible.
     */
    public static IAngleDistribution of(RealDistribution distribution) {
        Objects.requireNonNull(distribution, "distribution");
        return random -> distribution.sample();
    }

    /**
     * The default polar distribution, uniform on {@code [-pi, pi)}.
     */
    public static IAngleDistribution defaultPolar() {
        return uniform(-Math.PI, Math.PI);
    }

    /**
     * The default azimuthal distribution, {@code arccos(-1, 1)}.
     */
    public static IAngleDistribution defaultAzimuthal() {
        return arccos(-1, 1);
    }
}
