package org.abmkit.runtime.space;

import java.util.Locale;

/**
 * Distance metric of a grid space.
 */
public enum Metric {
    CHEBYSHEV,
    MANHATTAN,
    EUCLIDEAN;

    /**
     * Computes the length of an integer offset under this metric.
     *
     * @param offset the offset
     * @return the distance from the origin
     */
    public double length(int[] offset) {
        double result = 0;
        for (int d : offset) {
            int a = Math.abs(d);
            switch (this) {
                case CHEBYSHEV -> result = Math.max(result, a);
                case MANHATTAN -> result += a;
                case EUCLIDEAN -> result += (double) a * a;
            }
        }
        return this == EUCLIDEAN ? Math.sqrt(result) : result;
    }

    /**
     * Whether the set of lattice offsets at a fixed radius is well defined. Euclidean spheres
     * on an integer lattice contain almost no lattice points, so only Chebyshev and Manhattan qualify.
     *
     * @return true if {@link AbstractGridSpace#offsetsAtRadius(double)} is supported
     */
    public boolean hasFixedRadiusOffsets() {
        return this != EUCLIDEAN;
    }

    /**
     * @param name "chebyshev", "manhattan" or "euclidean", case-insensitive
     * @return the metric
     */
    public static Metric fromString(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric: " + name, e);
        }
    }
}
