package org.abmkit.runtime.movement;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Rotations of velocity vectors used by continuous random walks.
 */
public final class VectorRotation {

    private VectorRotation() {}

    /**
     * Rotates a 2D vector counterclockwise by {@code theta} radians.
     */
    public static double[] rotate(double[] w, double theta) {
        if (w.length != 2) {
            throw new IllegalArgumentException("Expected a 2D vector, got " + w.length + " components");
        }
        double c = Math.cos(theta);
        double s = Math.sin(theta);
        return new double[]{c * w[0] - s * w[1], s * w[0] + c * w[1]};
    }

    /**
     * Rotates a 3D vector by a polar angle {@code theta} and an azimuthal angle {@code phi}.
     * <p>
     * {@code w} is first rotated by {@code theta} about a vector {@code u} normal to it, giving
     * {@code a}; {@code a} is then rotated about the original {@code w} by {@code phi}. The
     * result {@code v} satisfies {@code (v.w) / (|v||w|) = cos(theta)} for every {@code phi}.
     *
     * @throws IllegalArgumentException if {@code w} is not 3D or is the zero vector
     */
    public static double[] rotate(double[] w, double theta, double phi) {
        if (w.length != 3) {
            throw new IllegalArgumentException("Expected a 3D vector, got " + w.length + " components");
        }
        int m = -1;
        for (int i = 0; i < 3; i++) {
            if (w[i] != 0) {
                m = i;
                break;
            }
        }
        if (m < 0) {
            throw new IllegalArgumentException("Cannot rotate the zero vector");
        }
        int n = (m + 1) % 3;
        double[] u = new double[3];
        u[n] = w[m];
        u[m] = -w[n];

        Vector3D original = new Vector3D(w);
        Vector3D a = new Rotation(new Vector3D(u), theta, RotationConvention.VECTOR_OPERATOR).applyTo(original);
        Vector3D v = new Rotation(original, phi, RotationConvention.VECTOR_OPERATOR).applyTo(a);
        return v.toArray();
    }
}
