package io.github.jakubt4.orrery.dynamics.frame;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.orekit.utils.PVCoordinates;

/**
 * Radial / transverse / normal frame of an orbiting object, with unit axes
 * expressed in inertial coordinates.
 *
 * <p>Radial is along the position, normal along the angular momentum, and
 * transverse is {@code normal × radial}.
 */
public record RtnFrame(Vector3D radial, Vector3D transverse, Vector3D normal) {

    /**
     * @throws io.github.jakubt4.orrery.dynamics.error.DegenerateGeometryException if the
     *         position or the angular momentum is too short to define a direction
     */
    public static RtnFrame of(final PVCoordinates state) {
        final var radial = Geometry.unitPosition(state.getPosition());
        final var normal = Geometry.unitAngularMomentum(state.getPosition(), state.getVelocity());
        final var transverse = Vector3D.crossProduct(normal, radial);
        return new RtnFrame(radial, transverse, normal);
    }

    /**
     * Rotation from RTN to inertial: the columns are the radial, transverse and
     * normal unit vectors.
     */
    public RealMatrix rotationToInertial() {
        final var m = MatrixUtils.createRealMatrix(3, 3);
        m.setColumn(0, radial.toArray());
        m.setColumn(1, transverse.toArray());
        m.setColumn(2, normal.toArray());
        return m;
    }

    /** Inertial vector whose RTN components are {@code rtn}. */
    public Vector3D toInertial(final Vector3D rtn) {
        return new Vector3D(rtn.getX(), radial, rtn.getY(), transverse, rtn.getZ(), normal);
    }
}
