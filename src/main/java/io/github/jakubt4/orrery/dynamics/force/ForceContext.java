package io.github.jakubt4.orrery.dynamics.force;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.PVCoordinates;

/**
 * Everything a force model may read during one derivative evaluation.
 *
 * @param epoch              absolute date of the evaluation
 * @param state              inertial position/velocity relative to the central body
 * @param jacobiansRequired  {@code false} when no STM is being propagated; models
 *                           may then return zero partials
 */
public record ForceContext(AbsoluteDate epoch, PVCoordinates state, boolean jacobiansRequired) {

    public Vector3D position() {
        return state.getPosition();
    }

    public Vector3D velocity() {
        return state.getVelocity();
    }
}
