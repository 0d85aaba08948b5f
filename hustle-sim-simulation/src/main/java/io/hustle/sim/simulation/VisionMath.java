package io.hustle.sim.simulation;

import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.Vec3;

/**
 * Stateless vision helpers used by the detection pipeline.
 *
 * All methods are static and allocation-light.
 *
 * AWARENESS MODEL:
 *   awareness = visionRange / max(distance, MIN_DETECTION_DISTANCE)
 *   An observer notices an activity when awareness * sensitivity >= visualProfile.
 *   At the edge of range awareness is exactly 1, so a full-profile activity is
 *   still noticed there; closer in it grows without bound.
 *
 * RISK MODEL:
 *   risk = (1 - distance / visionRange) * visualProfile * sensitivity, clamped to [0..1].
 */
public final class VisionMath {

    private VisionMath() {}

    /**
     * Angle between two vectors in degrees, [0..180].
     * Returns 0 if either vector is (near) zero.
     */
    public static float angleDegrees(Vec3 a, Vec3 b) {
        float la = a.length();
        float lb = b.length();
        if (la < 1e-6f || lb < 1e-6f) {
            return 0f;
        }
        float cos = a.dot(b) / (la * lb);
        cos = Math.max(-1f, Math.min(1f, cos));
        return (float) Math.toDegrees(Math.acos(cos));
    }

    /** True if {@code target} lies inside the cone centred on {@code facing}. */
    public static boolean insideCone(Vec3 facing, Vec3 toTarget, float coneDegrees) {
        return angleDegrees(facing, toTarget) <= coneDegrees * 0.5f;
    }

    public static float awareness(float visionRange, float distance) {
        return visionRange / Math.max(distance, HustleConstants.MIN_DETECTION_DISTANCE);
    }

    public static float risk(float visionRange, float distance, float visualProfile, float sensitivity) {
        float proximity = 1f - distance / visionRange;
        return Math.max(0f, Math.min(1f, proximity * visualProfile * sensitivity));
    }
}
