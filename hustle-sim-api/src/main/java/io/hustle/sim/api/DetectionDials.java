package io.hustle.sim.api;

/**
 * Global detection dials shared between the heat engine (writer) and the
 * detection engine (reader).
 *
 * Passed into the detection engine at construction rather than held in a static,
 * so the heat -> detection feedback is an explicit wire.
 *
 * THREAD SAFETY:
 *   Single writer, single reader on the simulation thread. Fields are volatile so a
 *   profiler overlay may read them from another thread; composition is not atomic.
 */
public final class DetectionDials {

    private volatile float patrolFrequency = 1f;
    private volatile float sensitivity = 1f;

    /** Current patrol frequency multiplier. 1.0 = baseline. */
    public float patrolFrequency() { return patrolFrequency; }

    /** Current detection sensitivity multiplier. 1.0 = baseline. */
    public float sensitivity() { return sensitivity; }

    /**
     * Multiplies the patrol frequency dial. Result floored at MIN_DIAL_MULTIPLIER.
     * Non-finite or non-positive multipliers are ignored.
     *
     * @return the new dial value
     */
    public float multiplyPatrolFrequency(float multiplier) {
        if (!isUsable(multiplier)) {
            return patrolFrequency;
        }
        patrolFrequency = Math.max(HustleConstants.MIN_DIAL_MULTIPLIER, patrolFrequency * multiplier);
        return patrolFrequency;
    }

    /**
     * Multiplies the sensitivity dial. Result floored at MIN_DIAL_MULTIPLIER.
     * Non-finite or non-positive multipliers are ignored.
     *
     * @return the new dial value
     */
    public float multiplySensitivity(float multiplier) {
        if (!isUsable(multiplier)) {
            return sensitivity;
        }
        sensitivity = Math.max(HustleConstants.MIN_DIAL_MULTIPLIER, sensitivity * multiplier);
        return sensitivity;
    }

    /** Restores dial values from saved state. Values are floored at MIN_DIAL_MULTIPLIER. */
    public void restore(float patrolFrequency, float sensitivity) {
        this.patrolFrequency = Math.max(HustleConstants.MIN_DIAL_MULTIPLIER, patrolFrequency);
        this.sensitivity = Math.max(HustleConstants.MIN_DIAL_MULTIPLIER, sensitivity);
    }

    private static boolean isUsable(float multiplier) {
        return multiplier > 0f && !Float.isInfinite(multiplier);
    }

    @Override
    public String toString() {
        return "DetectionDials{patrol=" + patrolFrequency + ", sensitivity=" + sensitivity + "}";
    }
}
