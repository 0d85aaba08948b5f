package io.hustle.sim.api;

/**
 * Outcome of one detection query. Detection is stateless - a fresh result is
 * computed per query and nothing is cached between ticks.
 *
 * IMMUTABLE.
 */
public final class DetectionResult {

    private final boolean detected;
    private final String observerId;
    private final float severity;
    private final String riskTag;
    private final DetectionReason reason;
    private final DetectionStage stage;

    private DetectionResult(boolean detected, String observerId, float severity,
                            String riskTag, DetectionReason reason, DetectionStage stage) {
        this.detected = detected;
        this.observerId = observerId;
        this.severity = severity;
        this.riskTag = riskTag;
        this.reason = reason;
        this.stage = stage;
    }

    /**
     * Positive detection.
     *
     * @param observerId id of the observer that noticed the actor
     * @param severity   [0..1]; clamped
     * @param riskTag    tag of the activity that was noticed
     * @param reason     detection channel
     */
    public static DetectionResult detected(String observerId, float severity,
                                           String riskTag, DetectionReason reason) {
        return new DetectionResult(true, observerId, Math.max(0f, Math.min(1f, severity)),
            riskTag, reason, DetectionStage.DETECTED);
    }

    /**
     * Negative result.
     *
     * @param riskTag tag of the activity that was checked
     * @param stage   deepest rejection stage reached
     */
    public static DetectionResult notDetected(String riskTag, DetectionStage stage) {
        if (stage == DetectionStage.DETECTED) {
            throw new IllegalArgumentException("a negative result cannot report DETECTED");
        }
        return new DetectionResult(false, null, 0f, riskTag, DetectionReason.NONE, stage);
    }

    public boolean detected() { return detected; }

    /** Observer that made the detection. Null on a negative result. */
    public String observerId() { return observerId; }

    /** Severity [0..1]. 0 on a negative result. */
    public float severity() { return severity; }

    public String riskTag() { return riskTag; }

    public DetectionReason reason() { return reason; }

    /** DETECTED on a hit; otherwise the deepest rejection stage. */
    public DetectionStage stage() { return stage; }

    @Override
    public String toString() {
        return detected
            ? "DetectionResult{detected by '" + observerId + "', severity=" + severity +
              ", tag='" + riskTag + "', reason=" + reason + "}"
            : "DetectionResult{not detected, tag='" + riskTag + "', stage=" + stage + "}";
    }
}
