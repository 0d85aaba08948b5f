package io.hustle.sim.api;

/**
 * Write side of the detection dials, as seen by the heat engine.
 *
 * Both setters are multiplicative: repeated calls compose, they do not replace.
 * Calling setPatrolFrequency(1.2f) twice leaves the dial at 1.44.
 */
public interface DetectionControl {

    /** Multiplies the global patrol frequency dial. */
    void setPatrolFrequency(float multiplier);

    /** Multiplies the global detection sensitivity dial. */
    void setDetectionSensitivity(float multiplier);
}
