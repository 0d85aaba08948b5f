package io.hustle.sim.api;

/**
 * Channel through which a detection happened.
 *
 * The sensor model produces LINE_OF_SIGHT hits. WITNESS is for scripted
 * detections reported by collaborators, such as a coworker telling the boss.
 */
public enum DetectionReason {
    LINE_OF_SIGHT,
    WITNESS,
    NONE
}
