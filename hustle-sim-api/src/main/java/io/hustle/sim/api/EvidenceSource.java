package io.hustle.sim.api;

/**
 * Answers whether incriminating evidence exists against an actor.
 *
 * Consulted when heat reaches the raid threshold: evidence turns an arrest
 * warrant into a raid.
 */
@FunctionalInterface
public interface EvidenceSource {

    /** Source for games without an evidence system. Never finds anything. */
    EvidenceSource NONE = actorId -> false;

    boolean hasIncriminatingEvidence(String actorId);
}
