package io.hustle.sim.api;

/**
 * Backend contract for line-of-sight tests against world geometry.
 *
 * Abstracts whatever spatial or physics backend the game uses. The detection
 * engine calls this once per candidate observer per query.
 */
@FunctionalInterface
public interface LineOfSightQuery {

    /** Backend for open spaces with no occluding geometry. Never blocks. */
    LineOfSightQuery OPEN = (from, to) -> false;

    /**
     * Returns true if geometry lies strictly between {@code from} and {@code to}.
     *
     * Surfaces at the target point itself (the actor's own collider) do not count
     * as blocking.
     *
     * @param from observer eye position
     * @param to   actor position
     * @return true if the segment is obstructed
     */
    boolean raycastBlocked(Vec3 from, Vec3 to);
}
