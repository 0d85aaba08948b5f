package io.hustle.sim.api;

/**
 * Lifecycle states for an activity.
 *
 * Valid transitions:
 *   ACTIVE   -> PAUSED     (pause, or displaced by an incompatible new activity)
 *   PAUSED   -> RUNNING    (resume)
 *   RUNNING  -> PAUSED
 *   ACTIVE | RUNNING | PAUSED -> COMPLETED (end, or duration elapsed)
 *   ACTIVE | RUNNING | PAUSED -> FAILED    (fail)
 *
 * COMPLETED and FAILED are terminal. The activity leaves the engine's live map
 * in the same call that sets them.
 */
public enum ActivityState {

    /** Freshly created and ticking. */
    ACTIVE,

    /** Resumed after a pause and ticking. */
    RUNNING,

    /** Not ticking. Keeps elapsed time and performance. */
    PAUSED,

    FAILED,

    COMPLETED;

    /** True for states that advance on tick. */
    public boolean isTicking() {
        return this == ACTIVE || this == RUNNING;
    }
}
