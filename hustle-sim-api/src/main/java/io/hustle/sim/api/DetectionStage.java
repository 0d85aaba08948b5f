package io.hustle.sim.api;

/**
 * How far a detection check got before it was rejected.
 *
 * Constants are declared in evaluation order. A negative result reports the
 * deepest stage reached by any co-located observer, so a UI can explain
 * "they couldn't see you" versus "they saw you but didn't care".
 *
 * Do NOT reorder these constants - depth comparison uses ordinal().
 */
public enum DetectionStage {

    /** Nobody shares the actor's location. */
    NO_OBSERVER_PRESENT,

    /** Further away than the observer's vision range. */
    OUT_OF_RANGE,

    /** Geometry between observer and actor. */
    LINE_OF_SIGHT_BLOCKED,

    /** In range and visible but outside the vision cone. */
    OUTSIDE_VISION_CONE,

    /** Seen, but the observer does not care about this kind of activity. */
    NOT_OF_INTEREST,

    /** The activity has a visual profile of zero. */
    UNDETECTABLE,

    /** Observer awareness did not reach the activity's visual profile. */
    BELOW_THRESHOLD,

    /** Positive detection. */
    DETECTED;

    /** True if this stage is further along the pipeline than {@code other}. */
    public boolean isDeeperThan(DetectionStage other) {
        return ordinal() > other.ordinal();
    }
}
