package io.hustle.sim.api;

/**
 * Terminal outcome of an activity, returned exactly once by end() or fail().
 *
 * A repeated end() on the same id, or an unknown id, yields {@link #failed(String)}:
 * zero performance, zero time, not completed.
 */
public final class ActivityResult {

    private final String activityId;
    private final float performanceScore;
    private final float elapsedSeconds;
    private final boolean completed;
    private final boolean detected;

    public ActivityResult(String activityId, float performanceScore, float elapsedSeconds,
                          boolean completed, boolean detected) {
        this.activityId = activityId;
        this.performanceScore = performanceScore;
        this.elapsedSeconds = elapsedSeconds;
        this.completed = completed;
        this.detected = detected;
    }

    /** Zero-valued result for an id that is not (or no longer) live. */
    public static ActivityResult failed(String activityId) {
        return new ActivityResult(activityId, 0f, 0f, false, false);
    }

    public String activityId() { return activityId; }

    /** Final performance on the 0..100 scale. Reward input for the job/skill systems. */
    public float performanceScore() { return performanceScore; }

    /** Seconds the activity actually ticked, excluding time spent paused. */
    public float elapsedSeconds() { return elapsedSeconds; }

    /** True if the activity ended normally rather than failing or being unknown. */
    public boolean completed() { return completed; }

    /** True if the activity was caught by an observer at any point. */
    public boolean detected() { return detected; }

    @Override
    public String toString() {
        return "ActivityResult{id='" + activityId + "', performance=" + performanceScore +
            ", elapsed=" + elapsedSeconds + "s, completed=" + completed +
            ", detected=" + detected + "}";
    }
}
