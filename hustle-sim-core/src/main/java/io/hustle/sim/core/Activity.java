package io.hustle.sim.core;

import io.hustle.sim.api.ActivityKind;
import io.hustle.sim.api.ActivityPhase;
import io.hustle.sim.api.ActivityState;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.MultitaskingLevel;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A live activity owned by the {@link ActivityEngine}.
 *
 * Game code reads activities through the public getters. All mutation goes through
 * the engine; the mutators here are package-private.
 *
 * THREAD SAFETY:
 *   Not thread-safe. Owned by the simulation thread.
 */
public final class Activity {

    private final String id;
    private final long sequence;
    private final String ownerId;
    private final ActivityKind kind;
    private final String riskTag;
    private final float durationSeconds;
    private final boolean riskBearing;

    private ActivityState state = ActivityState.ACTIVE;
    private MultitaskingLevel multitaskingLevel;
    private float requiredAttention;
    private float elapsedSeconds = 0f;
    private float performanceScore = HustleConstants.INITIAL_PERFORMANCE;
    private boolean detected = false;

    private List<ActivityPhase> phases = List.of();
    private int currentPhaseIndex = 0;
    private float phaseElapsedSeconds = 0f;

    /** Ids of live activities this one was accepted alongside. Insertion-ordered. */
    private final Set<String> concurrentWith = new LinkedHashSet<>();

    Activity(String id, long sequence, ActivityDef def) {
        this.id = id;
        this.sequence = sequence;
        this.ownerId = def.ownerId();
        this.kind = def.kind();
        this.riskTag = def.riskTag();
        this.durationSeconds = def.durationSeconds();
        this.riskBearing = def.riskBearing();
        this.multitaskingLevel = def.multitaskingLevel();
        this.requiredAttention = def.requiredAttention();
        if (!def.phases().isEmpty()) {
            setPhases(def.phases());
        }
    }

    // -- Read API -------------------------------------------------------------

    public String id() { return id; }

    /** Creation order. Higher is newer. */
    public long sequence() { return sequence; }

    public String ownerId() { return ownerId; }
    public ActivityKind kind() { return kind; }
    public String riskTag() { return riskTag; }
    public float durationSeconds() { return durationSeconds; }
    public boolean riskBearing() { return riskBearing; }
    public ActivityState state() { return state; }
    public MultitaskingLevel multitaskingLevel() { return multitaskingLevel; }
    public float requiredAttention() { return requiredAttention; }
    public float elapsedSeconds() { return elapsedSeconds; }

    /** Performance score [0..100]. */
    public float performanceScore() { return performanceScore; }

    /** True once the activity has been caught. Never resets. */
    public boolean detected() { return detected; }

    public List<ActivityPhase> phases() { return phases; }

    /** Index into phases(). 0 when unphased. */
    public int currentPhaseIndex() { return currentPhaseIndex; }

    /** Current phase, or null when unphased. */
    public ActivityPhase currentPhase() {
        return phases.isEmpty() ? null : phases.get(currentPhaseIndex);
    }

    /** Unmodifiable view. */
    public Set<String> concurrentWith() {
        return Collections.unmodifiableSet(concurrentWith);
    }

    // -- Engine mutators ------------------------------------------------------

    void setState(ActivityState state) { this.state = state; }

    void addElapsed(float deltaSeconds) { this.elapsedSeconds += deltaSeconds; }

    void setPerformanceScore(float score) {
        this.performanceScore = Math.max(0f, Math.min(HustleConstants.MAX_PERFORMANCE, score));
    }

    void markDetected() { this.detected = true; }

    void addConcurrent(String otherId) { concurrentWith.add(otherId); }

    void removeConcurrent(String otherId) { concurrentWith.remove(otherId); }

    /** Replaces the phase list, restarts at phase 0 and adopts its parameters. */
    void setPhases(List<ActivityPhase> newPhases) {
        this.phases = List.copyOf(newPhases);
        this.currentPhaseIndex = 0;
        this.phaseElapsedSeconds = 0f;
        if (!phases.isEmpty()) {
            adoptPhase(phases.get(0));
        }
    }

    /**
     * Accumulates phase time and advances at most one phase.
     * Phases cycle: after the last one the index wraps to 0.
     *
     * @return true if the phase changed
     */
    boolean advancePhase(float deltaSeconds) {
        if (phases.isEmpty()) {
            return false;
        }
        phaseElapsedSeconds += deltaSeconds;
        ActivityPhase current = phases.get(currentPhaseIndex);
        if (phaseElapsedSeconds < current.durationSeconds()) {
            return false;
        }
        phaseElapsedSeconds -= current.durationSeconds();
        currentPhaseIndex = (currentPhaseIndex + 1) % phases.size();
        adoptPhase(phases.get(currentPhaseIndex));
        return true;
    }

    private void adoptPhase(ActivityPhase phase) {
        this.multitaskingLevel = phase.multitaskingLevel();
        this.requiredAttention = phase.attention();
    }

    @Override
    public String toString() {
        return "Activity{id='" + id + "', owner='" + ownerId + "', kind=" + kind +
            ", tag='" + riskTag + "', state=" + state + ", elapsed=" + elapsedSeconds +
            "s, perf=" + performanceScore + "}";
    }
}
