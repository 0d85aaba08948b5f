package io.hustle.sim.core;

import io.hustle.sim.api.ActivityKind;
import io.hustle.sim.api.ActivityPhase;
import io.hustle.sim.api.ActivityResult;
import io.hustle.sim.api.ActivityState;
import io.hustle.sim.api.DetectionQuery;
import io.hustle.sim.api.DetectionResult;
import io.hustle.sim.api.DetectionStage;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.SimulationEvent;
import io.hustle.sim.api.SimulationEventBus;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns every live activity: creation, multitasking arbitration, per-tick progress,
 * performance tracking and detection polling.
 *
 * TICK ORDER (per ticking activity):
 *   1. elapsed += delta
 *   2. duration reached -> end, nothing else this tick
 *   3. performance EMA against the latest sample (default 50)
 *   4. risk-bearing and not yet caught -> detection query; hit -> penalty + ActivityCaught
 *   5. phase advance
 *
 * MULTITASKING:
 *   The most recently created activity always wins. A new activity pauses every
 *   live activity of the same owner that is incompatible with it; compatible ones
 *   are linked both ways. A resume is declined while a newer incompatible
 *   activity is running; otherwise it pauses the older incompatible ones.
 *
 * EVENTS:
 *   Posted to the bus during the operation and flushed when it returns.
 *   tick() holds a bus batch open so events raised by the detection backend
 *   are delivered together with the activity's own. Listeners may call back
 *   into the engine.
 *
 * THREAD SAFETY:
 *   Not thread-safe. Single simulation thread.
 */
public final class ActivityEngine {

    private static final Logger log = LogManager.getLogger(ActivityEngine.class);

    /** Used when no detection backend is wired. */
    private static final DetectionQuery NO_DETECTION =
        (actorId, riskTag) -> DetectionResult.notDetected(riskTag, DetectionStage.NO_OBSERVER_PRESENT);

    private final DetectionQuery detection;
    private final SimulationEventBus bus;

    private final AtomicLong idSequence = new AtomicLong(1L);

    /** Live activities in creation order. Ended activities are removed immediately. */
    private final Map<String, Activity> activities = new LinkedHashMap<>();

    /** Latest performance sample per activity. Consumed on read, never cleared per tick. */
    private final Map<String, Float> performanceSamples = new HashMap<>();

    /** Test hook: replaces the detection query for specific activities. */
    private final Map<String, DetectionResult> forcedOutcomes = new HashMap<>();

    // -- Construction ---------------------------------------------------------

    /**
     * @param detection detection backend; null disables detection polling
     * @param bus       event bus shared with the other engines
     */
    public ActivityEngine(DetectionQuery detection, SimulationEventBus bus) {
        if (bus == null) {
            throw new NullPointerException("bus");
        }
        this.detection = detection != null ? detection : NO_DETECTION;
        this.bus = bus;
    }

    // -- Creation -------------------------------------------------------------

    /** Starts an activity for the player with tag-derived defaults. */
    public String create(ActivityKind kind, String riskTag, float durationSeconds) {
        return create(ActivityDef.builder(kind, riskTag, durationSeconds).build());
    }

    /**
     * Starts an activity.
     *
     * @return the new activity id, unique for the lifetime of this engine
     */
    public String create(ActivityDef def) {
        if (def == null) {
            throw new NullPointerException("def");
        }
        long sequence = idSequence.getAndIncrement();
        String id = "activity-" + sequence;
        Activity activity = new Activity(id, sequence, def);

        arbitrate(activity);
        activities.put(id, activity);
        bus.post(new SimulationEvent.ActivityStarted(id, activity.ownerId(), activity.kind(),
            activity.riskTag()));
        log.debug("Started {}", activity);

        bus.flush();
        return id;
    }

    // -- Lifecycle ------------------------------------------------------------

    /** Pauses a ticking activity. Unknown ids and already-paused activities are no-ops. */
    public void pause(String activityId) {
        Activity activity = lookup(activityId, "pause");
        if (activity == null) return;
        if (activity.state().isTicking()) {
            pauseInternal(activity);
        }
        bus.flush();
    }

    /**
     * Resumes a paused activity. Stays paused if a newer incompatible activity of
     * the same owner is running; otherwise older incompatible ones are paused.
     */
    public void resume(String activityId) {
        Activity activity = lookup(activityId, "resume");
        if (activity == null) return;
        if (activity.state() == ActivityState.PAUSED) {
            Activity newer = newerConflict(activity);
            if (newer != null) {
                bus.post(new SimulationEvent.MultitaskAttempted(activityId, newer.id(), false));
                log.debug("Resume of {} declined: newer {} is running", activityId, newer.id());
            } else {
                arbitrate(activity);
                activity.setState(ActivityState.RUNNING);
                bus.post(new SimulationEvent.ActivityResumed(activityId));
            }
        }
        bus.flush();
    }

    /**
     * Ends an activity successfully.
     *
     * @return the final result; ActivityResult.failed(id) for unknown or already-ended ids
     */
    public ActivityResult end(String activityId) {
        Activity activity = lookup(activityId, "end");
        if (activity == null) {
            return ActivityResult.failed(activityId);
        }
        ActivityResult result = finish(activity, ActivityState.COMPLETED);
        bus.flush();
        return result;
    }

    /**
     * Ends an activity unsuccessfully. Performance is preserved in the result.
     *
     * @return the final result; ActivityResult.failed(id) for unknown or already-ended ids
     */
    public ActivityResult fail(String activityId) {
        Activity activity = lookup(activityId, "fail");
        if (activity == null) {
            return ActivityResult.failed(activityId);
        }
        ActivityResult result = finish(activity, ActivityState.FAILED);
        bus.flush();
        return result;
    }

    // -- Tick -----------------------------------------------------------------

    /**
     * Advances every ticking activity by {@code deltaSeconds} of real time.
     * Non-positive or non-finite deltas are ignored.
     */
    public void tick(float deltaSeconds) {
        if (!(deltaSeconds > 0f) || Float.isInfinite(deltaSeconds)) {
            return;
        }
        bus.beginBatch();
        try {
            for (Activity activity : new ArrayList<>(activities.values())) {
                if (!activity.state().isTicking()) continue;
                tickActivity(activity, deltaSeconds);
            }
        } finally {
            bus.endBatch();
        }
    }

    private void tickActivity(Activity activity, float deltaSeconds) {
        activity.addElapsed(deltaSeconds);

        if (activity.elapsedSeconds() >= activity.durationSeconds()) {
            finish(activity, ActivityState.COMPLETED);
            return;
        }

        float sample = performanceSamples.getOrDefault(activity.id(),
            HustleConstants.DEFAULT_PERFORMANCE_SAMPLE);
        float w = HustleConstants.PERFORMANCE_SAMPLE_WEIGHT;
        activity.setPerformanceScore(activity.performanceScore() * (1f - w) + sample * w);

        if (activity.riskBearing() && !activity.detected()) {
            DetectionResult result = forcedOutcomes.containsKey(activity.id())
                ? forcedOutcomes.get(activity.id())
                : detection.checkDetection(activity.ownerId(), activity.riskTag());
            if (result != null && result.detected()) {
                activity.markDetected();
                activity.setPerformanceScore(
                    activity.performanceScore() - HustleConstants.DETECTION_PERFORMANCE_PENALTY);
                bus.post(new SimulationEvent.ActivityCaught(activity.id(), activity.ownerId(), result));
                log.info("Activity {} ({}) caught by {} severity={}",
                    activity.id(), activity.riskTag(), result.observerId(), result.severity());
            }
        }

        if (activity.advancePhase(deltaSeconds)) {
            ActivityPhase phase = activity.currentPhase();
            bus.post(new SimulationEvent.ActivityPhaseChanged(activity.id(),
                activity.currentPhaseIndex(), phase.name()));
        }
    }

    // -- Queries --------------------------------------------------------------

    /** Live activity by id, or null. */
    public Activity getActivity(String activityId) {
        return activityId == null ? null : activities.get(activityId);
    }

    /** Ticking activities of {@code ownerId}, oldest first. */
    public List<Activity> getActiveActivities(String ownerId) {
        List<Activity> result = new ArrayList<>();
        for (Activity a : activities.values()) {
            if (a.ownerId().equals(ownerId) && a.state().isTicking()) {
                result.add(a);
            }
        }
        return result;
    }

    /** Performance score [0..100], or 0 for unknown ids. */
    public float getPerformance(String activityId) {
        Activity activity = getActivity(activityId);
        return activity == null ? 0f : activity.performanceScore();
    }

    /** Whether two live activities may run together. False if either is unknown. */
    public boolean canMultitask(String activityId1, String activityId2) {
        Activity a = getActivity(activityId1);
        Activity b = getActivity(activityId2);
        if (a == null || b == null) {
            return false;
        }
        return MultitaskingRules.compatible(a, b);
    }

    /** Number of live activities, paused included. */
    public int activeCount() {
        return activities.size();
    }

    // -- Inputs ---------------------------------------------------------------

    /**
     * Records the latest performance sample [0..100] for an activity, typically from
     * a minigame. The sample keeps feeding the average until replaced.
     */
    public void submitPerformanceSample(String activityId, float sample) {
        if (lookup(activityId, "submitPerformanceSample") == null) return;
        if (Float.isNaN(sample)) {
            log.warn("Ignoring NaN performance sample for {}", activityId);
            return;
        }
        performanceSamples.put(activityId,
            Math.max(0f, Math.min(HustleConstants.MAX_PERFORMANCE, sample)));
    }

    /** Replaces an activity's phases and restarts it at phase 0. */
    public void setPhases(String activityId, List<ActivityPhase> phases) {
        Activity activity = lookup(activityId, "setPhases");
        if (activity == null) return;
        activity.setPhases(phases == null ? List.of() : phases);
    }

    /**
     * Overrides the detection query for one activity, for tests and scripted scenes.
     * Pass null to restore normal polling.
     */
    public void forceDetectionOutcome(String activityId, DetectionResult outcome) {
        if (lookup(activityId, "forceDetectionOutcome") == null) return;
        if (outcome == null) {
            forcedOutcomes.remove(activityId);
        } else {
            forcedOutcomes.put(activityId, outcome);
        }
    }

    // -- Internal -------------------------------------------------------------

    private Activity lookup(String activityId, String operation) {
        Activity activity = getActivity(activityId);
        if (activity == null) {
            log.warn("{}: unknown activity '{}'", operation, activityId);
        }
        return activity;
    }

    /** First running activity of the same owner, created after {@code activity}, that conflicts with it. */
    private Activity newerConflict(Activity activity) {
        for (Activity existing : getActiveActivities(activity.ownerId())) {
            if (existing.sequence() > activity.sequence()
                && !MultitaskingRules.compatible(activity, existing)) {
                return existing;
            }
        }
        return null;
    }

    /**
     * Pauses or links every other ticking activity of the same owner. Callers
     * guarantee no newer incompatible activity is ticking.
     */
    private void arbitrate(Activity incoming) {
        for (Activity existing : getActiveActivities(incoming.ownerId())) {
            if (existing == incoming) continue;
            boolean compatible = MultitaskingRules.compatible(incoming, existing);
            bus.post(new SimulationEvent.MultitaskAttempted(incoming.id(), existing.id(), compatible));
            if (compatible) {
                incoming.addConcurrent(existing.id());
                existing.addConcurrent(incoming.id());
            } else {
                pauseInternal(existing);
            }
        }
    }

    private void pauseInternal(Activity activity) {
        activity.setState(ActivityState.PAUSED);
        bus.post(new SimulationEvent.ActivityPaused(activity.id()));
    }

    private ActivityResult finish(Activity activity, ActivityState terminal) {
        activity.setState(terminal);
        activities.remove(activity.id());
        performanceSamples.remove(activity.id());
        forcedOutcomes.remove(activity.id());
        for (String otherId : activity.concurrentWith()) {
            Activity other = activities.get(otherId);
            if (other != null) other.removeConcurrent(activity.id());
        }
        ActivityResult result = new ActivityResult(activity.id(), activity.performanceScore(),
            activity.elapsedSeconds(), terminal == ActivityState.COMPLETED, activity.detected());
        bus.post(new SimulationEvent.ActivityEnded(result));
        log.debug("{} {} perf={} elapsed={}s", terminal, activity.id(),
            activity.performanceScore(), activity.elapsedSeconds());
        return result;
    }
}
