package io.hustle.sim.api;

/**
 * Sealed hierarchy of notifications raised by the engines.
 *
 * Events are queued on the {@link SimulationEventBus} while an engine mutates its
 * state and delivered once the mutating call has finished, so a listener never
 * observes an engine half-way through an update and may safely call back into it.
 *
 * The presentation layer subscribes for banners and HUD updates; the runtime
 * subscribes to route detections into heat.
 */
public sealed interface SimulationEvent
    permits SimulationEvent.ActivityStarted,
            SimulationEvent.ActivityPaused,
            SimulationEvent.ActivityResumed,
            SimulationEvent.ActivityEnded,
            SimulationEvent.MultitaskAttempted,
            SimulationEvent.ActivityPhaseChanged,
            SimulationEvent.ActivityCaught,
            SimulationEvent.ActorDetected,
            SimulationEvent.DetectionRiskSampled,
            SimulationEvent.ObserverPatrolled,
            SimulationEvent.HeatIncreased,
            SimulationEvent.HeatDecreased,
            SimulationEvent.HeatCleared,
            SimulationEvent.HeatThresholdCrossed,
            SimulationEvent.InvestigationTriggered,
            SimulationEvent.AuditResolved,
            SimulationEvent.WarrantCleared {

    // -- Activity lifecycle ---------------------------------------------------

    record ActivityStarted(
        String activityId,
        String ownerId,
        ActivityKind kind,
        String riskTag
    ) implements SimulationEvent {}

    record ActivityPaused(String activityId) implements SimulationEvent {}

    record ActivityResumed(String activityId) implements SimulationEvent {}

    /** Raised once per activity, by end(), fail() or duration expiry. */
    record ActivityEnded(ActivityResult result) implements SimulationEvent {}

    /**
     * A new activity was started while another one was live.
     * When {@code compatible} is false the existing activity has been paused.
     */
    record MultitaskAttempted(
        String newActivityId,
        String existingActivityId,
        boolean compatible
    ) implements SimulationEvent {}

    record ActivityPhaseChanged(
        String activityId,
        int phaseIndex,
        String phaseName
    ) implements SimulationEvent {}

    /** A risk-bearing activity was noticed. Raised at most once per activity. */
    record ActivityCaught(
        String activityId,
        String ownerId,
        DetectionResult detection
    ) implements SimulationEvent {}

    // -- Detection ------------------------------------------------------------

    record ActorDetected(
        String actorId,
        DetectionResult detection
    ) implements SimulationEvent {}

    record DetectionRiskSampled(
        String actorId,
        String locationId,
        float risk
    ) implements SimulationEvent {}

    record ObserverPatrolled(
        String observerId,
        int waypointIndex,
        Vec3 position
    ) implements SimulationEvent {}

    // -- Heat -----------------------------------------------------------------

    record HeatIncreased(
        String actorId,
        float amount,
        String cause,
        float level
    ) implements SimulationEvent {}

    record HeatDecreased(
        String actorId,
        float amount,
        float level
    ) implements SimulationEvent {}

    record HeatCleared(String actorId) implements SimulationEvent {}

    record HeatThresholdCrossed(
        String actorId,
        float threshold
    ) implements SimulationEvent {}

    record InvestigationTriggered(
        String actorId,
        InvestigationType type
    ) implements SimulationEvent {}

    /**
     * An audit reached its deadline.
     * {@code fine} is 0 when the audit came back clean.
     */
    record AuditResolved(
        String actorId,
        boolean clean,
        float fine
    ) implements SimulationEvent {}

    record WarrantCleared(String actorId) implements SimulationEvent {}
}
