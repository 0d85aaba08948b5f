package io.hustle.sim.simulation;

import io.hustle.sim.api.DetectionControl;
import io.hustle.sim.api.DetectionDials;
import io.hustle.sim.api.DetectionQuery;
import io.hustle.sim.api.DetectionReason;
import io.hustle.sim.api.DetectionResult;
import io.hustle.sim.api.DetectionStage;
import io.hustle.sim.api.HustleConstants;
import io.hustle.sim.api.LineOfSightQuery;
import io.hustle.sim.api.RiskProfile;
import io.hustle.sim.api.SimulationEvent;
import io.hustle.sim.api.SimulationEventBus;
import io.hustle.sim.api.Vec3;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides whether an actor doing something is noticed by the observers around them.
 *
 * DETECTION PIPELINE (per observer sharing the actor's location, registry order):
 *   1. distance > visionRange             -> OUT_OF_RANGE
 *   2. line of sight blocked              -> LINE_OF_SIGHT_BLOCKED
 *   3. angle to actor > cone / 2          -> OUTSIDE_VISION_CONE
 *   4. legal act and no job interest,
 *      or illegal act and no legal interest -> NOT_OF_INTEREST
 *   5. visualProfile <= 0                  -> UNDETECTABLE
 *   6. awareness * sensitivity < profile   -> BELOW_THRESHOLD
 * The first observer to pass every stage detects the actor. A negative result
 * reports the deepest stage any observer reached.
 *
 * SEVERITY:
 *   0.5 base, +0.3 for an illegal act, +0.2 if a law-enforcement observer saw an
 *   illegal act, +0.2 if an authority observer cares about job performance.
 *   Clamped to [0..1].
 *
 * PATROLS:
 *   tick() advances an internal seconds clock. An observer with waypoints steps to
 *   the next one when its timer elapses and reschedules after
 *   interval / patrolFrequency, jittered by +-10% from the injected RandomGenerator.
 *
 * THREAD SAFETY:
 *   Not thread-safe. Single simulation thread. The dials are read on every query.
 */
public final class DetectionEngine implements DetectionQuery, DetectionControl {

    private static final Logger log = LogManager.getLogger(DetectionEngine.class);

    private final DetectionDials dials;
    private final LineOfSightQuery lineOfSight;
    private final RandomGenerator random;
    private final SimulationEventBus bus;

    /** Registered observers in registration order. Re-registering keeps the slot. */
    private final Map<String, Observer> observers = new LinkedHashMap<>();
    private final Map<String, RiskProfile> riskProfiles = new HashMap<>();
    private final Map<String, ActorPose> actorPoses = new HashMap<>();

    /** Engine clock for patrol scheduling, in seconds since construction. */
    private double nowSeconds = 0.0;

    private record ActorPose(Vec3 position, String locationId) {}

    private static final ActorPose DEFAULT_POSE =
        new ActorPose(Vec3.ZERO, HustleConstants.DEFAULT_LOCATION_ID);

    // -- Construction ---------------------------------------------------------

    /**
     * @param dials       shared patrol/sensitivity dials; written by the heat engine
     * @param lineOfSight occlusion backend
     * @param random      jitter source for patrol timing; seed it for reproducible runs
     * @param bus         event bus shared with the other engines
     */
    public DetectionEngine(DetectionDials dials, LineOfSightQuery lineOfSight,
                           RandomGenerator random, SimulationEventBus bus) {
        if (dials == null) throw new NullPointerException("dials");
        if (lineOfSight == null) throw new NullPointerException("lineOfSight");
        if (random == null) throw new NullPointerException("random");
        if (bus == null) throw new NullPointerException("bus");
        this.dials = dials;
        this.lineOfSight = lineOfSight;
        this.random = random;
        this.bus = bus;
    }

    /** Open world, unseeded jitter. */
    public DetectionEngine(DetectionDials dials, SimulationEventBus bus) {
        this(dials, LineOfSightQuery.OPEN, new SplittableRandom(), bus);
    }

    // -- Observer registry ----------------------------------------------------

    /** Registers or replaces an observer. Blank ids and null definitions are ignored. */
    public void registerObserver(String observerId, ObserverDef def) {
        if (observerId == null || observerId.isBlank()) {
            log.warn("registerObserver: blank observer id ignored");
            return;
        }
        if (def == null) {
            log.warn("registerObserver: null definition for '{}' ignored", observerId);
            return;
        }
        Observer previous = observers.put(observerId, new Observer(observerId, def));
        if (previous != null) {
            log.debug("Replaced observer {}", observerId);
        }
    }

    public void unregisterObserver(String observerId) {
        if (observerId == null || observers.remove(observerId) == null) {
            log.warn("unregisterObserver: unknown observer '{}'", observerId);
        }
    }

    /** Moves an observer. A zero or null facing keeps the current facing. */
    public void updateObserverPose(String observerId, Vec3 position, Vec3 facing) {
        Observer observer = lookup(observerId, "updateObserverPose");
        if (observer == null) return;
        if (position == null) {
            log.warn("updateObserverPose: null position for '{}' ignored", observerId);
            return;
        }
        Vec3 unit = facing == null ? Vec3.ZERO : facing.normalized();
        if (unit.isZero()) {
            log.warn("updateObserverPose: zero facing for '{}', keeping {}", observerId, observer.facing());
            unit = observer.facing();
        }
        observer.setPose(position, unit);
    }

    /**
     * Installs a patrol route. The first step happens intervalSeconds from now.
     * An empty or null list clears the route.
     */
    public void setPatrolRoute(String observerId, List<Vec3> waypoints, float intervalSeconds) {
        Observer observer = lookup(observerId, "setPatrolRoute");
        if (observer == null) return;
        if (waypoints == null || waypoints.isEmpty()) {
            observer.setPatrolRoute(List.of(), 0f, 0.0);
            return;
        }
        if (!(intervalSeconds > 0f) || Float.isInfinite(intervalSeconds)) {
            log.warn("setPatrolRoute: interval {} for '{}' must be positive and finite",
                intervalSeconds, observerId);
            return;
        }
        List<Vec3> route = new ArrayList<>(waypoints.size());
        for (Vec3 w : waypoints) {
            if (w != null) route.add(w);
        }
        observer.setPatrolRoute(route, intervalSeconds, nowSeconds + intervalSeconds);
    }

    public Observer getObserver(String observerId) {
        return observerId == null ? null : observers.get(observerId);
    }

    public int observerCount() {
        return observers.size();
    }

    // -- World state ----------------------------------------------------------

    /** Records where an actor is standing and which location they are in. */
    public void setActorPose(String actorId, Vec3 position, String locationId) {
        if (actorId == null || actorId.isBlank()) {
            log.warn("setActorPose: blank actor id ignored");
            return;
        }
        Vec3 p = position != null ? position : Vec3.ZERO;
        String loc = locationId == null || locationId.isBlank()
            ? HustleConstants.DEFAULT_LOCATION_ID : locationId;
        actorPoses.put(actorId, new ActorPose(p, loc));
    }

    public Vec3 actorPosition(String actorId) {
        return pose(actorId).position();
    }

    /** Registers or replaces the legality and visibility of a risk tag. */
    public void registerRiskProfile(RiskProfile profile) {
        if (profile == null) {
            log.warn("registerRiskProfile: null profile ignored");
            return;
        }
        riskProfiles.put(profile.riskTag(), profile);
    }

    /** Registered profile, or the legal / 0.5 default for unknown tags. */
    public RiskProfile riskProfile(String riskTag) {
        RiskProfile profile = riskTag == null ? null : riskProfiles.get(riskTag);
        return profile != null ? profile : RiskProfile.defaultFor(riskTag);
    }

    public DetectionDials dials() {
        return dials;
    }

    // -- Detection ------------------------------------------------------------

    @Override
    public DetectionResult checkDetection(String actorId, String riskTag) {
        String tag = riskTag == null ? "" : riskTag;
        ActorPose pose = pose(actorId);
        RiskProfile profile = riskProfile(tag);
        float sensitivity = dials.sensitivity();

        DetectionStage deepest = DetectionStage.NO_OBSERVER_PRESENT;
        for (Observer observer : observers.values()) {
            if (!observer.locationId().equals(pose.locationId())) continue;

            DetectionStage stage = evaluate(observer, pose.position(), profile, sensitivity);
            if (stage == DetectionStage.DETECTED) {
                DetectionResult result = DetectionResult.detected(observer.id(),
                    calculateSeverity(profile, observer), tag, DetectionReason.LINE_OF_SIGHT);
                bus.post(new SimulationEvent.ActorDetected(actorId, result));
                log.debug("{} detected doing '{}' by {} at severity {}",
                    actorId, tag, observer.id(), result.severity());
                bus.flush();
                return result;
            }
            if (stage.isDeeperThan(deepest)) {
                deepest = stage;
            }
        }
        return DetectionResult.notDetected(tag, deepest);
    }

    private DetectionStage evaluate(Observer observer, Vec3 actorPosition,
                                    RiskProfile profile, float sensitivity) {
        float distance = observer.position().distanceTo(actorPosition);
        if (distance > observer.visionRange()) {
            return DetectionStage.OUT_OF_RANGE;
        }
        if (lineOfSight.raycastBlocked(observer.position(), actorPosition)) {
            return DetectionStage.LINE_OF_SIGHT_BLOCKED;
        }
        Vec3 toActor = actorPosition.minus(observer.position());
        if (!VisionMath.insideCone(observer.facing(), toActor, observer.visionConeDegrees())) {
            return DetectionStage.OUTSIDE_VISION_CONE;
        }
        if (!isInterested(observer, profile)) {
            return DetectionStage.NOT_OF_INTEREST;
        }
        if (profile.visualProfile() <= 0f) {
            return DetectionStage.UNDETECTABLE;
        }
        float awareness = VisionMath.awareness(observer.visionRange(), distance);
        return awareness * sensitivity >= profile.visualProfile()
            ? DetectionStage.DETECTED
            : DetectionStage.BELOW_THRESHOLD;
    }

    /**
     * Proximity-weighted risk of being noticed, for HUD warnings. Ignores vision
     * cones and occlusion.
     *
     * @return highest risk over interested, in-range observers at {@code locationId}, [0..1]
     */
    public float getDetectionRisk(String actorId, String riskTag, String locationId) {
        String loc = locationId == null ? HustleConstants.DEFAULT_LOCATION_ID : locationId;
        Vec3 position = pose(actorId).position();
        RiskProfile profile = riskProfile(riskTag);
        float sensitivity = dials.sensitivity();

        float maxRisk = 0f;
        for (Observer observer : observers.values()) {
            if (!observer.locationId().equals(loc)) continue;
            float distance = observer.position().distanceTo(position);
            if (distance > observer.visionRange()) continue;
            if (!isInterested(observer, profile)) continue;
            maxRisk = Math.max(maxRisk, VisionMath.risk(observer.visionRange(), distance,
                profile.visualProfile(), sensitivity));
        }
        bus.post(new SimulationEvent.DetectionRiskSampled(actorId, loc, maxRisk));
        bus.flush();
        return maxRisk;
    }

    private static boolean isInterested(Observer observer, RiskProfile profile) {
        return profile.legal() ? observer.caresAboutJobPerformance() : observer.caresAboutLegality();
    }

    /** Severity of being caught doing {@code profile} by {@code observer}, [0..1]. */
    public static float calculateSeverity(RiskProfile profile, Observer observer) {
        float severity = HustleConstants.SEVERITY_BASE;
        if (!profile.legal()) {
            severity += HustleConstants.SEVERITY_ILLEGAL_BONUS;
            if (observer.role().isLawEnforcement()) {
                severity += HustleConstants.SEVERITY_LAW_ENFORCEMENT_BONUS;
            }
        }
        if (observer.role().isAuthority() && observer.caresAboutJobPerformance()) {
            severity += HustleConstants.SEVERITY_AUTHORITY_BONUS;
        }
        return Math.max(0f, Math.min(1f, severity));
    }

    // -- Dials ----------------------------------------------------------------

    @Override
    public void setPatrolFrequency(float multiplier) {
        float value = dials.multiplyPatrolFrequency(multiplier);
        log.debug("Patrol frequency x{} -> {}", multiplier, value);
    }

    @Override
    public void setDetectionSensitivity(float multiplier) {
        float value = dials.multiplySensitivity(multiplier);
        log.debug("Detection sensitivity x{} -> {}", multiplier, value);
    }

    // -- Tick -----------------------------------------------------------------

    /** Advances the patrol clock. Non-positive or non-finite deltas are ignored. */
    public void tick(float deltaSeconds) {
        if (!(deltaSeconds > 0f) || Float.isInfinite(deltaSeconds)) {
            return;
        }
        nowSeconds += deltaSeconds;
        for (Observer observer : observers.values()) {
            if (!observer.patrols() || nowSeconds < observer.nextPatrolTime()) continue;
            observer.stepPatrol(nowSeconds + nextPatrolDelay(observer.patrolIntervalSeconds()));
            bus.post(new SimulationEvent.ObserverPatrolled(observer.id(),
                observer.currentWaypointIndex(), observer.position()));
        }
        bus.flush();
    }

    /** Engine clock in seconds. */
    public double nowSeconds() {
        return nowSeconds;
    }

    private double nextPatrolDelay(float baseInterval) {
        double interval = baseInterval / dials.patrolFrequency();
        double variance = interval * HustleConstants.PATROL_JITTER_FRACTION;
        if (variance <= 0.0) {
            return interval;
        }
        return interval + random.nextDouble(-variance, variance);
    }

    // -- Internal -------------------------------------------------------------

    private ActorPose pose(String actorId) {
        ActorPose pose = actorId == null ? null : actorPoses.get(actorId);
        return pose != null ? pose : DEFAULT_POSE;
    }

    private Observer lookup(String observerId, String operation) {
        Observer observer = getObserver(observerId);
        if (observer == null) {
            log.warn("{}: unknown observer '{}'", operation, observerId);
        }
        return observer;
    }
}
