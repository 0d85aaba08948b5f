package io.hustle.sim.test;

import io.hustle.sim.api.DetectionDials;
import io.hustle.sim.api.DetectionResult;
import io.hustle.sim.api.DetectionStage;
import io.hustle.sim.api.LineOfSightQuery;
import io.hustle.sim.api.ObserverRole;
import io.hustle.sim.api.RiskProfile;
import io.hustle.sim.api.SimulationEvent;
import io.hustle.sim.api.SimulationEventBus;
import io.hustle.sim.api.Vec3;
import io.hustle.sim.simulation.DetectionEngine;
import io.hustle.sim.simulation.Observer;
import io.hustle.sim.simulation.ObserverDef;
import java.util.List;
import java.util.SplittableRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DetectionEngineTest {

    private static final String ACTOR = "player";
    private static final String MUGGING = "mugging";
    private static final String SLACKING = "work.slacking";

    private DetectionDials dials;
    private SimulationEventBus bus;
    private RecordingListener events;
    private DetectionEngine engine;

    @BeforeEach
    void setUp() {
        dials = new DetectionDials();
        bus = new SimulationEventBus();
        events = new RecordingListener();
        bus.addListener(events);
        engine = newEngine(LineOfSightQuery.OPEN);
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 3f), "alley");
    }

    private DetectionEngine newEngine(LineOfSightQuery los) {
        DetectionEngine e = new DetectionEngine(dials, los, new SplittableRandom(42L), bus);
        e.registerRiskProfile(new RiskProfile(MUGGING, false, 0.8f));
        e.registerRiskProfile(new RiskProfile(SLACKING, true, 1.0f));
        return e;
    }

    private static ObserverDef.Builder cop() {
        return ObserverDef.builder(ObserverRole.COP)
            .location("alley")
            .visionRange(6f)
            .visionCone(120f)
            .caresAboutLegality(true);
    }

    private static ObserverDef.Builder boss() {
        return ObserverDef.builder(ObserverRole.BOSS)
            .location("alley")
            .visionRange(10f)
            .visionCone(90f)
            .caresAboutJobPerformance(true);
    }

    // -- Pipeline -------------------------------------------------------------

    @Test
    void copSeesMuggingDeadAhead() {
        engine.registerObserver("cop", cop().build());

        DetectionResult result = engine.checkDetection(ACTOR, MUGGING);

        assertThat(result.detected()).isTrue();
        assertThat(result.observerId()).isEqualTo("cop");
        assertThat(result.stage()).isEqualTo(DetectionStage.DETECTED);
        assertThat(result.riskTag()).isEqualTo(MUGGING);
        // 0.5 base + 0.3 illegal + 0.2 law enforcement
        assertThat(result.severity()).isCloseTo(1.0f, within(1e-5f));
        assertThat(events.ofType(SimulationEvent.ActorDetected.class)).hasSize(1);
    }

    @Test
    void actorBeyondRangeIsNotSeen() {
        engine.registerObserver("cop", cop().build());
        engine.setActorPose(ACTOR, Vec3.of(5f, 0f, 5f), "alley");

        DetectionResult result = engine.checkDetection(ACTOR, MUGGING);

        assertThat(result.detected()).isFalse();
        assertThat(result.stage()).isEqualTo(DetectionStage.OUT_OF_RANGE);
        assertThat(result.observerId()).isNull();
        assertThat(events.events).isEmpty();
    }

    @Test
    void actorAtExactRangeIsSeen() {
        engine.registerObserver("cop", cop().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 6f), "alley");
        assertThat(engine.checkDetection(ACTOR, MUGGING).detected()).isTrue();
    }

    @Test
    void observersElsewhereAreIgnored() {
        engine.registerObserver("cop", cop().location("precinct").build());
        DetectionResult result = engine.checkDetection(ACTOR, MUGGING);
        assertThat(result.stage()).isEqualTo(DetectionStage.NO_OBSERVER_PRESENT);
    }

    @Test
    void blockedLineOfSightRejects() {
        DetectionEngine walled = newEngine((from, to) -> true);
        walled.setActorPose(ACTOR, Vec3.of(0f, 0f, 3f), "alley");
        walled.registerObserver("cop", cop().build());

        assertThat(walled.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.LINE_OF_SIGHT_BLOCKED);
    }

    @Test
    void actorBesideObserverIsOutsideCone() {
        engine.registerObserver("cop", cop().visionCone(90f).build());
        engine.setActorPose(ACTOR, Vec3.of(3f, 0f, 0f), "alley");

        assertThat(engine.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.OUTSIDE_VISION_CONE);
    }

    @Test
    void copIgnoresSlacking() {
        engine.registerObserver("cop", cop().build());
        assertThat(engine.checkDetection(ACTOR, SLACKING).stage())
            .isEqualTo(DetectionStage.NOT_OF_INTEREST);
    }

    @Test
    void bossIgnoresCrime() {
        engine.registerObserver("boss", boss().build());
        assertThat(engine.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.NOT_OF_INTEREST);
    }

    @Test
    void invisibleActivityIsNeverSeen() {
        engine.registerRiskProfile(new RiskProfile("pickpocket", false, 0f));
        engine.registerObserver("cop", cop().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 0.5f), "alley");

        assertThat(engine.checkDetection(ACTOR, "pickpocket").stage())
            .isEqualTo(DetectionStage.UNDETECTABLE);
    }

    @Test
    void lowSensitivityFallsBelowThreshold() {
        dials.multiplySensitivity(0.1f);
        engine.registerObserver("cop", cop().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 5f), "alley");

        // awareness 6/5 = 1.2, times 0.1 = 0.12 < 0.8
        assertThat(engine.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.BELOW_THRESHOLD);
    }

    @Test
    void negativeResultReportsDeepestStage() {
        engine.registerObserver("far", cop().position(0f, 0f, -20f).build());
        engine.registerObserver("boss", boss().build());

        assertThat(engine.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.NOT_OF_INTEREST);
    }

    @Test
    void unknownTagIsLegalAndModeratelyVisible() {
        engine.registerObserver("cop", cop().build());
        assertThat(engine.checkDetection(ACTOR, "juggling").detected()).isFalse();

        engine.registerObserver("boss", boss().build());
        DetectionResult result = engine.checkDetection(ACTOR, "juggling");
        assertThat(result.detected()).isTrue();
        // 0.5 base + 0.2 authority
        assertThat(result.severity()).isCloseTo(0.7f, within(1e-5f));
    }

    @Test
    void securityGuardSeverityHasNoLawEnforcementBonus() {
        engine.registerObserver("guard", ObserverDef.builder(ObserverRole.SECURITY)
            .location("alley").caresAboutLegality(true).build());
        assertThat(engine.checkDetection(ACTOR, MUGGING).severity())
            .isCloseTo(0.8f, within(1e-5f));
    }

    @Test
    void actorWithoutPoseStandsAtDefaultLocation() {
        engine.registerObserver("boss", boss().location("default_location").build());
        DetectionResult result = engine.checkDetection("npc-3", SLACKING);
        // actor at the origin, same point as the observer
        assertThat(result.detected()).isTrue();
        assertThat(engine.actorPosition("npc-3")).isEqualTo(Vec3.ZERO);
        assertThat(engine.actorPosition(ACTOR)).isEqualTo(Vec3.of(0f, 0f, 3f));
    }

    // -- Registry order -------------------------------------------------------

    @Test
    void outcomeDoesNotDependOnRegistrationOrder() {
        ObserverDef blind = cop().position(0f, 0f, 20f).build();
        ObserverDef seeing = cop().build();

        engine.registerObserver("a", blind);
        engine.registerObserver("b", seeing);
        boolean first = engine.checkDetection(ACTOR, MUGGING).detected();

        DetectionEngine reversed = newEngine(LineOfSightQuery.OPEN);
        reversed.setActorPose(ACTOR, Vec3.of(0f, 0f, 3f), "alley");
        reversed.registerObserver("b", seeing);
        reversed.registerObserver("a", blind);
        boolean second = reversed.checkDetection(ACTOR, MUGGING).detected();

        assertThat(first).isTrue();
        assertThat(second).isTrue();
    }

    @Test
    void firstRegisteredCapableObserverIsReported() {
        engine.registerObserver("cop-1", cop().build());
        engine.registerObserver("cop-2", cop().build());
        engine.registerObserver("cop-1", cop().position(0f, 0f, 1f).build());

        assertThat(engine.observerCount()).isEqualTo(2);
        assertThat(engine.checkDetection(ACTOR, MUGGING).observerId()).isEqualTo("cop-1");
    }

    @Test
    void unregisteredObserverNoLongerSees() {
        engine.registerObserver("cop", cop().build());
        engine.unregisterObserver("cop");
        assertThat(engine.checkDetection(ACTOR, MUGGING).detected()).isFalse();
        assertThat(engine.getObserver("cop")).isNull();
    }

    @Test
    void blankIdsAreIgnored() {
        engine.registerObserver(" ", cop().build());
        engine.registerObserver(null, cop().build());
        assertThat(engine.observerCount()).isZero();
    }

    // -- Pose -----------------------------------------------------------------

    @Test
    void turningAwayLosesSight() {
        engine.registerObserver("cop", cop().build());
        engine.updateObserverPose("cop", Vec3.ZERO, Vec3.of(0f, 0f, -1f));
        assertThat(engine.checkDetection(ACTOR, MUGGING).stage())
            .isEqualTo(DetectionStage.OUTSIDE_VISION_CONE);
    }

    @Test
    void zeroFacingKeepsPreviousFacing() {
        engine.registerObserver("cop", cop().build());
        engine.updateObserverPose("cop", Vec3.of(1f, 0f, 0f), Vec3.ZERO);

        Observer cop = engine.getObserver("cop");
        assertThat(cop.position()).isEqualTo(Vec3.of(1f, 0f, 0f));
        assertThat(cop.facing()).isEqualTo(Vec3.FORWARD);
    }

    @Test
    void invalidObserverDefinitionsAreRejected() {
        assertThatThrownBy(() -> cop().visionRange(0f).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cop().visionCone(400f).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cop().facing(Vec3.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    // -- Risk -----------------------------------------------------------------

    @Test
    void riskGrowsWithProximity() {
        engine.registerObserver("boss", boss().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 5f), "alley");
        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "alley")).isCloseTo(0.5f, within(1e-5f));

        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 9f), "alley");
        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "alley")).isCloseTo(0.1f, within(1e-5f));
    }

    @Test
    void riskIsHighestAcrossObservers() {
        engine.registerObserver("boss", boss().build());
        engine.registerObserver("manager", boss().position(0f, 0f, 4f).build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 5f), "alley");

        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "alley")).isCloseTo(0.9f, within(1e-5f));
        SimulationEvent.DetectionRiskSampled sampled =
            events.ofType(SimulationEvent.DetectionRiskSampled.class).get(0);
        assertThat(sampled.locationId()).isEqualTo("alley");
    }

    @Test
    void riskIsZeroOutOfRangeOrElsewhere() {
        engine.registerObserver("boss", boss().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 15f), "alley");
        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "alley")).isZero();
        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "office")).isZero();
    }

    @Test
    void riskIgnoresTheCone() {
        engine.registerObserver("boss", boss().build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, -5f), "alley");
        assertThat(engine.getDetectionRisk(ACTOR, SLACKING, "alley")).isCloseTo(0.5f, within(1e-5f));
    }

    // -- Dials ----------------------------------------------------------------

    @Test
    void controlMultipliesSharedDials() {
        engine.setPatrolFrequency(1.5f);
        engine.setPatrolFrequency(2f);
        engine.setDetectionSensitivity(1.3f);

        assertThat(dials.patrolFrequency()).isCloseTo(3f, within(1e-5f));
        assertThat(dials.sensitivity()).isCloseTo(1.3f, within(1e-5f));
    }

    @Test
    void dialsAreFlooredAndIgnoreNonsense() {
        engine.setDetectionSensitivity(0f);
        engine.setDetectionSensitivity(-2f);
        assertThat(dials.sensitivity()).isEqualTo(1f);

        engine.setPatrolFrequency(0.0001f);
        assertThat(dials.patrolFrequency()).isEqualTo(0.01f);
    }

    @Test
    void dialsRestoreSavedValues() {
        dials.restore(2.4f, 0f);
        assertThat(dials.patrolFrequency()).isEqualTo(2.4f);
        assertThat(dials.sensitivity()).isEqualTo(0.01f);
    }

    @Test
    void heightenedSensitivityCatchesMore() {
        engine.registerRiskProfile(new RiskProfile("graffiti", false, 1.0f));
        engine.registerObserver("cop", cop().visionRange(5f).build());
        engine.setActorPose(ACTOR, Vec3.of(0f, 0f, 4.9f), "alley");
        dials.multiplySensitivity(0.5f);
        assertThat(engine.checkDetection(ACTOR, "graffiti").detected()).isFalse();

        dials.multiplySensitivity(4f);
        assertThat(engine.checkDetection(ACTOR, "graffiti").detected()).isTrue();
    }

    // -- Patrols --------------------------------------------------------------

    @Test
    void patrolStepsThroughWaypointsAndLoops() {
        engine.registerObserver("guard", cop().build());
        engine.setPatrolRoute("guard", List.of(Vec3.ZERO, Vec3.of(5f, 0f, 0f)), 10f);

        engine.tick(9.5f);
        Observer guard = engine.getObserver("guard");
        assertThat(guard.currentWaypointIndex()).isZero();

        engine.tick(0.6f);
        assertThat(guard.currentWaypointIndex()).isEqualTo(1);
        assertThat(guard.position()).isEqualTo(Vec3.of(5f, 0f, 0f));
        assertThat(guard.facing()).isEqualTo(Vec3.of(1f, 0f, 0f));

        engine.tick(12f);
        assertThat(guard.currentWaypointIndex()).isZero();
        assertThat(guard.position()).isEqualTo(Vec3.ZERO);
        assertThat(guard.facing()).isEqualTo(Vec3.of(-1f, 0f, 0f));

        assertThat(events.ofType(SimulationEvent.ObserverPatrolled.class))
            .extracting(SimulationEvent.ObserverPatrolled::waypointIndex)
            .containsExactly(1, 0);
    }

    @Test
    void patrolIntervalIsJitteredWithinTenPercent() {
        engine.registerObserver("guard", cop().build());
        engine.setPatrolRoute("guard", List.of(Vec3.ZERO, Vec3.of(5f, 0f, 0f)), 10f);
        engine.tick(10f);

        double next = engine.getObserver("guard").nextPatrolTime() - engine.nowSeconds();
        assertThat(next).isBetween(9.0, 11.0);
    }

    @Test
    void patrolFrequencyShortensTheInterval() {
        dials.multiplyPatrolFrequency(2f);
        engine.registerObserver("guard", cop().build());
        engine.setPatrolRoute("guard", List.of(Vec3.ZERO, Vec3.of(5f, 0f, 0f)), 10f);
        engine.tick(10f);

        double next = engine.getObserver("guard").nextPatrolTime() - engine.nowSeconds();
        assertThat(next).isBetween(4.5, 5.5);
    }

    @Test
    void sameSeedGivesSameSchedule() {
        DetectionEngine a = newEngine(LineOfSightQuery.OPEN);
        DetectionEngine b = newEngine(LineOfSightQuery.OPEN);
        for (DetectionEngine e : List.of(a, b)) {
            e.registerObserver("guard", cop().build());
            e.setPatrolRoute("guard", List.of(Vec3.ZERO, Vec3.of(5f, 0f, 0f)), 10f);
            e.tick(10f);
        }
        assertThat(a.getObserver("guard").nextPatrolTime())
            .isEqualTo(b.getObserver("guard").nextPatrolTime());
    }

    @Test
    void emptyRouteStopsPatrolling() {
        engine.registerObserver("guard", cop().build());
        engine.setPatrolRoute("guard", List.of(Vec3.ZERO, Vec3.of(5f, 0f, 0f)), 10f);
        engine.setPatrolRoute("guard", List.of(), 10f);
        engine.tick(20f);

        assertThat(engine.getObserver("guard").patrols()).isFalse();
        assertThat(events.count(SimulationEvent.ObserverPatrolled.class)).isZero();
    }
}
