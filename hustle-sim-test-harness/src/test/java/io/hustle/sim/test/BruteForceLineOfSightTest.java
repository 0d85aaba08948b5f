package io.hustle.sim.test;

import io.hustle.sim.api.DetectionDials;
import io.hustle.sim.api.DetectionStage;
import io.hustle.sim.api.ObserverRole;
import io.hustle.sim.api.RiskProfile;
import io.hustle.sim.api.SimulationEventBus;
import io.hustle.sim.api.Vec3;
import io.hustle.sim.simulation.BruteForceLineOfSight;
import io.hustle.sim.simulation.DetectionEngine;
import io.hustle.sim.simulation.ObserverDef;
import io.hustle.sim.simulation.OccluderTriangle;
import io.hustle.sim.simulation.OccluderWorld;
import java.util.SplittableRandom;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BruteForceLineOfSightTest {

    /** 10 x 10 wall in the z = 2 plane, centred on the z axis. */
    private static OccluderWorld wall() {
        return OccluderWorld.builder()
            .addWall(Vec3.of(-5f, -5f, 2f), Vec3.of(5f, 5f, 2f))
            .build();
    }

    @Test
    void emptyWorldNeverBlocks() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(OccluderWorld.EMPTY);
        assertThat(los.raycastBlocked(Vec3.ZERO, Vec3.of(0f, 0f, 10f))).isFalse();
    }

    @Test
    void wallBetweenBlocks() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 0f), Vec3.of(1f, -2f, 4f))).isTrue();
    }

    @Test
    void wallBehindTargetDoesNotBlock() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 0f), Vec3.of(1f, -2f, 1.5f))).isFalse();
    }

    @Test
    void targetLeaningOnWallIsVisible() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 0f), Vec3.of(1f, -2f, 2f))).isFalse();
    }

    @Test
    void rayPassingBesideWallIsOpen() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 0f), Vec3.of(20f, -2f, 4f))).isFalse();
    }

    @Test
    void wallBlocksFromEitherSide() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 4f), Vec3.of(1f, -2f, 0f))).isTrue();
    }

    @Test
    void boxBlocks() {
        OccluderWorld world = OccluderWorld.builder()
            .addBox(Vec3.of(-1f, -1f, 4f), Vec3.of(1f, 1f, 5f))
            .build();
        assertThat(world.triangleCount()).isEqualTo(12);

        BruteForceLineOfSight los = new BruteForceLineOfSight(world);
        assertThat(los.raycastBlocked(Vec3.of(0.3f, -0.4f, 0f), Vec3.of(0.3f, -0.4f, 10f))).isTrue();
        assertThat(los.raycastBlocked(Vec3.of(3f, 0f, 0f), Vec3.of(3f, 0f, 10f))).isFalse();
    }

    @Test
    void coincidentPointsAreNotBlocked() {
        BruteForceLineOfSight los = new BruteForceLineOfSight(wall());
        assertThat(los.raycastBlocked(Vec3.of(1f, -2f, 2f), Vec3.of(1f, -2f, 2f))).isFalse();
    }

    @Test
    void nonFiniteVertexRejected() {
        assertThatThrownBy(() -> new OccluderTriangle(0f, 0f, 0f, Float.NaN, 0f, 0f, 0f, 1f, 0f))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void skewedWallCornersRejected() {
        assertThatThrownBy(() -> OccluderWorld.builder().addWall(Vec3.ZERO, Vec3.of(1f, 1f, 1f)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectionEngineUsesOccluders() {
        DetectionEngine engine = new DetectionEngine(new DetectionDials(),
            new BruteForceLineOfSight(wall()), new SplittableRandom(1L), new SimulationEventBus());
        engine.registerRiskProfile(new RiskProfile("mugging", false, 0.5f));
        engine.registerObserver("cop", ObserverDef.builder(ObserverRole.COP)
            .position(1f, -2f, 0f)
            .caresAboutLegality(true)
            .build());
        engine.setActorPose("player", Vec3.of(1f, -2f, 4f), null);

        assertThat(engine.checkDetection("player", "mugging").stage())
            .isEqualTo(DetectionStage.LINE_OF_SIGHT_BLOCKED);

        engine.setActorPose("player", Vec3.of(1f, -2f, 1.5f), null);
        assertThat(engine.checkDetection("player", "mugging").detected()).isTrue();
    }
}
