package io.hustle.sim.runtime;

import io.hustle.sim.api.GameClock;
import io.hustle.sim.api.GameTime;
import io.hustle.sim.core.ActivityEngine;
import io.hustle.sim.escalation.HeatEngine;
import io.hustle.sim.simulation.DetectionEngine;

/**
 * Fixed-order step function driving the three engines.
 *
 * STEP ORDER:
 *   1. advance the game clock by delta * time scale
 *   2. detection patrols
 *   3. activities (detection queries; caught activities feed heat through the bus)
 *   4. heat decay, modifier expiry, audit deadlines
 * A detection raised in step 3 is already reflected in heat when step 4 runs.
 *
 * Not thread-safe. The host calls step() from its simulation thread.
 */
public final class SimulationLoop {

    private final GameClock clock;
    private final DetectionEngine detection;
    private final ActivityEngine activities;
    private final HeatEngine heat;
    private final double gameMinutesPerSecond;

    private long stepCount = 0L;

    public SimulationLoop(GameClock clock, DetectionEngine detection, ActivityEngine activities,
                          HeatEngine heat, double gameMinutesPerSecond) {
        if (clock == null) throw new NullPointerException("clock");
        if (detection == null) throw new NullPointerException("detection");
        if (activities == null) throw new NullPointerException("activities");
        if (heat == null) throw new NullPointerException("heat");
        this.clock = clock;
        this.detection = detection;
        this.activities = activities;
        this.heat = heat;
        this.gameMinutesPerSecond = gameMinutesPerSecond;
    }

    /**
     * Advances the simulation by {@code deltaSeconds} of real time.
     * Non-positive or non-finite deltas are ignored.
     */
    public void step(float deltaSeconds) {
        if (!(deltaSeconds > 0f) || Float.isInfinite(deltaSeconds)) {
            return;
        }
        double gameMinutes = deltaSeconds * gameMinutesPerSecond;
        clock.advance(gameMinutes);
        detection.tick(deltaSeconds);
        activities.tick(deltaSeconds);
        heat.tick(gameMinutes / GameTime.MINUTES_PER_HOUR);
        stepCount++;
    }

    public long stepCount() {
        return stepCount;
    }
}
