package io.hustle.sim.runtime;

import io.hustle.sim.api.DetectionDials;
import io.hustle.sim.api.EconomyLedger;
import io.hustle.sim.api.EvidenceSource;
import io.hustle.sim.api.GameClock;
import io.hustle.sim.api.LineOfSightQuery;
import io.hustle.sim.api.SimulationEventBus;
import io.hustle.sim.api.SimulationListener;
import io.hustle.sim.core.ActivityEngine;
import io.hustle.sim.core.ManualGameClock;
import io.hustle.sim.escalation.HeatEngine;
import io.hustle.sim.simulation.DetectionEngine;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fully wired activity / detection / heat simulation for one actor.
 *
 * WIRING:
 *   DetectionEngine  reads the shared DetectionDials
 *   ActivityEngine   queries DetectionEngine for risk-bearing activities
 *   HeatEngine       writes the dials through DetectionEngine's DetectionControl
 *   bridge           routes ActivityCaught into HeatEngine.addHeat
 * All engines share one SimulationEventBus. Nothing is static; two instances are
 * fully independent.
 */
public final class HustleSimulation {

    private static final Logger log = LogManager.getLogger(HustleSimulation.class);

    private final SimulationConfig config;
    private final GameClock clock;
    private final DetectionDials dials;
    private final SimulationEventBus bus;
    private final DetectionEngine detection;
    private final ActivityEngine activities;
    private final HeatEngine heat;
    private final SimulationLoop loop;

    private HustleSimulation(Builder b) {
        this.config = b.config;
        this.clock = b.clock != null ? b.clock : new ManualGameClock();
        this.dials = new DetectionDials();
        this.bus = new SimulationEventBus();

        RandomGenerator random = b.random != null ? b.random
            : config.seed() != null ? new SplittableRandom(config.seed()) : new SplittableRandom();

        this.detection = new DetectionEngine(dials, b.lineOfSight, random, bus);
        this.activities = new ActivityEngine(detection, bus);
        this.heat = new HeatEngine(config.actorId(), clock, detection, b.ledger, b.evidence, bus);
        this.bus.addListener(new DetectionHeatBridge(heat, config.heatPerSeverity()));
        this.loop = new SimulationLoop(clock, detection, activities, heat, config.gameMinutesPerSecond());
        log.info("Simulation ready: {}", config);
    }

    /** Advances every engine by {@code deltaSeconds} of real time. */
    public void step(float deltaSeconds) {
        loop.step(deltaSeconds);
    }

    public void addListener(SimulationListener listener) {
        bus.addListener(listener);
    }

    public void removeListener(SimulationListener listener) {
        bus.removeListener(listener);
    }

    public SimulationConfig config() { return config; }
    public GameClock clock() { return clock; }
    public DetectionDials dials() { return dials; }
    public SimulationEventBus bus() { return bus; }
    public DetectionEngine detection() { return detection; }
    public ActivityEngine activities() { return activities; }
    public HeatEngine heat() { return heat; }
    public SimulationLoop loop() { return loop; }

    public static Builder builder(EconomyLedger ledger) {
        return new Builder(ledger);
    }

    public static final class Builder {

        private final EconomyLedger ledger;
        private SimulationConfig config = SimulationConfig.defaults();
        private GameClock clock;
        private LineOfSightQuery lineOfSight = LineOfSightQuery.OPEN;
        private EvidenceSource evidence = EvidenceSource.NONE;
        private RandomGenerator random;

        private Builder(EconomyLedger ledger) {
            if (ledger == null) {
                throw new NullPointerException("ledger");
            }
            this.ledger = ledger;
        }

        public Builder config(SimulationConfig config) {
            if (config == null) throw new NullPointerException("config");
            this.config = config;
            return this;
        }

        /** Defaults to a ManualGameClock at the epoch. */
        public Builder clock(GameClock clock) {
            if (clock == null) throw new NullPointerException("clock");
            this.clock = clock;
            return this;
        }

        public Builder lineOfSight(LineOfSightQuery lineOfSight) {
            if (lineOfSight == null) throw new NullPointerException("lineOfSight");
            this.lineOfSight = lineOfSight;
            return this;
        }

        public Builder evidence(EvidenceSource evidence) {
            if (evidence == null) throw new NullPointerException("evidence");
            this.evidence = evidence;
            return this;
        }

        /** Overrides the jitter source built from the config seed. */
        public Builder random(RandomGenerator random) {
            if (random == null) throw new NullPointerException("random");
            this.random = random;
            return this;
        }

        public HustleSimulation build() {
            return new HustleSimulation(this);
        }
    }
}
