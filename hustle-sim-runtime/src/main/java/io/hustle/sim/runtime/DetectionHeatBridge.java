package io.hustle.sim.runtime;

import io.hustle.sim.api.SimulationEvent;
import io.hustle.sim.api.SimulationListener;
import io.hustle.sim.escalation.HeatEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns caught activities into heat.
 *
 * An ActivityCaught for the tracked actor adds severity * heatPerSeverity heat,
 * attributed to the activity's risk tag. Activities of other owners are ignored.
 */
public final class DetectionHeatBridge implements SimulationListener {

    private static final Logger log = LogManager.getLogger(DetectionHeatBridge.class);

    private final HeatEngine heat;
    private final float heatPerSeverity;

    public DetectionHeatBridge(HeatEngine heat, float heatPerSeverity) {
        if (heat == null) {
            throw new NullPointerException("heat");
        }
        this.heat = heat;
        this.heatPerSeverity = heatPerSeverity;
    }

    @Override
    public void onEvent(SimulationEvent event) {
        if (!(event instanceof SimulationEvent.ActivityCaught)) {
            return;
        }
        SimulationEvent.ActivityCaught caught = (SimulationEvent.ActivityCaught) event;
        if (!heat.actorId().equals(caught.ownerId())) {
            return;
        }
        float amount = caught.detection().severity() * heatPerSeverity;
        if (amount <= 0f) {
            return;
        }
        log.debug("{} caught on {}: +{} heat", caught.ownerId(), caught.activityId(), amount);
        heat.addHeat(amount, caught.detection().riskTag());
    }
}
