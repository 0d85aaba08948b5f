package io.hustle.sim.api;

/**
 * Subscriber for engine notifications.
 *
 * Called on the simulation thread after the raising operation has completed.
 * Implementations may call back into the engines; events raised by such calls
 * are delivered after the current event, in order.
 */
@FunctionalInterface
public interface SimulationListener {

    void onEvent(SimulationEvent event);
}
