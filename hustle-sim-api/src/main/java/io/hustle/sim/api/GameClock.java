package io.hustle.sim.api;

/**
 * Monotonic in-game clock consumed by the engines.
 *
 * The clock is owned by whatever drives the game calendar (sleep, fast travel,
 * the per-frame time scale). Engines only read it, except the runtime loop which
 * advances it once per simulation step.
 */
public interface GameClock {

    /** Current in-game instant. Never moves backwards. */
    GameTime now();

    /**
     * Advances the calendar.
     *
     * @param gameMinutes minutes to advance; non-positive values are ignored
     */
    void advance(double gameMinutes);
}
