package io.hustle.sim.core;

import io.hustle.sim.api.GameClock;
import io.hustle.sim.api.GameTime;

/**
 * In-game clock advanced explicitly by its owner.
 *
 * The runtime loop advances it once per step from real elapsed time and the
 * configured time scale; sleep and fast travel advance it in larger jumps.
 * Tests drive it directly, which makes every decay and deadline deterministic.
 */
public final class ManualGameClock implements GameClock {

    private GameTime now;

    /** Clock starting at the game epoch. */
    public ManualGameClock() {
        this(GameTime.EPOCH);
    }

    public ManualGameClock(GameTime start) {
        if (start == null) {
            throw new NullPointerException("start");
        }
        this.now = start;
    }

    @Override
    public GameTime now() {
        return now;
    }

    @Override
    public void advance(double gameMinutes) {
        if (!(gameMinutes > 0.0) || Double.isInfinite(gameMinutes)) {
            return;
        }
        now = now.plusMinutes(gameMinutes);
    }

    /** Convenience for heat-scale jumps. */
    public void advanceHours(double gameHours) {
        advance(gameHours * GameTime.MINUTES_PER_HOUR);
    }

    /** Convenience for heat-scale jumps. */
    public void advanceDays(double gameDays) {
        advance(gameDays * GameTime.MINUTES_PER_DAY);
    }

    /**
     * Moves the clock to {@code time}. Restoring a save is the only legitimate
     * reason to move backwards.
     */
    public void set(GameTime time) {
        if (time == null) {
            throw new NullPointerException("time");
        }
        this.now = time;
    }
}
