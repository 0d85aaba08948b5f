package io.hustle.sim.api;

/**
 * An instant on the in-game calendar, measured in fractional minutes since the game epoch.
 *
 * All heat decay, modifier expiry and audit deadlines are expressed in GameTime so
 * they stay deterministic no matter how often or how irregularly the simulation ticks.
 *
 * IMMUTABLE: arithmetic returns new instances.
 */
public final class GameTime implements Comparable<GameTime> {

    public static final double MINUTES_PER_HOUR = 60.0;
    public static final double MINUTES_PER_DAY = 24.0 * MINUTES_PER_HOUR;

    /** The game epoch - day 0, 00:00. */
    public static final GameTime EPOCH = new GameTime(0.0);

    private final double minutes;

    private GameTime(double minutes) {
        this.minutes = minutes;
    }

    public static GameTime ofMinutes(double minutes) {
        if (Double.isNaN(minutes) || Double.isInfinite(minutes)) {
            throw new IllegalArgumentException("minutes must be finite; got " + minutes);
        }
        return new GameTime(minutes);
    }

    public static GameTime ofHours(double hours) {
        return ofMinutes(hours * MINUTES_PER_HOUR);
    }

    public static GameTime ofDays(double days) {
        return ofMinutes(days * MINUTES_PER_DAY);
    }

    /** Minutes since the game epoch. */
    public double minutes() { return minutes; }

    public double hours() { return minutes / MINUTES_PER_HOUR; }

    public double days() { return minutes / MINUTES_PER_DAY; }

    public GameTime plusMinutes(double delta) {
        return ofMinutes(minutes + delta);
    }

    public GameTime plusHours(double delta) {
        return plusMinutes(delta * MINUTES_PER_HOUR);
    }

    public GameTime plusDays(double delta) {
        return plusMinutes(delta * MINUTES_PER_DAY);
    }

    /** Hours from {@code earlier} to this instant. Negative if {@code earlier} is later. */
    public double hoursSince(GameTime earlier) {
        return (minutes - earlier.minutes) / MINUTES_PER_HOUR;
    }

    /** Days from {@code earlier} to this instant. Negative if {@code earlier} is later. */
    public double daysSince(GameTime earlier) {
        return (minutes - earlier.minutes) / MINUTES_PER_DAY;
    }

    public boolean isBefore(GameTime other) {
        return minutes < other.minutes;
    }

    public boolean isAtOrAfter(GameTime other) {
        return minutes >= other.minutes;
    }

    @Override
    public int compareTo(GameTime other) {
        return Double.compare(minutes, other.minutes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameTime)) return false;
        return Double.compare(minutes, ((GameTime) o).minutes) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(minutes);
    }

    @Override
    public String toString() {
        long whole = (long) Math.floor(minutes);
        long day = Math.floorDiv(whole, (long) MINUTES_PER_DAY);
        long minuteOfDay = Math.floorMod(whole, (long) MINUTES_PER_DAY);
        return String.format("day %d %02d:%02d", day, minuteOfDay / 60, minuteOfDay % 60);
    }
}
