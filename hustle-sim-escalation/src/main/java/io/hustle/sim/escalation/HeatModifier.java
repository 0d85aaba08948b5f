package io.hustle.sim.escalation;

import io.hustle.sim.api.GameTime;

/**
 * Standing heat attributed to a source: a news story, a tip-off, a criminal record.
 *
 * Timed modifiers carry an expiry; permanent ones do not. {@code applied} is the
 * heat the modifier actually added, which is less than {@code amount} when the
 * level was clamped at the maximum. Expiry takes back {@code applied}. IMMUTABLE.
 */
public final class HeatModifier {

    private final String source;
    private final float amount;
    private final float applied;
    private final GameTime expiresAt;

    private HeatModifier(String source, float amount, float applied, GameTime expiresAt) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        if (!(amount > 0f) || Float.isInfinite(amount)) {
            throw new IllegalArgumentException("amount must be > 0 and finite; got " + amount);
        }
        if (!(applied >= 0f) || applied > amount) {
            throw new IllegalArgumentException("applied must be in [0.." + amount + "]; got " + applied);
        }
        this.source = source;
        this.amount = amount;
        this.applied = applied;
        this.expiresAt = expiresAt;
    }

    public static HeatModifier timed(String source, float amount, float applied, GameTime expiresAt) {
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt must not be null for a timed modifier");
        }
        return new HeatModifier(source, amount, applied, expiresAt);
    }

    public static HeatModifier permanent(String source, float amount, float applied) {
        return new HeatModifier(source, amount, applied, null);
    }

    public String source() { return source; }

    /** Requested heat. */
    public float amount() { return amount; }

    /** Heat actually added to the level. */
    public float applied() { return applied; }

    /** Expiry instant, or null when permanent. */
    public GameTime expiresAt() { return expiresAt; }

    public boolean isPermanent() { return expiresAt == null; }

    public boolean isExpired(GameTime now) {
        return expiresAt != null && now.isAtOrAfter(expiresAt);
    }

    @Override
    public String toString() {
        return "HeatModifier{source='" + source + "', amount=" + amount + ", applied=" + applied +
            (isPermanent() ? ", permanent}" : ", expiresAt=" + expiresAt + "}");
    }
}
