package io.hustle.sim.api;

/**
 * The parts of the economy the heat engine needs for audits.
 *
 * Transactions and income history stay in the ledger itself, outside
 * this library.
 */
public interface EconomyLedger {

    /**
     * Share of the actor's income that comes from legitimate sources.
     *
     * @return ratio in [0..1]
     */
    float legitimacyRatio(String actorId);

    /** Current balance of the actor. */
    float balance(String actorId);

    /** Freezes {@code amount} of the actor's balance until unfrozen. */
    void freeze(String actorId, float amount);

    /** Releases a previous freeze of {@code amount}. */
    void unfreeze(String actorId, float amount);

    /** Deducts a fine from the actor's balance. */
    void fine(String actorId, float amount);
}
