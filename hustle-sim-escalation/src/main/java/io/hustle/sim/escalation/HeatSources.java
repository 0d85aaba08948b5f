package io.hustle.sim.escalation;

/**
 * Well-known heat causes. Any string is a valid cause; these are the ones the
 * engine itself attributes heat to.
 */
public final class HeatSources {

    private HeatSources() {}

    public static final String DRUG_DEALING = "drug_dealing";
    public static final String FLASHY_PURCHASE = "flashy_purchase";
    public static final String ARREST = "recent_arrest";
    public static final String CASH_DEPOSIT = "cash_deposit";
    public static final String SUSPICIOUS_INCOME = "suspicious_income";
    public static final String REPEAT_OFFENDER = "repeat_offender";

    /** Cause recorded when the caller gives none. */
    public static final String UNKNOWN = "unknown";
}
