package io.hustle.sim.api;

/**
 * Escalations opened when heat crosses a threshold.
 */
public enum InvestigationType {

    /** Heat 50. More patrols, sharper eyes. */
    SURVEILLANCE,

    /** Heat 70 with a poor legitimate-income ratio. Freezes part of the balance for a month. */
    AUDIT,

    /** Heat 90 with evidence on file. Halves heat as a shock reset. */
    RAID,

    /** Heat 90 without evidence. Doubles patrols until resolved externally. */
    ARREST_WARRANT
}
