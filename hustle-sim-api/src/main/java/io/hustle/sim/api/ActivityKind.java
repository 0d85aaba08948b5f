package io.hustle.sim.api;

/**
 * What an activity occupies. Two activities of the same non-passive kind cannot
 * share the actor - you cannot type on two screens or be in two places at once.
 */
public enum ActivityKind {

    /** Uses the body - cleaning or dealing on a corner. */
    PHYSICAL,

    /** Uses the eyes and hands on a device - office work or streaming. */
    SCREEN,

    /** Runs in the background - waiting on a delivery, a slow cook. */
    PASSIVE
}
