package io.hustle.sim.api;

/**
 * How far an activity tolerates other activities running alongside it.
 *
 * Only NONE vetoes multitasking outright. The other levels are informational for
 * the presentation layer; compatibility is otherwise decided by kind and attention.
 */
public enum MultitaskingLevel {
    FULL,
    PARTIAL,
    /** Multitasking only during breaks - set by phases that allow it. */
    BREAKS,
    NONE
}
