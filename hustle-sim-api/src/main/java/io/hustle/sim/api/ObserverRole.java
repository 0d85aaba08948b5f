package io.hustle.sim.api;

/**
 * Role of an in-world observer. Role feeds the severity of a detection, not
 * whether it happens - that is decided by what the observer cares about.
 */
public enum ObserverRole {
    BOSS,
    COP,
    COWORKER,
    SECURITY,
    CIVILIAN;

    /** Roles whose witness of an illegal act carries extra severity. */
    public boolean isLawEnforcement() {
        return this == COP;
    }

    /** Roles whose notice of slacking carries extra severity. */
    public boolean isAuthority() {
        return this == BOSS;
    }
}
