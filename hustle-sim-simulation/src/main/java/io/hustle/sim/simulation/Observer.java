package io.hustle.sim.simulation;

import io.hustle.sim.api.ObserverRole;
import io.hustle.sim.api.Vec3;
import java.util.List;

/**
 * Runtime state of a registered observer: static vision data from its
 * {@link ObserverDef} plus the pose and patrol progress that change as it moves.
 *
 * Read-only outside the simulation package. Not thread-safe.
 */
public final class Observer {

    private final String id;
    private final ObserverDef def;

    private Vec3 position;
    private Vec3 facing;

    private List<Vec3> patrolWaypoints = List.of();
    private int currentWaypointIndex = 0;
    private float patrolIntervalSeconds = 0f;
    private double nextPatrolTime = 0.0;

    Observer(String id, ObserverDef def) {
        this.id = id;
        this.def = def;
        this.position = def.position();
        this.facing = def.facing();
    }

    public String id() { return id; }
    public ObserverRole role() { return def.role(); }
    public Vec3 position() { return position; }
    public Vec3 facing() { return facing; }
    public float visionRange() { return def.visionRange(); }
    public float visionConeDegrees() { return def.visionConeDegrees(); }
    public float audioSensitivity() { return def.audioSensitivity(); }
    public boolean caresAboutLegality() { return def.caresAboutLegality(); }
    public boolean caresAboutJobPerformance() { return def.caresAboutJobPerformance(); }
    public String locationId() { return def.locationId(); }

    /** Unmodifiable. Empty when the observer does not patrol. */
    public List<Vec3> patrolWaypoints() { return patrolWaypoints; }
    public int currentWaypointIndex() { return currentWaypointIndex; }
    public float patrolIntervalSeconds() { return patrolIntervalSeconds; }

    /** Engine time, in seconds, of the next patrol step. */
    public double nextPatrolTime() { return nextPatrolTime; }

    public boolean patrols() { return !patrolWaypoints.isEmpty(); }

    // -- Engine mutators ------------------------------------------------------

    void setPose(Vec3 position, Vec3 facing) {
        this.position = position;
        this.facing = facing;
    }

    void setPatrolRoute(List<Vec3> waypoints, float intervalSeconds, double nextPatrolTime) {
        this.patrolWaypoints = List.copyOf(waypoints);
        this.patrolIntervalSeconds = intervalSeconds;
        this.currentWaypointIndex = 0;
        this.nextPatrolTime = nextPatrolTime;
    }

    /**
     * Moves to the next waypoint and faces the direction of travel.
     * A zero-length step keeps the previous facing.
     */
    void stepPatrol(double nextPatrolTime) {
        currentWaypointIndex = (currentWaypointIndex + 1) % patrolWaypoints.size();
        Vec3 target = patrolWaypoints.get(currentWaypointIndex);
        Vec3 direction = target.minus(position).normalized();
        position = target;
        if (!direction.isZero()) {
            facing = direction;
        }
        this.nextPatrolTime = nextPatrolTime;
    }

    @Override
    public String toString() {
        return "Observer{id='" + id + "', role=" + role() + ", location='" + locationId() +
            "', position=" + position + ", facing=" + facing + "}";
    }
}
