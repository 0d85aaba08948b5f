package io.hustle.sim.simulation;

/**
 * Immutable occluder triangle. Walls, partitions and furniture that block sight
 * are reduced to these.
 */
public final class OccluderTriangle {

    public final float ax;
    public final float ay;
    public final float az;

    public final float bx;
    public final float by;
    public final float bz;

    public final float cx;
    public final float cy;
    public final float cz;

    public OccluderTriangle(float ax, float ay, float az,
                            float bx, float by, float bz,
                            float cx, float cy, float cz) {
        validateFinite("ax", ax);
        validateFinite("ay", ay);
        validateFinite("az", az);
        validateFinite("bx", bx);
        validateFinite("by", by);
        validateFinite("bz", bz);
        validateFinite("cx", cx);
        validateFinite("cy", cy);
        validateFinite("cz", cz);
        this.ax = ax;
        this.ay = ay;
        this.az = az;
        this.bx = bx;
        this.by = by;
        this.bz = bz;
        this.cx = cx;
        this.cy = cy;
        this.cz = cz;
    }

    private static void validateFinite(String name, float value) {
        if (!Float.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite vertex component: " + name);
        }
    }
}
