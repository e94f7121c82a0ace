package kymograph.io;

import kymograph.geom.Shape;

/**
 * Stored shape of a ROI. Z and T indices may be absent, in which case they default to 0
 */
public abstract class ShapeRecord {
    final Integer theZ, theT;

    protected ShapeRecord(Integer theZ, Integer theT) {
        this.theZ = theZ;
        this.theT = theT;
    }

    public int getTheZ() {
        return theZ==null ? 0 : theZ;
    }

    public int getTheT() {
        return theT==null ? 0 : theT;
    }

    /**
     * @return geometry of this record, or null if it cannot be interpreted
     */
    public abstract Shape toShape();
}
