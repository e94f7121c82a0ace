package kymograph.io;

import kymograph.geom.LineShape;

public class LineRecord extends ShapeRecord {
    final double x1, y1, x2, y2;

    public LineRecord(Integer theZ, Integer theT, double x1, double y1, double x2, double y2) {
        super(theZ, theT);
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    @Override
    public LineShape toShape() {
        return new LineShape(getTheZ(), x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return "Line(t="+getTheT()+")"+toShape();
    }
}
