package kymograph.io;

import kymograph.geom.Point;
import kymograph.geom.PolylineShape;

import java.util.List;

/**
 * Polyline stored with its vertices encoded as a points string, see {@link PointsParser}
 */
public class PolylineRecord extends ShapeRecord {
    final String points;

    public PolylineRecord(Integer theZ, Integer theT, String points) {
        super(theZ, theT);
        this.points = points;
    }

    public String getPoints() {
        return points;
    }

    /**
     * @return null if the points string is malformed or holds less than 2 points
     */
    @Override
    public PolylineShape toShape() {
        List<Point> pts = PointsParser.parse(points);
        if (pts.size()<2) return null;
        return new PolylineShape(getTheZ(), pts);
    }

    @Override
    public String toString() {
        return "Polyline(t="+getTheT()+")"+points;
    }
}
