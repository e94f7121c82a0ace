/*
 * Copyright (C) 2026 Kymograph contributors
 *
 * This File is part of KYMOGRAPH
 *
 * KYMOGRAPH is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * KYMOGRAPH is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with KYMOGRAPH.  If not, see <http://www.gnu.org/licenses/>.
 */
package kymograph.ij;

import ij.ImagePlus;
import ij.gui.Line;
import ij.gui.Overlay;
import ij.gui.PolygonRoi;
import ij.gui.Roi;
import ij.process.FloatPolygon;
import kymograph.geom.Point;
import kymograph.io.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Reads line and polyline ROIs from the overlay of ImageJ images.
 * ROIs sharing an overlay group form a single record, ungrouped ROIs form one record each. Record ids follow overlay order, starting at 1.
 * Other ROI types are ignored
 */
public class IJRoiSource implements RoiSource {
    public final static Logger logger = LoggerFactory.getLogger(IJRoiSource.class);
    final IJImageRepository repository;

    public IJRoiSource(IJImageRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<RoiRecord> findShapesForImage(long imageId) throws IOException {
        return getRois(repository.getImage(imageId).getImagePlus());
    }

    public static List<RoiRecord> getRois(ImagePlus image) {
        Overlay overlay = image.getOverlay();
        if (overlay==null) return Collections.emptyList();
        Map<Integer, List<ShapeRecord>> groups = new LinkedHashMap<>(); // group -> shapes, in order of first appearance
        List<List<ShapeRecord>> records = new ArrayList<>();
        for (Roi roi : overlay.toArray()) {
            ShapeRecord shape = toShapeRecord(roi, image);
            if (shape==null) continue;
            if (roi.getGroup()>0) {
                List<ShapeRecord> group = groups.get(roi.getGroup());
                if (group==null) {
                    group = new ArrayList<>();
                    groups.put(roi.getGroup(), group);
                    records.add(group);
                }
                group.add(shape);
            } else records.add(new ArrayList<>(Collections.singletonList(shape)));
        }
        List<RoiRecord> res = new ArrayList<>(records.size());
        for (int i = 0; i<records.size(); ++i) res.add(new RoiRecord(i+1, records.get(i)));
        logger.debug("image: {}: {} line / polyline ROI(s) found in overlay", image.getTitle(), res.size());
        return res;
    }

    /**
     * @return null if {@param roi} is neither a straight line nor a polyline
     */
    static ShapeRecord toShapeRecord(Roi roi, ImagePlus image) {
        Integer z = null, t = null;
        if (roi.hasHyperStackPosition()) {
            if (roi.getZPosition()>0) z = roi.getZPosition()-1;
            if (roi.getTPosition()>0) t = roi.getTPosition()-1;
        } else if (roi.getPosition()>0) { // stack index
            int[] czt = image.convertIndexToPosition(roi.getPosition());
            z = czt[1]-1;
            t = czt[2]-1;
        }
        if (roi.getType()==Roi.LINE) {
            Line l = (Line)roi;
            return new LineRecord(z, t, l.x1d, l.y1d, l.x2d, l.y2d);
        } else if (roi.getType()==Roi.POLYLINE) {
            FloatPolygon poly = ((PolygonRoi)roi).getFloatPolygon();
            List<Point> points = new ArrayList<>(poly.npoints);
            for (int i = 0; i<poly.npoints; ++i) points.add(new Point(poly.xpoints[i], poly.ypoints[i]));
            return new PolylineRecord(z, t, PointsParser.format(points));
        } else {
            logger.trace("ROI: {} of type: {} ignored", roi.getName(), roi.getTypeAsString());
            return null;
        }
    }
}
