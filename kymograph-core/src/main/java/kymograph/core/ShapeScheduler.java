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
package kymograph.core;

import kymograph.geom.LineShape;
import kymograph.geom.PolylineShape;
import kymograph.geom.Shape;
import kymograph.io.LineRecord;
import kymograph.io.PolylineRecord;
import kymograph.io.RoiRecord;
import kymograph.io.ShapeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves the shapes of a ROI into a sampling schedule. Lines and polylines are indexed separately, lines take precedence.
 */
public class ShapeScheduler {
    public final static Logger logger = LoggerFactory.getLogger(ShapeScheduler.class);
    final boolean useAllTimepoints;

    public ShapeScheduler(boolean useAllTimepoints) {
        this.useAllTimepoints = useAllTimepoints;
    }

    /**
     * When several lines share a timepoint, the last one is kept
     */
    public static Map<Integer, LineShape> getLines(RoiRecord roi) {
        Map<Integer, LineShape> res = new TreeMap<>();
        for (ShapeRecord s : roi.getShapes()) {
            if (s instanceof LineRecord) res.put(s.getTheT(), ((LineRecord)s).toShape());
        }
        return res;
    }

    /**
     * Polylines whose points cannot be read are ignored. When several polylines share a timepoint, the last one is kept
     */
    public static Map<Integer, PolylineShape> getPolylines(RoiRecord roi) {
        Map<Integer, PolylineShape> res = new TreeMap<>();
        for (ShapeRecord s : roi.getShapes()) {
            if (s instanceof PolylineRecord) {
                PolylineShape p = ((PolylineRecord)s).toShape();
                if (p==null) logger.warn("ROI: {} polyline at timepoint {} ignored: invalid points: {}", roi.getId(), s.getTheT(), ((PolylineRecord)s).getPoints());
                else res.put(s.getTheT(), p);
            }
        }
        return res;
    }

    /**
     * @return true if {@param roi} holds at least one line or polyline record
     */
    public static boolean hasLineShapes(RoiRecord roi) {
        return roi.getShapes().stream().anyMatch(s -> s instanceof LineRecord || s instanceof PolylineRecord);
    }

    /**
     * @return schedule of the lines of {@param roi} if any, otherwise of its polylines, or null if it holds neither
     */
    public ShapeSchedule<? extends Shape> schedule(RoiRecord roi) {
        Map<Integer, LineShape> lines = getLines(roi);
        Map<Integer, PolylineShape> polylines = getPolylines(roi);
        if (!lines.isEmpty()) {
            if (!polylines.isEmpty()) logger.debug("ROI: {}: {} polyline(s) ignored as lines are present", roi.getId(), polylines.size());
            return new ShapeSchedule<>(lines, useAllTimepoints);
        } else if (!polylines.isEmpty()) return new ShapeSchedule<>(polylines, useAllTimepoints);
        else return null;
    }
}
