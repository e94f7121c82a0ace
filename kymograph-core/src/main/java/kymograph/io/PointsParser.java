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
package kymograph.io;

import kymograph.geom.Point;
import kymograph.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decodes polyline vertices stored as e.g. {@code "points[309,427, 366,503, 190,491] points1[309,427, 366,503, 190,491]"}.
 * Only the first bracketed list is read.
 */
public class PointsParser {
    public final static Logger logger = LoggerFactory.getLogger(PointsParser.class);
    public final static String POINTS_TOKEN = "points";

    /**
     * @return ordered vertices, or an empty list if {@param points} is malformed
     */
    public static List<Point> parse(String points) {
        if (points==null) {
            logger.error("Unrecognised ROI shape 'points' string: null");
            return Collections.emptyList();
        }
        String[] lists = points.trim().split(POINTS_TOKEN, -1);
        if (lists.length<2) {
            logger.error("Unrecognised ROI shape 'points' string: {}", points);
            return Collections.emptyList();
        }
        String first = strip(lists[1], " []");
        if (first.isEmpty()) return Collections.emptyList();
        List<Point> res = new ArrayList<>();
        for (String xy : first.split(", ")) {
            String[] coords = xy.split(",");
            if (coords.length!=2) {
                logger.error("Unrecognised coordinates: \"{}\" in ROI shape 'points' string: {}", xy, points);
                return Collections.emptyList();
            }
            try {
                res.add(new Point(Double.parseDouble(coords[0].trim()), Double.parseDouble(coords[1].trim())));
            } catch (NumberFormatException e) {
                logger.error("Unrecognised coordinates: \"{}\" in ROI shape 'points' string: {}", xy, points);
                return Collections.emptyList();
            }
        }
        logger.debug("parsed points: {}", Utils.toStringList(res, Point::toString));
        return res;
    }

    /**
     * Inverse of {@link #parse(String)}
     * @return points string with a single list
     */
    public static String format(List<Point> points) {
        return POINTS_TOKEN + points.stream().map(p -> Utils.format(p.getX())+","+Utils.format(p.getY())).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Removes leading and trailing characters contained in {@param chars}
     */
    static String strip(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start<end && chars.indexOf(s.charAt(start))>=0) ++start;
        while (end>start && chars.indexOf(s.charAt(end-1))>=0) --end;
        return s.substring(start, end);
    }
}
