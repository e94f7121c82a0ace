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
package kymograph.geom;

import java.util.List;

/**
 * Line-like ROI shape drawn on a single Z-plane, sampled segment by segment
 */
public interface Shape {
    int getTheZ();

    /**
     * @return ordered vertices, consecutive pairs define the segments to sample
     */
    List<Point> getPoints();

    default int getSegmentCount() {
        return Math.max(0, getPoints().size() - 1);
    }

    default Point[] getSegment(int idx) {
        List<Point> points = getPoints();
        return new Point[]{points.get(idx), points.get(idx+1)};
    }
}
