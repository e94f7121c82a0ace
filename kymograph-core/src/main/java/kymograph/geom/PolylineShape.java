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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Connected segments through at least 2 ordered points
 */
public class PolylineShape implements Shape {
    final int theZ;
    final List<Point> points;

    public PolylineShape(int theZ, List<Point> points) {
        if (points==null || points.size()<2) throw new IllegalArgumentException("Polyline requires at least 2 points, found: "+(points==null ? 0 : points.size()));
        this.theZ = theZ;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    @Override
    public int getTheZ() {
        return theZ;
    }

    @Override
    public List<Point> getPoints() {
        return points;
    }

    @Override
    public String toString() {
        return "{theZ: "+theZ+", points: "+points+"}";
    }
}
