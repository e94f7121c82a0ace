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

import kymograph.utils.Utils;

import java.util.Arrays;
import java.util.List;

/**
 * Single straight segment
 */
public class LineShape implements Shape {
    final int theZ;
    final Point p1, p2;

    public LineShape(int theZ, Point p1, Point p2) {
        if (p1==null || p2==null) throw new IllegalArgumentException("Line end points cannot be null");
        this.theZ = theZ;
        this.p1 = p1;
        this.p2 = p2;
    }

    public LineShape(int theZ, double x1, double y1, double x2, double y2) {
        this(theZ, new Point(x1, y1), new Point(x2, y2));
    }

    @Override
    public int getTheZ() {
        return theZ;
    }

    @Override
    public List<Point> getPoints() {
        return Arrays.asList(p1, p2);
    }

    @Override
    public String toString() {
        return "{theZ: "+theZ+", x1: "+ Utils.format(p1.getX())+", y1: "+Utils.format(p1.getY())+", x2: "+Utils.format(p2.getX())+", y2: "+Utils.format(p2.getY())+"}";
    }
}
