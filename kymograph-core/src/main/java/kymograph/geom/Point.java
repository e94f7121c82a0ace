/*
 * Copyright (C) 2018 Jean Ollion
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

/**
 * Immutable 2D location in image pixel coordinates.
 * @author Jean Ollion
 */
public class Point {
    final double x, y;

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double dist(Point other) {
        return Math.sqrt(Math.pow(other.x - x, 2) + Math.pow(other.y - y, 2));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point)) return false;
        Point other = (Point)obj;
        return Double.compare(x, other.x)==0 && Double.compare(y, other.y)==0;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + Double.hashCode(x);
        hash = 53 * hash + Double.hashCode(y);
        return hash;
    }

    @Override
    public String toString() {
        return "("+ Utils.format(x)+", "+Utils.format(y)+")";
    }
}
