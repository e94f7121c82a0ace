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
package kymograph.image;

/**
 *
 * @author Jean Ollion
 */
public class SimpleBoundingBox implements BoundingBox {
    int xMin, xMax, yMin, yMax, zMin, zMax;

    public SimpleBoundingBox(int xMin, int xMax, int yMin, int yMax, int zMin, int zMax) {
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
        this.zMin = zMin;
        this.zMax = zMax;
    }
    public SimpleBoundingBox(BoundingBox other) {
        this(other.xMin(), other.xMax(), other.yMin(), other.yMax(), other.zMin(), other.zMax());
    }

    /**
     * Single plane rectangle with top-left corner ({@param x}, {@param y})
     * @return a box of size {@param width} x {@param height} x 1
     */
    public static SimpleBoundingBox ofRectangle(int x, int y, int width, int height) {
        return new SimpleBoundingBox(x, x+width-1, y, y+height-1, 0, 0);
    }

    @Override public int xMin() { return xMin; }
    @Override public int xMax() { return xMax; }
    @Override public int yMin() { return yMin; }
    @Override public int yMax() { return yMax; }
    @Override public int zMin() { return zMin; }
    @Override public int zMax() { return zMax; }

    /**
     * Translate the bounding box in the 3 axes
     * @param dX translation in the X-Axis in pixels
     * @param dY translation in the Y-Axis in pixels
     * @param dZ translation in the X-Axis in pixels
     * @return the same instance of bounding box, after the translation operation
     */
    public SimpleBoundingBox translate(int dX, int dY, int dZ) {
        xMin+=dX; xMax+=dX; yMin+=dY; yMax+=dY; zMin+=dZ; zMax+=dZ;
        return this;
    }

    public SimpleBoundingBox resetOffset() {
        return translate(-xMin, -yMin, -zMin);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof BoundingBox)) return false;
        return sameBounds((BoundingBox)other);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + this.xMin;
        hash = 29 * hash + this.xMax;
        hash = 29 * hash + this.yMin;
        hash = 29 * hash + this.yMax;
        hash = 29 * hash + this.zMin;
        hash = 29 * hash + this.zMax;
        return hash;
    }

    @Override
    public String toString() {
        return "[x:["+xMin+";"+xMax+"], y:["+yMin+";"+yMax+"], z:["+zMin+";"+zMax+"]]";
    }
}
