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
 * Axis-aligned box in pixel coordinates, bounds are inclusive.
 * @author Jean Ollion
 */
public interface BoundingBox {
    int xMin();
    int xMax();
    int yMin();
    int yMax();
    int zMin();
    int zMax();
    default int sizeX() { return xMax()-xMin()+1; }
    default int sizeY() { return yMax()-yMin()+1; }
    default int sizeZ() { return zMax()-zMin()+1; }
    default boolean isEmpty() {
        return sizeX()<=0 || sizeY()<=0 || sizeZ()<=0;
    }
    default boolean sameBounds(BoundingBox other) {
        return xMin()==other.xMin() && yMin()==other.yMin() && zMin()==other.zMin() && xMax()==other.xMax() && yMax()==other.yMax() && zMax()==other.zMax();
    }
    default boolean sameDimensions(BoundingBox other) {
        return sizeX() == other.sizeX() && sizeY() == other.sizeY() && sizeZ() == other.sizeZ();
    }

    static boolean intersect2D(BoundingBox b1, BoundingBox b2) {
        return Math.max(b1.xMin(), b2.xMin())<=Math.min(b1.xMax(), b2.xMax()) && Math.max(b1.yMin(), b2.yMin())<=Math.min(b1.yMax(), b2.yMax());
    }
    /**
     *
     * @return intersection in XY, z bounds are taken from {@param b1}. Result may be empty
     */
    static SimpleBoundingBox getIntersection2D(BoundingBox b1, BoundingBox b2) {
        return new SimpleBoundingBox(Math.max(b1.xMin(), b2.xMin()), Math.min(b1.xMax(), b2.xMax()), Math.max(b1.yMin(), b2.yMin()), Math.min(b1.yMax(), b2.yMax()), b1.zMin(), b1.zMax());
    }
    static boolean isIncluded2D(BoundingBox contained, BoundingBox container) {
        return contained.xMin()>=container.xMin() && contained.xMax()<=container.xMax() && contained.yMin()>=container.yMin() && contained.yMax()<=container.yMax();
    }
}
