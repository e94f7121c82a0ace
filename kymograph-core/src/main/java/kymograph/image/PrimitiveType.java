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

public interface PrimitiveType {
    Object[] getPixelArray();
    int byteCount();
    boolean floatingPoint();
    interface ByteType extends PrimitiveType {
        byte[][] getPixelArray();
        default int byteCount() {return 1;}
        default boolean floatingPoint() {return false;}
    }
    interface ShortType extends PrimitiveType {
        short[][] getPixelArray();
        default int byteCount() {return 2;}
        default boolean floatingPoint() {return false;}
    }
    interface FloatType extends PrimitiveType {
        float[][] getPixelArray();
        default int byteCount() {return 4;}
        default boolean floatingPoint() {return true;}
    }
    interface IntType extends PrimitiveType {
        int[][] getPixelArray();
        default int byteCount() {return 4;}
        default boolean floatingPoint() {return false;}
    }
}
