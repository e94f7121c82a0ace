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
public class SimpleImageProperties extends SimpleBoundingBox implements ImageProperties {
    protected String name;
    protected int sizeX, sizeY, sizeZ, sizeXY;
    protected double scaleXY, scaleZ;

    public SimpleImageProperties(String name, BoundingBox bounds, double scaleXY, double scaleZ) {
        super(bounds);
        this.name = name;
        this.sizeX = bounds.sizeX();
        this.sizeY = bounds.sizeY();
        this.sizeZ = bounds.sizeZ();
        this.sizeXY = sizeX * sizeY;
        this.scaleXY = scaleXY;
        this.scaleZ = scaleZ;
    }
    public SimpleImageProperties(int sizeX, int sizeY, int sizeZ, double scaleXY, double scaleZ) {
        this("", new SimpleBoundingBox(0, sizeX-1, 0, sizeY-1, 0, sizeZ-1), scaleXY, scaleZ);
    }
    public SimpleImageProperties(ImageProperties properties) {
        this(properties.getName(), properties, properties.getScaleXY(), properties.getScaleZ());
    }

    @Override public String getName() {
        return name;
    }
    @Override public int sizeX() { return sizeX; }
    @Override public int sizeY() { return sizeY; }
    @Override public int sizeZ() { return sizeZ; }
    @Override public int sizeXY() { return sizeXY; }
    @Override public double getScaleXY() { return scaleXY; }
    @Override public double getScaleZ() { return scaleZ; }

    @Override
    public String toString() {
        return name+":"+super.toString()+";scaleXY:"+scaleXY+";scaleZ:"+scaleZ;
    }
}
