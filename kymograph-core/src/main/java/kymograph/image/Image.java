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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Planar pixel container: one primitive array per Z-plane, row-major (index = x + y * sizeX).
 * @param <I> concrete image type
 */
public abstract class Image<I extends Image<I>> extends SimpleImageProperties implements PrimitiveType {
    public final static Logger logger = LoggerFactory.getLogger(Image.class);

    /**
     * Copies {@param source} into {@param dest} with its top-left corner at ({@param offX}, {@param offY}) and first plane at {@param offZ}.
     */
    public static void pasteImage(Image source, Image dest, int offX, int offY, int offZ) {
        if (source.getClass() != dest.getClass()) {
            throw new IllegalArgumentException("Paste Image: source and destination should be of the same type (source: " + source.getClass().getSimpleName() + " destination: " + dest.getClass().getSimpleName() + ")");
        }
        if (offX<0 || offY<0 || offZ<0 || source.sizeX() + offX > dest.sizeX() || source.sizeY() + offY > dest.sizeY() || source.sizeZ() + offZ > dest.sizeZ()) {
            throw new IllegalArgumentException("Paste Image: source (" + source.sizeX() + "x" + source.sizeY() + "x" + source.sizeZ() + ") does not fit in destination (" + dest.sizeX() + "x" + dest.sizeY() + "x" + dest.sizeZ() + ") offset: [" + offX + ";" + offY + ";" + offZ + "]");
        }
        if (source.sizeXY()==0) return;
        Object[] sourceP = source.getPixelArray();
        Object[] destP = dest.getPixelArray();
        final int offDestFinal = dest.sizeX() * offY + offX;
        for (int z = 0; z < source.sizeZ(); ++z) {
            int offDest = offDestFinal;
            int offSource = 0;
            for (int y = 0; y < source.sizeY(); ++y) {
                System.arraycopy(sourceP[z], offSource, destP[z + offZ], offDest, source.sizeX());
                offDest += dest.sizeX();
                offSource += source.sizeX();
            }
        }
    }

    public static void pasteImage(Image source, Image dest, int offX, int offY) {
        pasteImage(source, dest, offX, offY, 0);
    }

    protected Image(String name, int sizeX, int sizeY, int sizeZ) {
        super(name, new SimpleBoundingBox(0, sizeX-1, 0, sizeY-1, 0, sizeZ-1), 1, 1);
    }

    protected Image(String name, ImageProperties properties) {
        super(name, new SimpleBoundingBox(properties).resetOffset(), properties.getScaleXY(), properties.getScaleZ());
    }

    public I setName(String name) {
        this.name=name;
        return (I)this;
    }

    public I setCalibration(ImageProperties properties) {
        this.scaleXY = properties.getScaleXY();
        this.scaleZ = properties.getScaleZ();
        return (I)this;
    }

    public I setCalibration(double scaleXY, double scaleZ) {
        this.scaleXY = scaleXY;
        this.scaleZ = scaleZ;
        return (I)this;
    }

    public static <T extends Image<T>> T createEmptyImage(String name, Image<T> imageType, ImageProperties properties) {
        return imageType.newImage(name, properties);
    }

    public static Image createImageFrom2DPixelArray(String name, Object pixelArray, int sizeX) {
        if (pixelArray instanceof byte[]) return new ImageByte(name, sizeX, (byte[])pixelArray);
        else if (pixelArray instanceof short[]) return new ImageShort(name, sizeX, (short[])pixelArray);
        else if (pixelArray instanceof float[]) return new ImageFloat(name, sizeX, (float[])pixelArray);
        else if (pixelArray instanceof int[]) return new ImageInt(name, sizeX, (int[])pixelArray);
        else throw new IllegalArgumentException("Pixel Array should be of type byte, short, float or int");
    }

    /**
     * Stacks 2D images along Y: first image on top. All images must share the same type and sizeX.
     * @return a single plane image of height the sum of the heights
     */
    public static <T extends Image<T>> T concatenateY(String name, List<T> images) {
        if (images==null || images.isEmpty()) throw new IllegalArgumentException("No image to concatenate");
        T first = images.get(0);
        int sizeX = first.sizeX();
        int sizeY = 0;
        for (T im : images) {
            if (im.sizeX()!=sizeX) throw new IllegalArgumentException("Concatenate along Y: all images should have same sizeX (expected: "+sizeX+" found: "+im.sizeX()+")");
            sizeY+=im.sizeY();
        }
        T res = first.newImage(name, new SimpleImageProperties(sizeX, sizeY, 1, first.getScaleXY(), first.getScaleZ()));
        int offY = 0;
        for (T im : images) {
            pasteImage(im, res, 0, offY);
            offY += im.sizeY();
        }
        return res;
    }

    /**
     * Concatenates 2D images along X: first image on the left. All images must share the same type and sizeY.
     * @return a single plane image of width the sum of the widths
     */
    public static <T extends Image<T>> T concatenateX(String name, List<T> images) {
        if (images==null || images.isEmpty()) throw new IllegalArgumentException("No image to concatenate");
        T first = images.get(0);
        int sizeY = first.sizeY();
        int sizeX = 0;
        for (T im : images) {
            if (im.sizeY()!=sizeY) throw new IllegalArgumentException("Concatenate along X: all images should have same sizeY (expected: "+sizeY+" found: "+im.sizeY()+")");
            sizeX+=im.sizeX();
        }
        T res = first.newImage(name, new SimpleImageProperties(sizeX, sizeY, 1, first.getScaleXY(), first.getScaleZ()));
        int offX = 0;
        for (T im : images) {
            pasteImage(im, res, offX, 0);
            offX += im.sizeX();
        }
        return res;
    }

    public abstract I getZPlane(int idxZ);
    public abstract double getPixel(int x, int y, int z);
    public abstract double getPixel(int xy, int z);
    public abstract void setPixel(int x, int y, int z, double value);
    public abstract void setPixel(int xy, int z, double value);
    public abstract Object[] getPixelArray();
    public abstract I newImage(String name, ImageProperties properties);
    public abstract int getBitDepth();

    /**
     * @param bounds relative to this image. Parts of {@param bounds} located outside the image are filled with zeros
     * @return a new image of the size of {@param bounds}
     */
    public I crop(BoundingBox bounds) {
        I res = newImage(name, new SimpleImageProperties(name, bounds, scaleXY, scaleZ));
        SimpleBoundingBox inter = BoundingBox.getIntersection2D(new SimpleBoundingBox(this).resetOffset(), bounds);
        if (inter.isEmpty()) return res; // no data is copied
        int zMinSource = Math.max(0, bounds.zMin());
        int zMaxSource = Math.min(sizeZ-1, bounds.zMax());
        int sizeXCopy = inter.sizeX();
        for (int z = zMinSource; z <= zMaxSource; ++z) {
            for (int y = inter.yMin(); y <= inter.yMax(); ++y) {
                System.arraycopy(getPixelArray()[z], y * sizeX + inter.xMin(), res.getPixelArray()[z - bounds.zMin()], (y - bounds.yMin()) * res.sizeX() + inter.xMin() - bounds.xMin(), sizeXCopy);
            }
        }
        return res;
    }

    /**
     * Adds zero-valued margins around each plane
     * @return a new image of size (sizeX + left + right) x (sizeY + top + bottom)
     */
    public I pad(int left, int right, int top, int bottom) {
        if (left<0 || right<0 || top<0 || bottom<0) throw new IllegalArgumentException("Negative padding: left="+left+" right="+right+" top="+top+" bottom="+bottom);
        return crop(new SimpleBoundingBox(-left, sizeX-1+right, -top, sizeY-1+bottom, 0, sizeZ-1));
    }

    public double[] getMinAndMax() {
        double[] minAndMax = new double[]{Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
        for (int z = 0; z<sizeZ; ++z) {
            for (int xy = 0; xy<sizeXY; ++xy) {
                double v = getPixel(xy, z);
                if (v<minAndMax[0]) minAndMax[0] = v;
                if (v>minAndMax[1]) minAndMax[1] = v;
            }
        }
        return minAndMax;
    }

    @Override
    public String toString() {
        return byteCount()+";"+super.toString();
    }
}
