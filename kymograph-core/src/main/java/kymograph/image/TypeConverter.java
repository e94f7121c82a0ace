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
public class TypeConverter {

    /**
     *
     * @param image input image to be converted
     * @param output image to cast values to. if null, a new image will be created
     * @return a new ImageFloat values casted as float
     */
    public static ImageFloat toFloat(Image image, ImageFloat output) {
        if (output==null || !output.sameDimensions(image)) output = new ImageFloat(image.getName(), image);
        if (image instanceof ImageFloat) Image.pasteImage(image, output, 0, 0, 0);
        else {
            float[][] newPixels = output.getPixelArray();
            for (int z = 0; z<image.sizeZ(); ++z) {
                for (int xy = 0; xy<image.sizeXY(); ++xy) {
                    newPixels[z][xy]=(float)image.getPixel(xy, z);
                }
            }
        }
        return output;
    }

    /**
     * Type used to hold interpolated data of {@param source}: 8-bit images stay 8-bit, 16 and 32-bit integer images are widened to signed 32-bit, floating point images stay floating point
     * @return an empty image of the working type
     */
    public static Image getWorkingType(Image source) {
        if (source instanceof ImageByte) return new ImageByte("", 0, 0, 0);
        if (source.floatingPoint()) return new ImageFloat("", 0, 0, 0);
        return new ImageInt("", 0, 0, 0);
    }

    /**
     * Casts {@param source} to the type of {@param type}. Values are rounded for integer types and saturated to the range of 8 and 16-bit types
     * @return {@param source} itself if already of the requested type
     */
    public static <T extends Image<T>> T cast(Image source, T type) {
        if (type.getClass().equals(source.getClass())) return (T)source;
        T res = Image.createEmptyImage(source.getName(), type, source);
        res.setCalibration(source);
        boolean round = !type.floatingPoint();
        for (int z = 0; z<source.sizeZ(); ++z) {
            for (int xy = 0; xy<source.sizeXY(); ++xy) {
                double v = source.getPixel(xy, z);
                res.setPixel(xy, z, round ? Math.round(v) : v);
            }
        }
        return res;
    }
}
