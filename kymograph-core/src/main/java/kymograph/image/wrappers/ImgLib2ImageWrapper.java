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
package kymograph.image.wrappers;

import kymograph.image.*;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * @author Jean Ollion
 */
public class ImgLib2ImageWrapper {
    static final Logger logger = LoggerFactory.getLogger(ImgLib2ImageWrapper.class);

    /**
     * Copies a 2D view into a new ImageFloat. Only the first two dimensions are read.
     */
    public static <T extends RealType<T>> ImageFloat wrap(RandomAccessibleInterval<T> img) {
        int sizeX = (int)img.dimension(0);
        int sizeY = img.numDimensions()>1 ? (int)img.dimension(1) : 1;
        float[] pixels = new float[sizeX * sizeY];
        Cursor<T> c = Views.flatIterable(img).cursor();
        int i = 0;
        while (c.hasNext()) pixels[i++] = c.next().getRealFloat();
        return new ImageFloat("", sizeX, pixels);
    }

    /**
     * @return a 2D ArrayImg of plane {@param z} of {@param image} that shares its pixel array. Byte and short images are unsigned
     */
    public static <T extends RealType<T>> Img<T> getPlane(Image image, int z) {
        Object pixels = image.getPixelArray()[z];
        int sX = image.sizeX();
        int sY = image.sizeY();
        if (image instanceof PrimitiveType.ByteType) return (Img<T>)ArrayImgs.unsignedBytes((byte[])pixels, sX, sY);
        else if (image instanceof PrimitiveType.ShortType) return (Img<T>)ArrayImgs.unsignedShorts((short[])pixels, sX, sY);
        else if (image instanceof PrimitiveType.IntType) return (Img<T>)ArrayImgs.ints((int[])pixels, sX, sY);
        else if (image instanceof PrimitiveType.FloatType) return (Img<T>)ArrayImgs.floats((float[])pixels, sX, sY);
        else throw new IllegalArgumentException("Unsupported type: "+image.getClass().getSimpleName());
    }

    /**
     * @return a 2D float ArrayImg view of plane {@param z} of {@param image}. Pixel array is shared if {@param image} is an ImageFloat
     */
    public static ArrayImg<FloatType, FloatArray> getFloatPlane(Image image, int z) {
        ImageFloat plane = image instanceof ImageFloat ? ((ImageFloat)image).getZPlane(z) : TypeConverter.toFloat(image.getZPlane(z), null);
        return ArrayImgs.floats(plane.getPixelArray()[0], plane.sizeX(), plane.sizeY());
    }

    /**
     * Copies {@param source} into {@param target}, both intervals must have the same dimensions
     */
    public static <T extends Type<T>> void copy(RandomAccessibleInterval<T> source, RandomAccessibleInterval<T> target) {
        LoopBuilder.setImages(source, target).forEachPixel((s, t) -> t.set(s));
    }
}
