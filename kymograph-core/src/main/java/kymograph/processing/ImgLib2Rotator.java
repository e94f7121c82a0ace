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
package kymograph.processing;

import kymograph.image.Image;
import kymograph.image.ImageFloat;
import kymograph.image.wrappers.ImgLib2ImageWrapper;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.realtransform.RealViews;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Rotation through an ImgLib2 interpolated affine view. Source is extended with zeros.
 */
public class ImgLib2Rotator implements Rotator {
    final Interpolation interpolation;

    public ImgLib2Rotator(Interpolation interpolation) {
        if (interpolation==null || interpolation.equals(Interpolation.BICUBIC)) throw new IllegalArgumentException("Interpolation not supported by ImgLib2: "+interpolation);
        this.interpolation = interpolation;
    }

    @Override
    public Image rotate(Image image, double degrees, boolean expand) {
        int quarterTurns = ImageTransformation.getQuarterTurns(degrees);
        if (quarterTurns>=0) return ImageTransformation.turn(image.getZPlane(0), quarterTurns);
        int[] size = expand ? ImageTransformation.getRotatedSize(image.sizeX(), image.sizeY(), degrees) : new int[]{image.sizeX(), image.sizeY()};
        ArrayImg<FloatType, FloatArray> img = ImgLib2ImageWrapper.getFloatPlane(image, 0);
        RandomAccessibleInterval<FloatType> rotated = Views.interval(Views.raster(RealViews.affineReal(
                Views.interpolate(Views.extendZero(img), interpolation.factory()),
                getTransform(image.sizeX(), image.sizeY(), size[0], size[1], degrees))), new FinalInterval(size[0], size[1]));
        ImageFloat res = ImgLib2ImageWrapper.wrap(rotated);
        res.setName(image.getName()).setCalibration(image);
        return res;
    }

    /**
     * Maps source pixel indices to target pixel indices: pixel centers are rotated counter-clockwise (as displayed) by {@param degrees} about the image centers
     */
    static AffineTransform2D getTransform(int sourceSizeX, int sourceSizeY, int targetSizeX, int targetSizeY, double degrees) {
        AffineTransform2D transform = new AffineTransform2D();
        transform.translate(0.5 - sourceSizeX / 2d, 0.5 - sourceSizeY / 2d);
        transform.rotate(-Math.toRadians(degrees)); // y axis points down
        transform.translate(targetSizeX / 2d - 0.5, targetSizeY / 2d - 0.5);
        return transform;
    }
}
