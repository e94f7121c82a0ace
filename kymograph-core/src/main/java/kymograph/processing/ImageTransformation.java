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
package kymograph.processing;

import kymograph.image.Image;
import kymograph.image.SimpleImageProperties;
import kymograph.image.wrappers.ImgLib2ImageWrapper;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.view.Views;

/**
 *
 * @author Jean Ollion
 */
public class ImageTransformation {
    public final static double ANGLE_PRECISION = 1e-9;

    /**
     * @return angle in [0, 360)
     */
    public static double normalizeAngle(double degrees) {
        double res = degrees % 360;
        if (res<0) res += 360;
        if (360 - res < ANGLE_PRECISION) res = 0;
        return res;
    }

    /**
     * @return number of counter-clockwise quarter turns equivalent to {@param degrees}, or -1 if the angle is not a multiple of 90
     */
    public static int getQuarterTurns(double degrees) {
        double angle = normalizeAngle(degrees);
        double q = Math.rint(angle / 90);
        if (Math.abs(angle - q * 90) > ANGLE_PRECISION) return -1;
        return (int)q % 4;
    }

    /**
     * @return {sizeX, sizeY} of the smallest canvas containing an image of size {@param sizeX} x {@param sizeY} rotated by {@param degrees}
     */
    public static int[] getRotatedSize(int sizeX, int sizeY, double degrees) {
        int q = getQuarterTurns(degrees);
        if (q>=0) return q%2==0 ? new int[]{sizeX, sizeY} : new int[]{sizeY, sizeX};
        double rad = Math.toRadians(degrees);
        double cos = Math.abs(Math.cos(rad));
        double sin = Math.abs(Math.sin(rad));
        return new int[]{(int)Math.ceil(sizeX * cos + sizeY * sin - 1e-6), (int)Math.ceil(sizeX * sin + sizeY * cos - 1e-6)};
    }

    /**
     * Exact rotation by a multiple of 90 degrees, counter-clockwise as displayed. Only the first plane is considered.
     * @param quarterTurns number of counter-clockwise quarter turns
     * @return new image of same type as {@param image}
     */
    public static <T extends Image<T>> T turn(Image<T> image, int quarterTurns) {
        int q = ((quarterTurns % 4) + 4) % 4;
        int nX = q%2==0 ? image.sizeX() : image.sizeY();
        int nY = q%2==0 ? image.sizeY() : image.sizeX();
        T res = image.newImage(image.getName(), new SimpleImageProperties(nX, nY, 1, image.getScaleXY(), image.getScaleZ()));
        RandomAccessibleInterval view = ImgLib2ImageWrapper.getPlane(image, 0);
        for (int i = 0; i<q; ++i) view = Views.zeroMin(Views.rotate(view, 0, 1)); // x axis onto y axis
        RandomAccessibleInterval target = ImgLib2ImageWrapper.getPlane(res, 0);
        ImgLib2ImageWrapper.copy(view, target);
        return res;
    }
}
