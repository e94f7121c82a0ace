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

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import kymograph.image.Image;
import kymograph.image.ImageFloat;
import kymograph.image.SimpleBoundingBox;
import kymograph.image.TypeConverter;
import kymograph.image.wrappers.IJImageWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bicubic rotation performed by ImageJ on a float copy of the plane
 */
public class IJRotator implements Rotator {
    public final static Logger logger = LoggerFactory.getLogger(IJRotator.class);

    @Override
    public Image rotate(Image image, double degrees, boolean expand) {
        int quarterTurns = ImageTransformation.getQuarterTurns(degrees);
        if (quarterTurns>=0) return ImageTransformation.turn(image.getZPlane(0), quarterTurns);
        int sX = image.sizeX();
        int sY = image.sizeY();
        int[] targetSize = expand ? ImageTransformation.getRotatedSize(sX, sY, degrees) : new int[]{sX, sY};
        // canvas must contain the source and share the parity of the target so that the crop is centered
        int cX = Math.max(sX, targetSize[0]);
        int cY = Math.max(sY, targetSize[1]);
        if ((cX - targetSize[0])%2!=0) ++cX;
        if ((cY - targetSize[1])%2!=0) ++cY;
        ImageProcessor source = IJImageWrapper.getImageProcessor(TypeConverter.toFloat(image.getZPlane(0), null), 0);
        FloatProcessor canvas = new FloatProcessor(cX, cY);
        canvas.insert(source, (cX - sX)/2, (cY - sY)/2);
        canvas.setInterpolationMethod(ImageProcessor.BICUBIC);
        // when canvas and source sizes differ by an odd number the source is shifted by half a pixel onto the rotation center
        double dX = ((cX - sX)%2) / 2d;
        double dY = ((cY - sY)%2) / 2d;
        if (dX!=0 || dY!=0) canvas.translate(dX, dY);
        canvas.setBackgroundValue(0);
        canvas.rotate(-degrees); // ImageJ rotates clockwise
        ImageFloat rotated = (ImageFloat)IJImageWrapper.wrap(canvas);
        rotated.setName(image.getName()).setCalibration(image);
        if (cX==targetSize[0] && cY==targetSize[1]) return rotated;
        int offX = (cX - targetSize[0])/2;
        int offY = (cY - targetSize[1])/2;
        logger.trace("rotation canvas: {}x{} cropped to {}x{}", cX, cY, targetSize[0], targetSize[1]);
        return crop(rotated, SimpleBoundingBox.ofRectangle(offX, offY, targetSize[0], targetSize[1]));
    }
}
