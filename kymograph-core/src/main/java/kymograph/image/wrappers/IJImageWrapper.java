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

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import kymograph.image.*;

import java.util.List;

/**
 *
 * @author Jean Ollion
 */
public class IJImageWrapper {

    /**
     * Wraps the pixel array of {@param ip}, no copy occurs
     */
    public static Image wrap(ImageProcessor ip) {
        Object pixels = ip.getPixels();
        if (pixels instanceof byte[] || pixels instanceof short[] || pixels instanceof float[]) return Image.createImageFrom2DPixelArray("", pixels, ip.getWidth());
        else throw new IllegalArgumentException("Unsupported processor type: "+ip.getClass().getSimpleName());
    }

    /**
     * Generates an ImageJ processor backed by the z-th plane of {@param image} if its type is byte, short or float. Other types are converted to float and the link between pixel arrays is lost.
     */
    public static ImageProcessor getImageProcessor(Image image, int z) {
        if (image instanceof ImageByte) return new ByteProcessor(image.sizeX(), image.sizeY(), ((ImageByte)image).getPixelArray()[z]);
        else if (image instanceof ImageShort) return new ShortProcessor(image.sizeX(), image.sizeY(), ((ImageShort)image).getPixelArray()[z], null);
        else if (image instanceof ImageFloat) return new FloatProcessor(image.sizeX(), image.sizeY(), ((ImageFloat)image).getPixelArray()[z]);
        else return getImageProcessor(TypeConverter.toFloat(image.getZPlane(z), null), 0);
    }

    /**
     * Generate ImageJ's ImagePlus object from single-plane images, one per channel
     * @param planesC one 2D image per channel, all with same size and type
     * @return hyperstack with C = {@param planesC} size, Z = T = 1
     */
    public static ImagePlus getImagePlus(String title, List<? extends Image> planesC) {
        Image first = planesC.get(0);
        ImageStack st = new ImageStack(first.sizeX(), first.sizeY());
        for (Image plane : planesC) st.addSlice(getImageProcessor(plane, 0));
        ImagePlus ip = new ImagePlus(title, st);
        ip.setDimensions(planesC.size(), 1, 1);
        if (planesC.size()>1) ip.setOpenAsHyperStack(true);
        Calibration cal = new Calibration();
        if (first.getScaleXY()!=0) {
            cal.pixelWidth=first.getScaleXY();
            cal.pixelHeight=first.getScaleXY();
            if (first.getScaleZ()!=0) cal.pixelDepth=first.getScaleZ();
        }
        ip.setCalibration(cal);
        return ip;
    }
}
