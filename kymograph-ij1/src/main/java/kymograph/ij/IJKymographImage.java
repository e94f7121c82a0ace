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
package kymograph.ij;

import ij.CompositeImage;
import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.LUT;
import kymograph.io.KymographImage;

import java.awt.Color;
import java.io.File;
import java.io.IOException;

/**
 * Kymograph held as an ImageJ image and persisted as a TIFF file
 */
public class IJKymographImage implements KymographImage {
    final long id;
    final ImagePlus image;
    final File file;

    public IJKymographImage(long id, ImagePlus image, File file) {
        this.id = id;
        this.image = image;
        this.file = file;
    }

    public ImagePlus getImagePlus() {
        return image;
    }

    public File getFile() {
        return file;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        return image.getTitle();
    }

    @Override
    public int getSizeC() {
        return image.getNChannels();
    }

    @Override
    public void setChannelName(int c, String name) {
        image.getStack().setSliceLabel(name, image.getStackIndex(c+1, 1, 1));
    }

    @Override
    public void setChannelColor(int c, Color color) {
        LUT lut = LUT.createLutFromColor(color);
        if (image.isComposite()) ((CompositeImage)image).setChannelLut(lut, c+1);
        else image.getProcessor().setLut(lut);
    }

    @Override
    public void setPhysicalSizeX(double size) {
        Calibration cal = image.getCalibration();
        cal.pixelWidth = size;
        cal.setXUnit("micron");
    }

    /**
     * Along Y, one pixel stands for a fraction of the time interval. The value is stored as a length as there is no mixed unit calibration
     */
    @Override
    public void setPhysicalSizeY(double size) {
        Calibration cal = image.getCalibration();
        cal.pixelHeight = size;
        cal.setYUnit("micron");
    }

    @Override
    public void save() throws IOException {
        IJImageSink.writeTIF(image, file);
    }

    @Override
    public String toString() {
        return "Kymograph:"+id+"("+getName()+")";
    }
}
