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
import ij.ImageStack;
import ij.io.FileInfo;
import ij.measure.Calibration;
import ij.process.ImageProcessor;
import ij.process.LUT;
import kymograph.image.*;
import kymograph.image.wrappers.IJImageWrapper;
import kymograph.io.SourceImage;

import java.awt.Color;
import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * ImageJ hyperstack exposed as a kymograph source. Tiles are copies of the stack's pixels
 */
public class IJSourceImage implements SourceImage {
    final long id;
    final ImagePlus image;

    public IJSourceImage(long id, ImagePlus image) {
        if (image.getBitDepth()==24) throw new IllegalArgumentException("RGB images are not supported: "+image.getTitle());
        this.id = id;
        this.image = image;
    }

    public ImagePlus getImagePlus() {
        return image;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        String title = image.getShortTitle();
        return title==null || title.isEmpty() ? image.getTitle() : title;
    }

    @Override public int getSizeX() { return image.getWidth(); }
    @Override public int getSizeY() { return image.getHeight(); }
    @Override public int getSizeZ() { return image.getNSlices(); }
    @Override public int getSizeC() { return image.getNChannels(); }
    @Override public int getSizeT() { return image.getNFrames(); }

    @Override
    public Image getPixelType() {
        switch (image.getBitDepth()) {
            case 8:
                return new ImageByte("", 0, 0, 0);
            case 16:
                return new ImageShort("", 0, 0, 0);
            default:
                return new ImageFloat("", 0, 0, 0);
        }
    }

    @Override
    public Image getTile(int z, int c, int t, BoundingBox tile) {
        if (!BoundingBox.isIncluded2D(tile, SimpleBoundingBox.ofRectangle(0, 0, getSizeX(), getSizeY()))) throw new IllegalArgumentException("Tile: "+tile+" outside image: "+getSizeX()+"x"+getSizeY());
        if (z>=getSizeZ() || c>=getSizeC() || t>=getSizeT()) throw new IllegalArgumentException("Plane (z="+z+", c="+c+", t="+t+") outside image: Z="+getSizeZ()+" C="+getSizeC()+" T="+getSizeT());
        ImageProcessor ip = image.getStack().getProcessor(image.getStackIndex(c+1, z+1, t+1));
        ip.setRoi(tile.xMin(), tile.yMin(), tile.sizeX(), tile.sizeY());
        return IJImageWrapper.wrap(ip.crop()).setName(getName());
    }

    /**
     * Channel names are read from the slice labels of the first plane of each channel
     */
    @Override
    public List<String> getChannelNames() {
        ImageStack stack = image.getStack();
        List<String> res = new ArrayList<>(getSizeC());
        for (int c = 0; c<getSizeC(); ++c) res.add(stack.getShortSliceLabel(image.getStackIndex(c+1, 1, 1)));
        return res;
    }

    /**
     * @return color of the brightest entry of each channel LUT
     */
    @Override
    public List<Color> getChannelColors() {
        List<Color> res = new ArrayList<>(getSizeC());
        for (int c = 0; c<getSizeC(); ++c) {
            LUT lut = image.isComposite() ? ((CompositeImage)image).getChannelLut(c+1) : image.getProcessor().getLut();
            res.add(lut==null ? Color.WHITE : new Color(lut.getRed(255), lut.getGreen(255), lut.getBlue(255)));
        }
        return res;
    }

    /**
     * ImageJ does not record acquisition time per plane
     * @return null
     */
    @Override
    public Double getDeltaT(int z, int c, int t) {
        return null;
    }

    @Override
    public Double getTimeIncrement() {
        Calibration cal = image.getCalibration();
        if (cal.frameInterval<=0) return null;
        return cal.frameInterval * getTimeUnitToSeconds(cal.getTimeUnit());
    }

    @Override
    public Double getPhysicalSizeX() {
        Calibration cal = image.getCalibration();
        if (!cal.scaled()) return null;
        return cal.pixelWidth * getLengthUnitToMicrons(cal.getXUnit());
    }

    /**
     * @return true if the image was opened from a file: kymographs reference its location
     */
    @Override
    public boolean hasLinkableParent() {
        FileInfo fi = image.getOriginalFileInfo();
        return fi!=null && fi.directory!=null && !fi.directory.isEmpty();
    }

    public String getFilePath() {
        FileInfo fi = image.getOriginalFileInfo();
        if (fi==null || fi.directory==null) return null;
        return new File(fi.directory, fi.fileName).getPath();
    }

    static double getTimeUnitToSeconds(String unit) {
        if (unit==null) return 1;
        switch (unit) {
            case "ms":
            case "msec":
                return 1e-3;
            case "min":
                return 60;
            case "h":
            case "hr":
                return 3600;
            default:
                return 1;
        }
    }

    static double getLengthUnitToMicrons(String unit) {
        if (unit==null) return 1;
        switch (unit) {
            case "nm":
                return 1e-3;
            case "mm":
                return 1e3;
            case "cm":
                return 1e4;
            default:
                return 1;
        }
    }

    @Override
    public String toString() {
        return "Image:"+id+"("+getName()+")";
    }
}
