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
package kymograph.test_utils;

import kymograph.image.*;
import kymograph.io.SourceImage;

import java.awt.Color;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory source image whose pixel values are given by a function of (x, y, z, c, t)
 */
public class FakeSourceImage implements SourceImage {
    final long id;
    final String name;
    final int sizeX, sizeY, sizeZ, sizeC, sizeT;
    final Image type;
    final TestUtils.PixelFunction function;
    List<String> channelNames = new ArrayList<>();
    List<Color> channelColors = new ArrayList<>();
    Double frameInterval, timeIncrement, physicalSizeX;
    boolean linkable = true;
    IOException tileFailure;
    int tileRequests = 0;

    public FakeSourceImage(long id, String name, int sizeX, int sizeY, int sizeZ, int sizeC, int sizeT, Image type, TestUtils.PixelFunction function) {
        this.id = id;
        this.name = name;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeZ = sizeZ;
        this.sizeC = sizeC;
        this.sizeT = sizeT;
        this.type = type;
        this.function = function;
        for (int c = 0; c<sizeC; ++c) {
            channelNames.add("channel"+c);
            channelColors.add(c%2==0 ? Color.GREEN : Color.RED);
        }
    }

    /**
     * @param frameInterval elapsed time between planes of consecutive timepoints
     */
    public FakeSourceImage setFrameInterval(Double frameInterval) {
        this.frameInterval = frameInterval;
        return this;
    }

    public FakeSourceImage setTimeIncrement(Double timeIncrement) {
        this.timeIncrement = timeIncrement;
        return this;
    }

    public FakeSourceImage setPhysicalSizeX(Double physicalSizeX) {
        this.physicalSizeX = physicalSizeX;
        return this;
    }

    public FakeSourceImage setLinkable(boolean linkable) {
        this.linkable = linkable;
        return this;
    }

    /**
     * Subsequent tile requests will throw {@param failure}
     */
    public FakeSourceImage setTileFailure(IOException failure) {
        this.tileFailure = failure;
        return this;
    }

    public int getTileRequests() {
        return tileRequests;
    }

    @Override public long getId() { return id; }
    @Override public String getName() { return name; }
    @Override public int getSizeX() { return sizeX; }
    @Override public int getSizeY() { return sizeY; }
    @Override public int getSizeZ() { return sizeZ; }
    @Override public int getSizeC() { return sizeC; }
    @Override public int getSizeT() { return sizeT; }
    @Override public List<String> getChannelNames() { return channelNames; }
    @Override public List<Color> getChannelColors() { return channelColors; }

    @Override
    public Image getPixelType() {
        return type;
    }

    @Override
    public Image getTile(int z, int c, int t, BoundingBox tile) throws IOException {
        ++tileRequests;
        if (tileFailure!=null) throw tileFailure;
        if (!BoundingBox.isIncluded2D(tile, SimpleBoundingBox.ofRectangle(0, 0, sizeX, sizeY))) throw new IllegalArgumentException("tile: "+tile+" outside image");
        Image res = Image.createEmptyImage("tile", type, new SimpleImageProperties(tile.sizeX(), tile.sizeY(), 1, 1, 1));
        for (int y = 0; y<tile.sizeY(); ++y) {
            for (int x = 0; x<tile.sizeX(); ++x) res.setPixel(x, y, 0, function.value(x + tile.xMin(), y + tile.yMin(), z, c, t));
        }
        return res;
    }

    @Override
    public Double getDeltaT(int z, int c, int t) {
        return frameInterval==null ? null : t * frameInterval;
    }

    @Override
    public Double getTimeIncrement() {
        return timeIncrement;
    }

    @Override
    public Double getPhysicalSizeX() {
        return physicalSizeX;
    }

    @Override
    public boolean hasLinkableParent() {
        return linkable;
    }
}
