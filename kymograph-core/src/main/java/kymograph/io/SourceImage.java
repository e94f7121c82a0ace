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
package kymograph.io;

import java.awt.Color;
import java.util.List;

/**
 * Time-lapse image a kymograph is built from, along with the metadata carried over to the kymograph
 */
public interface SourceImage extends PixelSource {
    long getId();
    String getName();
    int getSizeZ();
    int getSizeC();
    int getSizeT();
    List<String> getChannelNames();
    List<Color> getChannelColors();

    /**
     * @return time elapsed since the beginning of acquisition for the plane (z, c, t) in seconds, or null if unknown
     */
    Double getDeltaT(int z, int c, int t);

    /**
     * @return time between two consecutive timepoints in seconds, or null if unknown
     */
    Double getTimeIncrement();

    /**
     * @return physical pixel size along X in microns, or null if unknown
     */
    Double getPhysicalSizeX();

    /**
     * @return true if kymographs created from this image can be attached to its container
     */
    boolean hasLinkableParent();
}
