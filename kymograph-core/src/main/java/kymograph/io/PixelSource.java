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

import kymograph.image.BoundingBox;
import kymograph.image.Image;

import java.io.IOException;

/**
 * Access to the raw planes of a 5D (XYZCT) image, tile by tile
 */
public interface PixelSource {
    int getSizeX();
    int getSizeY();

    /**
     * @return empty image of the type used to store pixel values of this source
     */
    Image getPixelType();

    /**
     * @param tile rectangle in pixel coordinates, must be included in the XY bounds of the source. Z coordinates are ignored
     * @return single plane image of the size of {@param tile}
     * @throws IOException if pixels could not be retrieved
     */
    Image getTile(int z, int c, int t, BoundingBox tile) throws IOException;
}
