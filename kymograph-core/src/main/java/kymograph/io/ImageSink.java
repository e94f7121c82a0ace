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

import kymograph.image.Image;

import java.io.IOException;
import java.util.Iterator;

/**
 * Creates new images from a sequence of planes
 */
public interface ImageSink {
    /**
     * Planes are consumed once, in order Z then C then T
     * @param parent image the new one is derived from
     * @return handle on the created image
     * @throws IOException if the image could not be created
     */
    KymographImage createFromPlaneSequence(Iterator<Image> planes, String name, int sizeZ, int sizeC, int sizeT, String description, SourceImage parent) throws IOException;
}
