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
package kymograph.core;

import kymograph.geom.Shape;
import kymograph.image.Image;
import kymograph.io.PixelSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single-pass sequence of kymograph planes, one per channel. A plane is built only when requested.
 * Tile retrieval failures are rethrown as {@link UncheckedIOException}
 */
public class PlaneSequence implements Iterator<Image> {
    final KymographAssembler assembler;
    final PixelSource source;
    final int sizeC, sizeT;
    final ShapeSchedule<? extends Shape> schedule;
    int nextChannel = 0;

    PlaneSequence(KymographAssembler assembler, PixelSource source, int sizeC, int sizeT, ShapeSchedule<? extends Shape> schedule) {
        if (sizeC<1) throw new IllegalArgumentException("At least one channel is required");
        this.assembler = assembler;
        this.source = source;
        this.sizeC = sizeC;
        this.sizeT = sizeT;
        this.schedule = schedule;
    }

    public int getSizeC() {
        return sizeC;
    }

    @Override
    public boolean hasNext() {
        return nextChannel<sizeC;
    }

    @Override
    public Image next() {
        if (!hasNext()) throw new NoSuchElementException("All "+sizeC+" planes have been consumed");
        int c = nextChannel++;
        try {
            return assembler.buildPlane(source, c, sizeT, schedule);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
