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

import kymograph.geom.Point;
import kymograph.geom.Shape;
import kymograph.image.Image;
import kymograph.io.PixelSource;
import kymograph.processing.LineSampler;
import kymograph.processing.StripReconciler;
import kymograph.utils.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds kymograph planes: one row of height line width per sampled timepoint, stacked in ascending timepoint order.
 * Each row is the concatenation of the strips sampled along the segments of the shape governing its timepoint.
 */
public class KymographAssembler {
    public final static Logger logger = LoggerFactory.getLogger(KymographAssembler.class);
    final LineSampler sampler;
    final int lineWidth;

    public KymographAssembler(LineSampler sampler, int lineWidth) {
        if (lineWidth<1) throw new IllegalArgumentException("Line width should be at least 1, found: "+lineWidth);
        this.sampler = sampler;
        this.lineWidth = lineWidth;
    }

    public int getLineWidth() {
        return lineWidth;
    }

    /**
     * @return one row of height line width: strips of all segments of {@param shape}, from left to right in point order
     */
    public Image sampleRow(PixelSource source, int c, int t, Shape shape) throws IOException {
        List<Image> strips = new ArrayList<>(shape.getSegmentCount());
        for (int i = 0; i<shape.getSegmentCount(); ++i) {
            Point[] segment = shape.getSegment(i);
            strips.add(sampler.sample(source, shape.getTheZ(), c, t, segment[0], segment[1], lineWidth));
        }
        return StripReconciler.concatenateSegments(strips);
    }

    /**
     * Lines: rows are cropped or padded to the length of the first row. Polylines: rows are padded to the longest row.
     * @return kymograph plane of channel {@param c}
     * @throws IOException if a tile could not be retrieved
     */
    public Image buildPlane(PixelSource source, int c, int sizeT, ShapeSchedule<? extends Shape> schedule) throws IOException {
        List<? extends Pair<Integer, ? extends Shape>> timepoints = schedule.resolve(sizeT);
        if (timepoints.isEmpty()) throw new IllegalArgumentException("No timepoint to sample: schedule: "+schedule+" sizeT: "+sizeT);
        List<Image> rows = new ArrayList<>(timepoints.size());
        for (Pair<Integer, ? extends Shape> p : timepoints) rows.add(sampleRow(source, c, p.key, p.value));
        rows = schedule.isLine() ? StripReconciler.fitToFirst(rows) : StripReconciler.padToLongest(rows);
        Image plane = StripReconciler.stackRows("kymograph_c"+c, rows);
        logger.debug("channel: {}, {} rows, plane: {}x{}", c, rows.size(), plane.sizeX(), plane.sizeY());
        return plane;
    }

    /**
     * @return lazy sequence of one plane per channel, in channel order
     */
    public PlaneSequence getPlanes(PixelSource source, int sizeC, int sizeT, ShapeSchedule<? extends Shape> schedule) {
        return new PlaneSequence(this, source, sizeC, sizeT, schedule);
    }
}
