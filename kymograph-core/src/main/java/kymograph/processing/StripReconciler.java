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

import kymograph.image.Image;
import kymograph.image.SimpleBoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes sampled strips so that they can be concatenated into kymograph rows and planes.
 * All strips of a given plane are expected to share the same type.
 */
public class StripReconciler {
    public final static Logger logger = LoggerFactory.getLogger(StripReconciler.class);

    /**
     * Crops or pads with zeros on the right so that {@param strip} has {@param length} columns. Left part is kept.
     * @return {@param strip} itself if it already has the requested length
     */
    public static Image fitLength(Image strip, int length) {
        if (length<0) throw new IllegalArgumentException("Negative length: "+length);
        if (strip.sizeX()==length) return strip;
        logger.trace("fit strip length: {} -> {}", strip.sizeX(), length);
        if (strip.sizeX()<length) return strip.pad(0, length - strip.sizeX(), 0, 0);
        else return strip.crop(SimpleBoundingBox.ofRectangle(0, 0, length, strip.sizeY()));
    }

    /**
     * Line case: every row is cropped or padded to the length of the first row
     */
    public static List<Image> fitToFirst(List<Image> rows) {
        if (rows.isEmpty()) return rows;
        int length = rows.get(0).sizeX();
        List<Image> res = new ArrayList<>(rows.size());
        for (Image row : rows) res.add(fitLength(row, length));
        return res;
    }

    /**
     * Polyline case: concatenates the strips of consecutive segments from left to right
     * @return single row
     */
    public static Image concatenateSegments(List<Image> segmentStrips) {
        if (segmentStrips.isEmpty()) throw new IllegalArgumentException("No segment strip to concatenate");
        if (segmentStrips.size()==1) return segmentStrips.get(0);
        return Image.concatenateX("row", segmentStrips);
    }

    /**
     * Polyline case: every row is padded with zeros on the right to the length of the longest row
     */
    public static List<Image> padToLongest(List<Image> rows) {
        int longest = rows.stream().mapToInt(Image::sizeX).max().orElse(0);
        List<Image> res = new ArrayList<>(rows.size());
        for (Image row : rows) res.add(fitLength(row, longest));
        return res;
    }

    /**
     * Stacks rows from top to bottom
     * @return single plane image
     */
    public static Image stackRows(String name, List<Image> rows) {
        if (rows.isEmpty()) throw new IllegalArgumentException("No row to stack");
        int height = rows.get(0).sizeY();
        for (Image row : rows) if (row.sizeY()!=height) throw new IllegalArgumentException("All rows should have the same height (expected: "+height+" found: "+row.sizeY()+")");
        return Image.concatenateY(name, rows);
    }
}
