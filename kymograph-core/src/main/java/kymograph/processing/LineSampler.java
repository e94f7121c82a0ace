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

import kymograph.geom.Point;
import kymograph.image.BoundingBox;
import kymograph.image.Image;
import kymograph.image.SimpleBoundingBox;
import kymograph.image.SimpleImageProperties;
import kymograph.image.TypeConverter;
import kymograph.io.PixelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Extracts a band of fixed width along a segment of a plane, oriented so that the segment is horizontal with its first point on the left.
 */
public class LineSampler {
    public final static Logger logger = LoggerFactory.getLogger(LineSampler.class);
    final Rotator rotator;

    public LineSampler(Rotator rotator) {
        if (rotator==null) throw new IllegalArgumentException("Rotator cannot be null");
        this.rotator = rotator;
    }

    public LineSampler() {
        this(Interpolation.BICUBIC.getRotator());
    }

    public Rotator getRotator() {
        return rotator;
    }

    /**
     * @return counter-clockwise rotation in degrees (as displayed) that brings the segment [{@param p1}; {@param p2}] horizontal with {@param p1} on the left
     */
    public static double getRotationAngle(Point p1, Point p2) {
        return Math.toDegrees(Math.atan2(p2.getY() - p1.getY(), p2.getX() - p1.getX()));
    }

    /**
     * @return length of the strip sampled along [{@param p1}; {@param p2}], in pixels
     */
    public static int getLength(Point p1, Point p2) {
        return (int)Math.floor(p1.dist(p2));
    }

    /**
     * Rectangle covering the segment, extended by {@param width} perpendicularly to it. May lie partially or totally outside the image
     * @return rectangle in pixel coordinates, z = 0
     */
    public static SimpleBoundingBox getSamplingBounds(Point p1, Point p2, int width) {
        double dX = p2.getX() - p1.getX();
        double dY = p2.getY() - p1.getY();
        double length = Math.sqrt(dX * dX + dY * dY);
        // sine and cosine of the angle between the segment and the vertical axis
        double sin = length==0 ? 0 : Math.abs(dX) / length;
        double cos = length==0 ? 1 : Math.abs(dY) / length;
        double extraH = sin * width;
        double extraW = cos * width;
        int left = (int)(Math.min(p1.getX(), p2.getX()) - extraW);
        int right = (int)(Math.max(p1.getX(), p2.getX()) + extraW);
        int top = (int)(Math.min(p1.getY(), p2.getY()) - extraH/2);
        int bottom = (int)(Math.max(p1.getY(), p2.getY()) + extraH/2);
        return new SimpleBoundingBox(left, right-1, top, bottom-1, 0, 0);
    }

    /**
     * Samples the plane (z, c, t) of {@param source} along the segment [{@param p1}; {@param p2}].
     * 8-bit and floating point data keep their type, other integer types are widened to signed 32-bit.
     * @param width strip width in pixels, at least 1
     * @return single plane image of size floor(|p1p2|) x {@param width}. Zero-length segments yield a strip with no column
     * @throws IOException if pixels could not be retrieved from {@param source}
     */
    public Image sample(PixelSource source, int z, int c, int t, Point p1, Point p2, int width) throws IOException {
        if (width<1) throw new IllegalArgumentException("Line width should be at least 1, found: "+width);
        if (z<0 || c<0 || t<0) throw new IllegalArgumentException("Negative plane index: z="+z+" c="+c+" t="+t);
        Image workingType = TypeConverter.getWorkingType(source.getPixelType());
        int length = getLength(p1, p2);
        if (length==0) {
            logger.warn("zero-length segment {} -> {}: empty strip", p1, p2);
            return Image.createEmptyImage("strip", workingType, new SimpleImageProperties(0, width, 1, 1, 1));
        }
        SimpleBoundingBox bounds = getSamplingBounds(p1, p2, width);
        Image tile = getPaddedTile(source, z, c, t, bounds);
        tile = TypeConverter.cast(tile, workingType);
        double angle = getRotationAngle(p1, p2);
        Image rotated = rotator.rotate(tile, angle, true);
        int cropX = Math.floorDiv(rotated.sizeX() - length, 2);
        int cropY = Math.floorDiv(rotated.sizeY() - width, 2);
        logger.debug("sampling {} -> {}: bounds: {}, angle: {}, rotated: {}x{}, crop: [{};{}]", p1, p2, bounds, angle, rotated.sizeX(), rotated.sizeY(), cropX, cropY);
        Image strip = rotator.crop(rotated, SimpleBoundingBox.ofRectangle(cropX, cropY, length, width));
        return TypeConverter.cast(strip, workingType).setName("strip");
    }

    /**
     * Retrieves the part of {@param bounds} located inside the source, and pads it with zeros to the size of {@param bounds}
     */
    static Image getPaddedTile(PixelSource source, int z, int c, int t, BoundingBox bounds) throws IOException {
        BoundingBox sourceBounds = SimpleBoundingBox.ofRectangle(0, 0, source.getSizeX(), source.getSizeY());
        if (!BoundingBox.intersect2D(sourceBounds, bounds)) {
            logger.debug("sampling bounds: {} outside image", bounds);
            return Image.createEmptyImage("tile", source.getPixelType(), new SimpleImageProperties(bounds.sizeX(), bounds.sizeY(), 1, 1, 1));
        }
        SimpleBoundingBox clipped = BoundingBox.getIntersection2D(bounds, sourceBounds);
        int padLeft = clipped.xMin() - bounds.xMin();
        int padRight = bounds.xMax() - clipped.xMax();
        int padTop = clipped.yMin() - bounds.yMin();
        int padBottom = bounds.yMax() - clipped.yMax();
        Image tile = source.getTile(z, c, t, clipped);
        if (padLeft>0 || padRight>0 || padTop>0 || padBottom>0) {
            logger.debug("padding tile: left={} right={} top={} bottom={}", padLeft, padRight, padTop, padBottom);
            tile = tile.pad(padLeft, padRight, padTop, padBottom);
        }
        return tile;
    }
}
