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

import kymograph.configuration.KymographParameters;
import kymograph.geom.Shape;
import kymograph.io.SourceImage;

/**
 * Name, description and calibration of a kymograph
 */
public class KymographDescriptor {
    public final static String NAME_SUFFIX = "_kymograph";
    final String name, description;
    final Double pixelSize, timeInterval;
    final int lineWidth;

    public KymographDescriptor(String name, String description, Double pixelSize, Double timeInterval, int lineWidth) {
        this.name = name;
        this.description = description;
        this.pixelSize = pixelSize;
        this.timeInterval = timeInterval;
        this.lineWidth = lineWidth;
    }

    public static KymographDescriptor of(SourceImage image, ShapeSchedule<? extends Shape> schedule, KymographParameters parameters) {
        return new KymographDescriptor(getName(image.getName()), getDescription(image.getId(), schedule, parameters.getLineWidth()), getPixelSize(image, parameters.getPixelSize()), getTimeInterval(image, parameters.getTimeIncrement()), parameters.getLineWidth());
    }

    public static String getName(String sourceName) {
        return sourceName + NAME_SUFFIX;
    }

    public static String getDescription(long imageId, ShapeSchedule<? extends Shape> schedule, int lineWidth) {
        Shape first = schedule.getFirstShape();
        String geometry = schedule.isLine() ? "line: " + first : "polyline: " + first.getPoints();
        return String.format("Kymograph generated from Image ID: %s, %s", imageId, geometry)
                + String.format("\nwith each timepoint being %s vertical pixels", lineWidth);
    }

    /**
     * First available of: elapsed time of the last timepoint (z=0, c=0) divided by the number of intervals, time increment of the image, {@param defaultTimeIncrement}
     * @return time interval in seconds or null if unknown
     */
    public static Double getTimeInterval(SourceImage image, Double defaultTimeIncrement) {
        int sizeT = image.getSizeT();
        Double duration = image.getDeltaT(0, 0, sizeT - 1);
        if (duration!=null) return sizeT==1 ? duration : duration / (sizeT - 1);
        if (image.getTimeIncrement()!=null) return image.getTimeIncrement();
        return defaultTimeIncrement;
    }

    /**
     * @return physical size X of the image if known, else {@param defaultPixelSize}
     */
    public static Double getPixelSize(SourceImage image, Double defaultPixelSize) {
        if (image.getPhysicalSizeX()!=null) return image.getPhysicalSizeX();
        return defaultPixelSize;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return physical size along X (microns) or null if unknown
     */
    public Double getPhysicalSizeX() {
        return pixelSize;
    }

    /**
     * Each timepoint spans line width pixels along Y
     * @return time interval divided by line width, or null if unknown
     */
    public Double getPhysicalSizeY() {
        if (timeInterval==null) return null;
        return timeInterval / lineWidth;
    }

    public Double getTimeInterval() {
        return timeInterval;
    }
}
