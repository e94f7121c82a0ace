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
import kymograph.image.ImageInt;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static kymograph.test_utils.TestUtils.assertValues;
import static kymograph.test_utils.TestUtils.createImage;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class StripReconcilerTest {
    static ImageInt strip(double[][] values) {
        return createImage(new ImageInt("", 0, 0, 0), values);
    }

    @Test
    public void testShorterRowIsPadded() {
        Image padded = StripReconciler.fitLength(strip(new double[][]{{1, 2}, {3, 4}}), 4);
        assertValues("pad right with zeros", new double[][]{{1, 2, 0, 0}, {3, 4, 0, 0}}, padded, 0);
    }

    @Test
    public void testLongerRowIsCropped() {
        Image cropped = StripReconciler.fitLength(strip(new double[][]{{1, 2, 3}, {4, 5, 6}}), 2);
        assertValues("rightmost columns discarded", new double[][]{{1, 2}, {4, 5}}, cropped, 0);
    }

    @Test
    public void testSameLength() {
        ImageInt s = strip(new double[][]{{1, 2}});
        assertSame("unchanged", s, StripReconciler.fitLength(s, 2));
    }

    @Test
    public void testFitToFirst() {
        List<Image> rows = StripReconciler.fitToFirst(Arrays.asList(strip(new double[][]{{1, 2, 3}}), strip(new double[][]{{4}}), strip(new double[][]{{5, 6, 7, 8}})));
        assertValues("first", new double[][]{{1, 2, 3}}, rows.get(0), 0);
        assertValues("shorter", new double[][]{{4, 0, 0}}, rows.get(1), 0);
        assertValues("longer", new double[][]{{5, 6, 7}}, rows.get(2), 0);
    }

    @Test
    public void testPolylineRows() {
        Image row0 = StripReconciler.concatenateSegments(Arrays.asList(strip(new double[][]{{1, 2}, {3, 4}}), strip(new double[][]{{5}, {6}})));
        assertValues("segments left to right", new double[][]{{1, 2, 5}, {3, 4, 6}}, row0, 0);
        Image row1 = StripReconciler.concatenateSegments(Arrays.asList(strip(new double[][]{{7, 7, 7, 7}, {8, 8, 8, 8}}), strip(new double[][]{{}, {}})));
        assertEquals("empty segment", 4, row1.sizeX());
        List<Image> rows = StripReconciler.padToLongest(Arrays.asList(row0, row1));
        assertValues("padded to longest", new double[][]{{1, 2, 5, 0}, {3, 4, 6, 0}}, rows.get(0), 0);
        assertSame("longest unchanged", row1, rows.get(1));
        Image plane = StripReconciler.stackRows("plane", rows);
        assertValues("stacked", new double[][]{{1, 2, 5, 0}, {3, 4, 6, 0}, {7, 7, 7, 7}, {8, 8, 8, 8}}, plane, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRowHeightMismatch() {
        StripReconciler.stackRows("plane", Arrays.asList(strip(new double[][]{{1}}), strip(new double[][]{{1}, {2}})));
    }
}
