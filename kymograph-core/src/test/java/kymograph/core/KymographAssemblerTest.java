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

import kymograph.geom.LineShape;
import kymograph.geom.Point;
import kymograph.geom.PolylineShape;
import kymograph.image.Image;
import kymograph.image.ImageInt;
import kymograph.image.ImageShort;
import kymograph.processing.LineSampler;
import kymograph.test_utils.FakeSourceImage;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.Assert.*;

public class KymographAssemblerTest {

    static FakeSourceImage movie(int sizeC, int sizeT) {
        return new FakeSourceImage(1, "movie", 100, 100, 1, sizeC, sizeT, new ImageShort("", 0, 0, 0), (x, y, z, c, t) -> y + 100 * c + 1000 * t);
    }

    static <S extends kymograph.geom.Shape> ShapeSchedule<S> schedule(boolean useAll, Object... tAndShapes) {
        Map<Integer, S> shapes = new HashMap<>();
        for (int i = 0; i<tAndShapes.length; i+=2) shapes.put((Integer)tAndShapes[i], (S)tAndShapes[i+1]);
        return new ShapeSchedule<>(shapes, useAll);
    }

    @Test
    public void testSingleLineAllTimepoints() throws IOException {
        FakeSourceImage source = movie(2, 4);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 4);
        ShapeSchedule<LineShape> schedule = schedule(true, 0, new LineShape(0, 10, 10, 10, 50));
        for (int c = 0; c<2; ++c) {
            Image plane = assembler.buildPlane(source, c, 4, schedule);
            assertEquals("plane width", 40, plane.sizeX());
            assertEquals("plane height", 16, plane.sizeY());
            assertTrue("16-bit source gives 32-bit plane", plane instanceof ImageInt);
            for (int t = 0; t<4; ++t) {
                for (int r = 0; r<4; ++r) {
                    assertEquals("c="+c+" t="+t+" first column", 10 + 100 * c + 1000 * t, plane.getPixel(0, t * 4 + r, 0), 0);
                    assertEquals("c="+c+" t="+t+" last column", 49 + 100 * c + 1000 * t, plane.getPixel(39, t * 4 + r, 0), 0);
                }
            }
        }
    }

    @Test
    public void testLineRowsFitFirstLength() throws IOException {
        FakeSourceImage source = movie(1, 4);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 2);
        ShapeSchedule<LineShape> schedule = schedule(true, 0, new LineShape(0, 10, 10, 10, 50), 2, new LineShape(0, 20, 10, 20, 40), 3, new LineShape(0, 30, 10, 30, 60));
        Image plane = assembler.buildPlane(source, 0, 4, schedule);
        assertEquals("width of first line", 40, plane.sizeX());
        assertEquals("height", 8, plane.sizeY());
        assertEquals("shorter row is padded", 0, plane.getPixel(35, 2 * 2, 0), 0);
        assertEquals("shorter row keeps its values", 2039, plane.getPixel(29, 2 * 2, 0), 0);
        assertEquals("longer row is cropped on the right", 3049, plane.getPixel(39, 3 * 2, 0), 0);
    }

    @Test
    public void testSparseLines() throws IOException {
        FakeSourceImage source = movie(1, 5);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 4);
        ShapeSchedule<LineShape> schedule = schedule(false, 0, new LineShape(0, 10, 10, 10, 50), 3, new LineShape(0, 12, 10, 12, 50));
        Image plane = assembler.buildPlane(source, 0, 5, schedule);
        assertEquals("two rows", 8, plane.sizeY());
        assertEquals("second row is timepoint 3", 3010, plane.getPixel(0, 4, 0), 0);
    }

    @Test
    public void testSinglePolyline() throws IOException {
        FakeSourceImage source = new FakeSourceImage(1, "movie", 50, 50, 1, 1, 3, new ImageShort("", 0, 0, 0), (x, y, z, c, t) -> 1 + x + 20 * y);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 2);
        ShapeSchedule<PolylineShape> schedule = schedule(true, 0, new PolylineShape(0, Arrays.asList(new Point(0, 0), new Point(10, 0), new Point(10, 10))));
        Image plane = assembler.buildPlane(source, 0, 3, schedule);
        assertEquals("row width: sum of segment lengths", 20, plane.sizeX());
        assertEquals("height: one row of line width per timepoint", 6, plane.sizeY());
        // first segment lies on the top border: upper row is padding
        assertEquals("first segment, upper row", 0, plane.getPixel(3, 0, 0), 0);
        assertEquals("first segment, lower row", 4, plane.getPixel(3, 1, 0), 0);
        assertEquals("second segment starts at its first point", 1 + 10 + 20 * 3, plane.getPixel(13, 0, 0), 0);
    }

    @Test
    public void testPolylineRowsArePaddedToLongest() throws IOException {
        FakeSourceImage source = movie(1, 2);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 2);
        ShapeSchedule<PolylineShape> schedule = schedule(true,
                0, new PolylineShape(0, Arrays.asList(new Point(10, 10), new Point(10, 20), new Point(10, 30))),
                1, new PolylineShape(0, Arrays.asList(new Point(10, 10), new Point(10, 30), new Point(10, 40))));
        Image plane = assembler.buildPlane(source, 0, 2, schedule);
        assertEquals("longest row", 30, plane.sizeX());
        assertEquals("first row padded", 0, plane.getPixel(25, 0, 0), 0);
        assertEquals("second row", 1000 + 10 + 25, plane.getPixel(25, 2, 0), 0);
    }

    @Test
    public void testLazyPlaneSequence() {
        FakeSourceImage source = movie(3, 2);
        KymographAssembler assembler = new KymographAssembler(new LineSampler(), 4);
        PlaneSequence planes = assembler.getPlanes(source, 3, 2, schedule(true, 0, new LineShape(0, 10, 10, 10, 50)));
        assertEquals("nothing sampled before iteration", 0, source.getTileRequests());
        assertTrue(planes.hasNext());
        planes.next();
        assertEquals("one channel sampled", 2, source.getTileRequests());
        planes.next();
        planes.next();
        assertFalse("single pass", planes.hasNext());
        try {
            planes.next();
            fail("sequence is exhausted");
        } catch (NoSuchElementException e) {
            assertEquals("no more sampling", 6, source.getTileRequests());
        }
    }

    @Test
    public void testTileFailure() {
        FakeSourceImage source = movie(1, 2).setTileFailure(new IOException("connection lost"));
        PlaneSequence planes = new KymographAssembler(new LineSampler(), 4).getPlanes(source, 1, 2, schedule(true, 0, new LineShape(0, 10, 10, 10, 50)));
        try {
            planes.next();
            fail("failure is propagated");
        } catch (UncheckedIOException e) {
            assertEquals("cause", "connection lost", e.getCause().getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidLineWidth() {
        new KymographAssembler(new LineSampler(), 0);
    }
}
