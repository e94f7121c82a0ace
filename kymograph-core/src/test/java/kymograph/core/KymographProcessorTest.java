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
import kymograph.image.ImageShort;
import kymograph.io.LineRecord;
import kymograph.io.PolylineRecord;
import kymograph.io.RoiRecord;
import kymograph.io.ShapeRecord;
import kymograph.test_utils.FakeImageSink;
import kymograph.test_utils.FakeImageSink.FakeKymograph;
import kymograph.test_utils.FakeRoiSource;
import kymograph.test_utils.FakeSourceImage;
import kymograph.utils.Pair;
import org.junit.Before;
import org.junit.Test;

import java.awt.Color;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class KymographProcessorTest {
    FakeRoiSource rois;
    FakeImageSink sink;
    KymographParameters parameters;

    @Before
    public void setUp() {
        rois = new FakeRoiSource();
        sink = new FakeImageSink();
        parameters = new KymographParameters();
    }

    static FakeSourceImage movie(long id, int sizeC, int sizeT) {
        return new FakeSourceImage(id, "movie"+id, 100, 100, 1, sizeC, sizeT, new ImageShort("", 0, 0, 0), (x, y, z, c, t) -> y + 100 * c + 1000 * t);
    }

    static RoiRecord lineRoi(long id) {
        return new RoiRecord(id, Collections.singletonList(new LineRecord(0, 0, 10, 10, 10, 50)));
    }

    @Test
    public void testSingleKymograph() {
        FakeSourceImage image = movie(1, 2, 4);
        rois.add(1, lineRoi(11));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Collections.singletonList(image));
        assertFalse("no error", result.hasErrors());
        assertEquals("one kymograph", 1, result.getKymographs().size());
        assertEquals("message", "New kymograph created: movie1_kymograph.", result.getMessage());
        FakeKymograph k = sink.getCreated().get(0);
        assertEquals("name", "movie1_kymograph", k.name);
        assertEquals("sizeZ", 1, k.sizeZ);
        assertEquals("sizeC", 2, k.sizeC);
        assertEquals("sizeT", 1, k.sizeT);
        assertSame("parent", image, k.parent);
        assertEquals("planes", 2, k.planes.size());
        assertEquals("plane width", 40, k.planes.get(1).sizeX());
        assertEquals("plane height", 16, k.planes.get(1).sizeY());
        assertEquals("last timepoint of second channel", 3149, k.planes.get(1).getPixel(39, 15, 0), 0);
        assertEquals("description", "Kymograph generated from Image ID: 1, line: {theZ: 0, x1: 10, y1: 10, x2: 10, y2: 50}\nwith each timepoint being 4 vertical pixels", k.description);
        assertEquals("saved once", 1, k.saveCount);
    }

    @Test
    public void testMetadata() {
        FakeSourceImage image = movie(1, 2, 5).setFrameInterval(3d).setPhysicalSizeX(0.065);
        rois.add(1, lineRoi(11));
        new KymographProcessor(rois, sink, parameters.setLineWidth(2).setPixelSize(0.1).setTimeIncrement(10d)).process(Collections.singletonList(image));
        FakeKymograph k = sink.getCreated().get(0);
        assertEquals("channel names", "channel0", k.channelNames.get(0));
        assertEquals("channel names", "channel1", k.channelNames.get(1));
        assertEquals("channel colors", Color.GREEN, k.channelColors.get(0));
        assertEquals("channel colors", Color.RED, k.channelColors.get(1));
        assertEquals("physical size X from image", 0.065, k.physicalSizeX, 1e-12);
        assertEquals("physical size Y: time interval / line width", 1.5, k.physicalSizeY, 1e-12);
    }

    @Test
    public void testDefaultCalibration() {
        FakeSourceImage image = movie(1, 1, 3);
        rois.add(1, lineRoi(11));
        new KymographProcessor(rois, sink, parameters.setPixelSize(0.1).setTimeIncrement(8d)).process(Collections.singletonList(image));
        FakeKymograph k = sink.getCreated().get(0);
        assertEquals("physical size X from parameters", 0.1, k.physicalSizeX, 1e-12);
        assertEquals("physical size Y from parameters", 2, k.physicalSizeY, 1e-12);
    }

    @Test
    public void testUnknownCalibration() {
        rois.add(1, lineRoi(11));
        new KymographProcessor(rois, sink, parameters).process(Collections.singletonList(movie(1, 1, 3)));
        FakeKymograph k = sink.getCreated().get(0);
        assertNull("physical size X", k.physicalSizeX);
        assertNull("physical size Y", k.physicalSizeY);
    }

    @Test
    public void testSeveralKymographs() {
        rois.add(1, lineRoi(11), new RoiRecord(12, Collections.singletonList(new PolylineRecord(0, 0, "points[10,10, 30,10, 30,40]"))));
        rois.add(2, lineRoi(21));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Arrays.asList(movie(1, 1, 3), movie(2, 1, 3)));
        assertEquals("kymographs of all images are counted", 3, result.getKymographs().size());
        assertEquals("message", "3 new kymographs created.", result.getMessage());
        assertTrue("polyline description", sink.getCreated().get(1).description.startsWith("Kymograph generated from Image ID: 1, polyline: "));
    }

    @Test
    public void testNotAttached() {
        rois.add(1, lineRoi(11));
        rois.add(2, lineRoi(21));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Arrays.asList(movie(1, 1, 3), movie(2, 1, 3).setLinkable(false)));
        assertEquals("message", "2 new kymographs created but could not be attached.", result.getMessage());
        result = new KymographProcessor(rois, new FakeImageSink(), parameters).process(Collections.singletonList(movie(2, 1, 3).setLinkable(false)));
        assertEquals("message", "New kymograph created but could not be attached: movie2_kymograph.", result.getMessage());
    }

    @Test
    public void testNoRoi() {
        rois.add(1, new RoiRecord(11, Collections.<ShapeRecord>emptyList()));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Arrays.asList(movie(1, 1, 3), movie(2, 1, 3)));
        assertEquals("message", KymographProcessor.NO_ROI_MESSAGE, result.getMessage());
        assertTrue("no kymograph", result.getKymographs().isEmpty());
        assertTrue("nothing created", sink.getCreated().isEmpty());
    }

    @Test
    public void testNotAMovie() {
        FakeSourceImage image = movie(1, 1, 1);
        rois.add(1, lineRoi(11));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Collections.singletonList(image));
        assertEquals("message", KymographProcessor.NO_KYMOGRAPH_MESSAGE, result.getMessage());
        assertEquals("info", Collections.singletonList("Image: 1 is not a movie (sizeT = 1) - Can't create Kymograph"), result.getInfos());
        assertEquals("no pixel read", 0, image.getTileRequests());
    }

    @Test
    public void testInvalidPolylineRoi() {
        rois.add(1, lineRoi(11), new RoiRecord(12, Collections.singletonList(new PolylineRecord(0, 0, "points[1,2]"))));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Collections.singletonList(movie(1, 1, 3)));
        assertEquals("valid ROI is processed", 1, result.getKymographs().size());
        assertEquals("info", Collections.singletonList("ROI: 12 had no lines or polylines"), result.getInfos());
    }

    @Test
    public void testTileFailureIsLocalized() {
        rois.add(1, lineRoi(11));
        rois.add(2, lineRoi(21));
        FakeSourceImage failing = movie(1, 1, 3).setTileFailure(new IOException("connection lost"));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Arrays.asList(failing, movie(2, 1, 3)));
        assertTrue("error", result.hasErrors());
        assertEquals("one error", 1, result.getErrors().getExceptions().size());
        Pair<String, Throwable> error = result.getErrors().getExceptions().get(0);
        assertEquals("localizer", "Image:1", error.key);
        assertTrue("IOException is unwrapped", error.value instanceof IOException);
        assertEquals("other image is processed", 1, result.getKymographs().size());
        assertEquals("message", "New kymograph created: movie2_kymograph.", result.getMessage());
    }

    @Test
    public void testRoiFailureIsLocalized() {
        rois.setFailing(1).add(2, lineRoi(21));
        ProcessingResult result = new KymographProcessor(rois, sink, parameters).process(Arrays.asList(movie(1, 1, 3), movie(2, 1, 3)));
        assertEquals("localizer", "Image:1", result.getErrors().getExceptions().get(0).key);
        assertEquals("other image is processed", 1, result.getKymographs().size());
    }

    @Test
    public void testMessages() {
        assertEquals(KymographProcessor.NO_KYMOGRAPH_MESSAGE, KymographProcessor.getMessage(Collections.emptyList(), true));
        assertEquals(KymographProcessor.NO_KYMOGRAPH_MESSAGE, KymographProcessor.getMessage(Collections.emptyList(), false));
    }
}
