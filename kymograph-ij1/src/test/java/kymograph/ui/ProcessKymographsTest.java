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
package kymograph.ui;

import ij.IJ;
import ij.ImagePlus;
import ij.gui.Line;
import ij.gui.Overlay;
import kymograph.core.KymographProcessor;
import kymograph.core.ProcessingResult;
import kymograph.ij.IJKymographImage;
import kymograph.ij.IJTestImages;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class ProcessKymographsTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    File saveMovie(String name, boolean withLine) {
        ImagePlus imp = IJTestImages.createMovie(name, 60, 60, 2, 1, 3);
        if (withLine) imp.setOverlay(new Overlay(new Line(10, 10, 10, 50)));
        File file = new File(folder.getRoot(), name+".tif");
        IJ.saveAsTiff(imp, file.getPath());
        return file;
    }

    JSONObject job(File output, String... images) {
        JSONObject job = new JSONObject();
        JSONArray paths = new JSONArray();
        JSONArray ids = new JSONArray();
        for (int i = 0; i<images.length; ++i) {
            paths.add(images[i]);
            ids.add((long)i);
        }
        job.put("images", paths);
        job.put("imageIds", ids);
        job.put("outputDir", output.getPath());
        job.put("lineWidth", 4L);
        return job;
    }

    @Test
    public void testRun() {
        File output = new File(folder.getRoot(), "output");
        File movie = saveMovie("movie", true);
        File missing = new File(folder.getRoot(), "missing.tif");
        ProcessingResult result = ProcessKymographs.run(job(output, movie.getPath(), missing.getPath(), saveMovie("empty", false).getPath()));
        assertEquals("message", "New kymograph created: movie_kymograph.", result.getMessage());
        assertEquals("missing file is reported", "Image:1", result.getErrors().getExceptions().get(0).key);
        assertEquals("one error", 1, result.getErrors().getExceptions().size());

        IJKymographImage kymograph = (IJKymographImage)result.getKymographs().get(0);
        assertEquals("file", new File(output, "movie_kymograph.tif"), kymograph.getFile());
        ImagePlus reopened = IJ.openImage(kymograph.getFile().getPath());
        assertEquals("length of the line", 40, reopened.getWidth());
        assertEquals("3 timepoints x line width", 12, reopened.getHeight());
        assertEquals("channels", 2, reopened.getNChannels());
        assertEquals("first pixel", 10, reopened.getStack().getProcessor(1).getPixelValue(0, 0), 1e-3);
        assertEquals("last pixel of second channel", 49 + 100 + 2000, reopened.getStack().getProcessor(2).getPixelValue(39, 11), 1e-3);
        assertTrue("source location", reopened.getInfoProperty().endsWith("source: "+movie.getPath()));
    }

    @Test
    public void testNoRoi() {
        ProcessingResult result = ProcessKymographs.run(job(new File(folder.getRoot(), "output"), saveMovie("empty", false).getPath()));
        assertEquals("message", KymographProcessor.NO_ROI_MESSAGE, result.getMessage());
        assertFalse("no error", result.hasErrors());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingOutputDir() {
        JSONObject job = job(folder.getRoot(), "movie.tif");
        job.remove("outputDir");
        ProcessKymographs.run(job);
    }

    @Test
    public void testReadJob() throws Exception {
        File jobFile = folder.newFile("job.json");
        Files.write(jobFile.toPath(), "{\"images\":[\"a.tif\"], \"imageIds\":[0], \"outputDir\":\"out\", \"interpolation\":\"NLINEAR\"}".getBytes(StandardCharsets.UTF_8));
        JSONObject job = ProcessKymographs.readJob(jobFile.getPath());
        assertEquals("out", job.get("outputDir"));
        assertEquals("NLINEAR", job.get("interpolation"));
    }
}
