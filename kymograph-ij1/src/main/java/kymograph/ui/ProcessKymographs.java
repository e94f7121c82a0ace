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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import kymograph.configuration.KymographParameters;
import kymograph.core.KymographProcessor;
import kymograph.core.ProcessingResult;
import kymograph.ij.IJImageRepository;
import kymograph.ij.IJImageSink;
import kymograph.ij.IJRoiSource;
import kymograph.ij.IJSourceImage;
import kymograph.utils.JSONUtils;
import kymograph.utils.MultipleException;
import kymograph.utils.Pair;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Headless kymograph job. Single argument: path of a JSON job file holding the list of image files ("images", ids are indices in this list),
 * the output directory ("outputDir") and the kymograph parameters
 */
public class ProcessKymographs {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(ProcessKymographs.class);

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        if (args.length==0) {
            logger.error("Missing argument: job file");
            return;
        } else if (args.length>1) {
            logger.error("Too many arguments. Expect only path of job file");
            return;
        }
        ProcessingResult result;
        try {
            result = run(readJob(args[0]));
        } catch (IOException | ParseException | IllegalArgumentException | ClassCastException e) {
            logger.error("Job file: {} could not be read", args[0], e);
            return;
        }
        logger.info(result.getMessage());
        for (String info : result.getInfos()) logger.info("Info: {}", info);
        for (Pair<String, Throwable> e : result.getErrors().getExceptions()) logger.error("Error @ {}", e.key, e.value);
    }

    public static JSONObject readJob(String path) throws IOException, ParseException {
        return JSONUtils.parse(new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8));
    }

    public static ProcessingResult run(JSONObject job) {
        if (!job.containsKey("images")) throw new IllegalArgumentException("Missing parameter: images");
        if (!job.containsKey("outputDir")) throw new IllegalArgumentException("Missing parameter: outputDir");
        KymographParameters parameters = new KymographParameters();
        parameters.initFromJSONEntry(job);
        List<String> paths = new ArrayList<>();
        for (String p : JSONUtils.fromStringArray((List)job.get("images"))) paths.add(p);
        IJImageRepository repository = new IJImageRepository(paths);
        logger.info("Processing {} image(s) with parameters: {}", parameters.getImageIds().size(), parameters);
        MultipleException openErrors = new MultipleException();
        List<IJSourceImage> images = new ArrayList<>();
        for (long id : parameters.getImageIds()) {
            try {
                images.add(repository.getImage(id));
            } catch (IOException e) {
                logger.error("Image: {} could not be opened", id, e);
                openErrors.addException("Image:"+id, e);
            }
        }
        KymographProcessor processor = new KymographProcessor(new IJRoiSource(repository), new IJImageSink(new File((String)job.get("outputDir"))), parameters);
        ProcessingResult result = processor.process(images);
        result.getErrors().addExceptions(openErrors.getExceptions());
        return result;
    }
}
