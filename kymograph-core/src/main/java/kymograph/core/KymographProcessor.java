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
import kymograph.io.*;
import kymograph.processing.LineSampler;
import kymograph.utils.MultipleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Creates one kymograph per line / polyline ROI of each image of a batch.
 * A failure on an image stops the processing of this image only, errors are collected and returned with the created kymographs.
 */
public class KymographProcessor {
    public final static Logger logger = LoggerFactory.getLogger(KymographProcessor.class);
    public final static String NO_ROI_MESSAGE = "No ROI containing line or polyline was found.";
    public final static String NO_KYMOGRAPH_MESSAGE = "No kymograph created. See 'Error' or 'Info' for details.";
    final RoiSource roiSource;
    final ImageSink sink;
    final KymographParameters parameters;
    final KymographAssembler assembler;
    final ShapeScheduler scheduler;

    public KymographProcessor(RoiSource roiSource, ImageSink sink, KymographParameters parameters) {
        this.roiSource = roiSource;
        this.sink = sink;
        this.parameters = parameters;
        this.assembler = new KymographAssembler(new LineSampler(parameters.getInterpolation().getRotator()), parameters.getLineWidth());
        this.scheduler = new ShapeScheduler(parameters.isUseAllTimepoints());
    }

    public ProcessingResult process(List<? extends SourceImage> images) {
        MultipleException errors = new MultipleException();
        List<String> infos = new ArrayList<>();
        List<KymographImage> kymographs = new ArrayList<>();
        // keep images with at least one line / polyline
        Map<SourceImage, List<RoiRecord>> roisByImage = new LinkedHashMap<>();
        for (SourceImage image : images) {
            try {
                List<RoiRecord> rois = roiSource.findShapesForImage(image.getId());
                if (rois.stream().anyMatch(ShapeScheduler::hasLineShapes)) roisByImage.put(image, rois);
                else logger.debug("Image: {} has no line or polyline ROI", image.getId());
            } catch (IOException | RuntimeException e) {
                logger.error("Image: {} ROIs could not be retrieved", image.getId(), e);
                errors.addException(getLocalizer(image), e);
            }
        }
        if (roisByImage.isEmpty()) {
            logger.info(NO_ROI_MESSAGE);
            return new ProcessingResult(kymographs, NO_ROI_MESSAGE, infos, errors);
        }
        boolean attached = true;
        for (Map.Entry<SourceImage, List<RoiRecord>> e : roisByImage.entrySet()) {
            SourceImage image = e.getKey();
            if (image.getSizeT()==1) {
                String info = String.format("Image: %s is not a movie (sizeT = 1) - Can't create Kymograph", image.getId());
                logger.warn(info);
                infos.add(info);
                continue;
            }
            List<KymographImage> imageKymographs = new ArrayList<>();
            try {
                for (RoiRecord roi : e.getValue()) {
                    KymographImage k = createKymograph(image, roi, infos);
                    if (k!=null) imageKymographs.add(k);
                }
            } catch (IOException | RuntimeException ex) {
                Throwable cause = ex instanceof UncheckedIOException ? ex.getCause() : ex;
                logger.error("Image: {} kymograph creation failed", image.getId(), cause);
                errors.addException(getLocalizer(image), cause);
            }
            if (!imageKymographs.isEmpty() && !image.hasLinkableParent()) attached = false;
            kymographs.addAll(imageKymographs);
        }
        String message = getMessage(kymographs, attached);
        logger.info(message);
        return new ProcessingResult(kymographs, message, infos, errors);
    }

    /**
     * @return created kymograph or null if {@param roi} holds no usable line or polyline
     */
    protected KymographImage createKymograph(SourceImage image, RoiRecord roi, List<String> infos) throws IOException {
        ShapeSchedule<? extends Shape> schedule = scheduler.schedule(roi);
        if (schedule==null) {
            String info = String.format("ROI: %s had no lines or polylines", roi.getId());
            logger.warn(info);
            infos.add(info);
            return null;
        }
        KymographDescriptor descriptor = KymographDescriptor.of(image, schedule, parameters);
        logger.info("Creating Kymograph image from '{}' ROI: {}. First {}: {}", schedule.isLine() ? "line" : "polyline", roi.getId(), schedule.isLine() ? "line" : "polyline", schedule.getFirstShape());
        PlaneSequence planes = assembler.getPlanes(image, image.getSizeC(), image.getSizeT(), schedule);
        KymographImage kymograph = sink.createFromPlaneSequence(planes, descriptor.getName(), 1, image.getSizeC(), 1, descriptor.getDescription(), image);
        applyMetadata(image, descriptor, kymograph);
        return kymograph;
    }

    /**
     * Copies channel names and colors of {@param image}, and sets physical sizes when known
     */
    protected static void applyMetadata(SourceImage image, KymographDescriptor descriptor, KymographImage kymograph) throws IOException {
        List<String> names = image.getChannelNames();
        List<Color> colors = image.getChannelColors();
        logger.debug("Applying channel Names: {} Colors: {}", names, colors.stream().map(c -> c.getRed()+","+c.getGreen()+","+c.getBlue()).collect(Collectors.toList()));
        for (int c = 0; c<kymograph.getSizeC(); ++c) {
            if (c<names.size() && names.get(c)!=null) kymograph.setChannelName(c, names.get(c));
            if (c<colors.size() && colors.get(c)!=null) kymograph.setChannelColor(c, colors.get(c));
        }
        if (descriptor.getPhysicalSizeX()!=null) kymograph.setPhysicalSizeX(descriptor.getPhysicalSizeX());
        if (descriptor.getPhysicalSizeY()!=null) kymograph.setPhysicalSizeY(descriptor.getPhysicalSizeY());
        kymograph.save();
    }

    public static String getMessage(List<KymographImage> kymographs, boolean attached) {
        if (kymographs.isEmpty()) return NO_KYMOGRAPH_MESSAGE;
        String linkMessage = attached ? "" : " but could not be attached";
        if (kymographs.size()==1) return String.format("New kymograph created%s: %s.", linkMessage, kymographs.get(0).getName());
        else return String.format("%s new kymographs created%s.", kymographs.size(), linkMessage);
    }

    static String getLocalizer(SourceImage image) {
        return "Image:"+image.getId();
    }
}
