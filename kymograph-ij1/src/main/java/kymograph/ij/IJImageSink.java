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
package kymograph.ij;

import ij.CompositeImage;
import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.FileSaver;
import ij.io.TiffEncoder;
import kymograph.image.Image;
import kymograph.image.wrappers.IJImageWrapper;
import kymograph.io.ImageSink;
import kymograph.io.SourceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Creates kymographs as ImageJ images written as TIFF files in an output directory.
 * When the source image has a file location, it is recorded in the image info
 */
public class IJImageSink implements ImageSink {
    public final static Logger logger = LoggerFactory.getLogger(IJImageSink.class);
    final File outputDir;
    long nextId = 1;

    public IJImageSink(File outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public IJKymographImage createFromPlaneSequence(Iterator<Image> planes, String name, int sizeZ, int sizeC, int sizeT, String description, SourceImage parent) throws IOException {
        if (sizeZ!=1 || sizeT!=1) throw new IllegalArgumentException("Only single Z and T images are supported, found: Z="+sizeZ+" T="+sizeT);
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) throw new IOException("Output directory: "+outputDir+" could not be created");
        List<Image> planesC = new ArrayList<>(sizeC);
        while (planes.hasNext()) planesC.add(planes.next());
        if (planesC.size()!=sizeC) throw new IllegalArgumentException("Expected "+sizeC+" planes, found: "+planesC.size());
        ImagePlus imp = IJImageWrapper.getImagePlus(name, planesC);
        if (sizeC>1) imp = new CompositeImage(imp, CompositeImage.COMPOSITE);
        String info = description;
        if (parent instanceof IJSourceImage && parent.hasLinkableParent()) info += "\nsource: "+((IJSourceImage)parent).getFilePath();
        imp.setProperty("Info", info);
        IJKymographImage res = new IJKymographImage(nextId++, imp, new File(outputDir, name+".tif"));
        res.save();
        logger.debug("kymograph: {} ({}x{}x{}) written to: {}", name, imp.getWidth(), imp.getHeight(), sizeC, res.getFile());
        return res;
    }

    /**
     * Writes {@param image} as a TIFF file, with its info and slice labels
     */
    static void writeTIF(ImagePlus image, File file) throws IOException {
        FileInfo fi = image.getFileInfo();
        fi.info = image.getInfoProperty();
        FileSaver fs = new FileSaver(image);
        fi.description = fs.getDescriptionString();
        fi.sliceLabels = image.getStack().getSliceLabels();
        TiffEncoder te = new TiffEncoder(fi);
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(file)))) {
            te.write(out);
        }
    }
}
