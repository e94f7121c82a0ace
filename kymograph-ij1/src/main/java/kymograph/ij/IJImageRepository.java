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

import ij.IJ;
import ij.ImagePlus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Image files identified by their index in a list of paths. Opened images are cached
 */
public class IJImageRepository {
    public final static Logger logger = LoggerFactory.getLogger(IJImageRepository.class);
    final List<String> paths;
    final Map<Long, IJSourceImage> images = new HashMap<>();

    public IJImageRepository(List<String> paths) {
        this.paths = new ArrayList<>(paths);
    }

    /**
     * Registers an already opened image
     * @return id of {@param image}
     */
    public long add(ImagePlus image) {
        long id = paths.size();
        paths.add(null);
        images.put(id, new IJSourceImage(id, image));
        return id;
    }

    public boolean contains(long id) {
        return id>=0 && id<paths.size();
    }

    /**
     * @throws IOException if there is no image with this id or if the file cannot be opened
     */
    public IJSourceImage getImage(long id) throws IOException {
        IJSourceImage res = images.get(id);
        if (res!=null) return res;
        if (!contains(id)) throw new IOException("Image: "+id+" not found");
        String path = paths.get((int)id);
        if (!new File(path).isFile()) throw new IOException("File: "+path+" not found");
        logger.debug("opening image: {} from: {}", id, path);
        ImagePlus imp = IJ.openImage(path);
        if (imp==null) throw new IOException("File: "+path+" could not be opened");
        try {
            res = new IJSourceImage(id, imp);
        } catch (IllegalArgumentException e) {
            throw new IOException("File: "+path+" could not be opened", e);
        }
        images.put(id, res);
        return res;
    }
}
