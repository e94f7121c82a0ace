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
package kymograph.io;

import java.awt.Color;
import java.io.IOException;

/**
 * Handle on an image created by an {@link ImageSink}. Metadata changes are persisted by {@link #save()}
 */
public interface KymographImage {
    long getId();
    String getName();
    int getSizeC();
    void setChannelName(int c, String name);
    void setChannelColor(int c, Color color);

    /**
     * @param size physical size in microns
     */
    void setPhysicalSizeX(double size);
    void setPhysicalSizeY(double size);
    void save() throws IOException;
}
