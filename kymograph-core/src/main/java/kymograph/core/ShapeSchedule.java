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
import kymograph.geom.Shape;
import kymograph.utils.Pair;

import java.util.*;

/**
 * Shapes of a single ROI indexed by timepoint, all of the same kind
 * @param <S> shape kind
 */
public class ShapeSchedule<S extends Shape> {
    final TreeMap<Integer, S> shapes;
    final boolean useAllTimepoints;

    /**
     * @param useAllTimepoints if true, timepoints without shape are sampled with the last shape defined before them (or the first shape).
     *                         Forced to true when a single shape is present
     */
    public ShapeSchedule(Map<Integer, S> shapes, boolean useAllTimepoints) {
        if (shapes==null || shapes.isEmpty()) throw new IllegalArgumentException("Schedule requires at least one shape");
        this.shapes = new TreeMap<>(shapes);
        this.useAllTimepoints = useAllTimepoints || shapes.size()==1;
    }

    public boolean isUseAllTimepoints() {
        return useAllTimepoints;
    }

    public int size() {
        return shapes.size();
    }

    public int getFirstTimepoint() {
        return shapes.firstKey();
    }

    /**
     * @return shape with the lowest timepoint. It fixes the reference length of rows in the line case
     */
    public S getFirstShape() {
        return shapes.firstEntry().getValue();
    }

    public S getShape(int t) {
        return shapes.get(t);
    }

    public boolean isLine() {
        return getFirstShape() instanceof LineShape;
    }

    /**
     * @return shape governing each sampled timepoint, in ascending timepoint order
     */
    public List<Pair<Integer, S>> resolve(int sizeT) {
        List<Pair<Integer, S>> res = new ArrayList<>();
        S current = getFirstShape();
        for (int t = 0; t<sizeT; ++t) {
            S s = shapes.get(t);
            if (s!=null) current = s;
            else if (!useAllTimepoints) continue;
            res.add(new Pair<>(t, current));
        }
        return res;
    }

    @Override
    public String toString() {
        return (isLine() ? "lines" : "polylines") + shapes.keySet() + (useAllTimepoints ? " (all timepoints)" : "");
    }
}
