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
package kymograph.configuration;

import kymograph.processing.Interpolation;
import kymograph.utils.JSONSerializable;
import kymograph.utils.JSONUtils;
import kymograph.utils.Utils;
import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameters of a kymograph job
 */
public class KymographParameters implements JSONSerializable {
    public final static int DEFAULT_LINE_WIDTH = 4;
    List<Long> imageIds = new ArrayList<>();
    int lineWidth = DEFAULT_LINE_WIDTH;
    boolean useAllTimepoints = true;
    Double timeIncrement, pixelSize;
    Interpolation interpolation = Interpolation.BICUBIC;

    public List<Long> getImageIds() {
        return Collections.unmodifiableList(imageIds);
    }

    public KymographParameters setImageIds(List<Long> imageIds) {
        this.imageIds = new ArrayList<>(imageIds);
        return this;
    }

    public int getLineWidth() {
        return lineWidth;
    }

    public KymographParameters setLineWidth(int lineWidth) {
        if (lineWidth<1) throw new IllegalArgumentException("Line width should be at least 1, found: "+lineWidth);
        this.lineWidth = lineWidth;
        return this;
    }

    /**
     * If false and a ROI holds several shapes, only timepoints with a shape are sampled
     */
    public boolean isUseAllTimepoints() {
        return useAllTimepoints;
    }

    public KymographParameters setUseAllTimepoints(boolean useAllTimepoints) {
        this.useAllTimepoints = useAllTimepoints;
        return this;
    }

    /**
     * @return time increment per timepoint (seconds) used when the source image has no time information, or null
     */
    public Double getTimeIncrement() {
        return timeIncrement;
    }

    public KymographParameters setTimeIncrement(Double timeIncrement) {
        this.timeIncrement = timeIncrement;
        return this;
    }

    /**
     * @return pixel size (microns) used when the source image has no pixel size information, or null
     */
    public Double getPixelSize() {
        return pixelSize;
    }

    public KymographParameters setPixelSize(Double pixelSize) {
        this.pixelSize = pixelSize;
        return this;
    }

    public Interpolation getInterpolation() {
        return interpolation;
    }

    public KymographParameters setInterpolation(Interpolation interpolation) {
        if (interpolation==null) throw new IllegalArgumentException("Interpolation cannot be null");
        this.interpolation = interpolation;
        return this;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("imageIds", JSONUtils.toJSONEntry(imageIds));
        res.put("lineWidth", lineWidth);
        res.put("useAllTimepoints", useAllTimepoints);
        if (timeIncrement!=null) res.put("timeIncrement", timeIncrement);
        if (pixelSize!=null) res.put("pixelSize", pixelSize);
        res.put("interpolation", JSONUtils.toJSONEntry(interpolation));
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        JSONObject json = (JSONObject)jsonEntry;
        if (!json.containsKey("imageIds")) throw new IllegalArgumentException("Missing parameter: imageIds");
        setImageIds(JSONUtils.fromLongArrayToList((List)json.get("imageIds")));
        if (json.containsKey("lineWidth")) setLineWidth(((Number)json.get("lineWidth")).intValue());
        if (json.containsKey("useAllTimepoints")) setUseAllTimepoints((Boolean)json.get("useAllTimepoints"));
        if (json.containsKey("timeIncrement")) setTimeIncrement(((Number)json.get("timeIncrement")).doubleValue());
        if (json.containsKey("pixelSize")) setPixelSize(((Number)json.get("pixelSize")).doubleValue());
        if (json.containsKey("interpolation")) {
            String interp = (String)json.get("interpolation");
            try {
                setInterpolation(Interpolation.valueOf(interp));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown interpolation: "+interp+" should be one of: "+String.join(", ", Utils.toStringArray(Interpolation.values())), e);
            }
        }
    }

    @Override
    public String toString() {
        return JSONUtils.serialize(this);
    }
}
