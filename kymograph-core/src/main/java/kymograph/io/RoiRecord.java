package kymograph.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored ROI: a group of shapes, possibly one per timepoint
 */
public class RoiRecord {
    final long id;
    final List<ShapeRecord> shapes;

    public RoiRecord(long id, List<ShapeRecord> shapes) {
        this.id = id;
        this.shapes = shapes==null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(shapes));
    }

    public long getId() {
        return id;
    }

    public List<ShapeRecord> getShapes() {
        return shapes;
    }

    @Override
    public String toString() {
        return "ROI:"+id+" "+shapes;
    }
}
