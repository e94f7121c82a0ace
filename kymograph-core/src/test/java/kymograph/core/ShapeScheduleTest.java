package kymograph.core;

import kymograph.geom.LineShape;
import kymograph.utils.Pair;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ShapeScheduleTest {
    final LineShape l0 = new LineShape(0, 0, 0, 10, 0);
    final LineShape l3 = new LineShape(0, 0, 5, 10, 5);

    Map<Integer, LineShape> shapesAt0And3() {
        Map<Integer, LineShape> shapes = new HashMap<>();
        shapes.put(3, l3);
        shapes.put(0, l0);
        return shapes;
    }

    @Test
    public void testUseAllTimepoints() {
        ShapeSchedule<LineShape> schedule = new ShapeSchedule<>(shapesAt0And3(), true);
        List<Pair<Integer, LineShape>> resolved = schedule.resolve(5);
        assertEquals("all timepoints", 5, resolved.size());
        for (int t = 0; t<5; ++t) {
            assertEquals("timepoint order", t, (int)resolved.get(t).key);
            assertSame("shape at: "+t, t<3 ? l0 : l3, resolved.get(t).value);
        }
    }

    @Test
    public void testSparseTimepoints() {
        ShapeSchedule<LineShape> schedule = new ShapeSchedule<>(shapesAt0And3(), false);
        List<Pair<Integer, LineShape>> resolved = schedule.resolve(5);
        assertEquals("only timepoints with shape", 2, resolved.size());
        assertEquals("first", 0, (int)resolved.get(0).key);
        assertEquals("second", 3, (int)resolved.get(1).key);
        assertSame("first shape", l0, schedule.getFirstShape());
    }

    @Test
    public void testSingleShapeIsUsedForAllTimepoints() {
        Map<Integer, LineShape> shapes = new HashMap<>();
        shapes.put(2, l3);
        ShapeSchedule<LineShape> schedule = new ShapeSchedule<>(shapes, false);
        assertTrue("single shape implies all timepoints", schedule.isUseAllTimepoints());
        List<Pair<Integer, LineShape>> resolved = schedule.resolve(4);
        assertEquals("all timepoints", 4, resolved.size());
        for (Pair<Integer, LineShape> p : resolved) assertSame("first shape before and after its timepoint", l3, p.value);
        assertEquals("first timepoint", 2, schedule.getFirstTimepoint());
    }

    @Test
    public void testShapesBeyondSizeT() {
        ShapeSchedule<LineShape> schedule = new ShapeSchedule<>(shapesAt0And3(), false);
        assertEquals("timepoint 3 is out of range", 1, schedule.resolve(2).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySchedule() {
        new ShapeSchedule<>(new HashMap<Integer, LineShape>(), true);
    }
}
