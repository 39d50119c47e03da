package ed.inf.adbs.pivotgrid;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public class PivotIndexTest {

    private static final List<String> AB = Arrays.asList("A", "B");

    private PivotIndex<String> index;
    private Map<Tuple, String> relation;

    @Before
    public void setUp() {
        index = new PivotIndex<>();
        relation = new LinkedHashMap<>();
        relation.put(Tuple.of(1, 10), "x");
        relation.put(Tuple.of(2, 10), "y");
    }

    private static List<String> dims(String... ids) {
        return Arrays.asList(ids);
    }

    private static List<String> none() {
        return Collections.emptyList();
    }

    @Test
    public void testRowsAndColumnsPivot() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());

        assertEquals("Row header should hold both A values",
                Arrays.asList(Tuple.of(1), Tuple.of(2)), index.getRowHeader());
        assertEquals("Column header should hold the single B value",
                Collections.singletonList(Tuple.of(10)), index.getColumnHeader());
        assertEquals("x", index.getCell(0, 0));
        assertEquals("y", index.getCell(1, 0));
    }

    @Test
    public void testEverythingFrozen() {
        index.reset(relation, AB, none(), none(), dims("A", "B"), Tuple.of(1, 10));

        assertTrue("Row header should be empty", index.getRowHeader().isEmpty());
        assertTrue("Column header should be empty", index.getColumnHeader().isEmpty());
        assertEquals("The singleton cell should hold the sliced payload", "x", index.getCell(0, 0));
        assertEquals(Collections.singletonList(Collections.singletonList("x")),
                index.pivotedData(Collections.singletonList(0), Collections.singletonList(0)));
    }

    @Test
    public void testRemoveShrinksHeader() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());

        AxisDelta delta = index.remove(Collections.singletonList(Tuple.of(2, 10)));

        assertEquals("Row header should shrink by one", -1, delta.getRows());
        assertEquals("Column header should not change", 0, delta.getColumns());
        assertEquals(Collections.singletonList(Tuple.of(1)), index.getRowHeader());
    }

    @Test
    public void testRemoveUnknownKeyIsNoOp() {
        index.reset(relation, AB, null);
        int recomputes = index.getRecomputeCount();

        assertEquals(AxisDelta.NONE, index.remove(Collections.singletonList(Tuple.of(7, 7))));
        assertEquals("Nothing should be recomputed", recomputes, index.getRecomputeCount());
    }

    @Test
    public void testNullPivotPutsEveryDimensionOnRows() {
        index.reset(relation, AB, null);

        assertEquals(AB, index.getPivotRows());
        assertTrue(index.getPivotColumns().isEmpty());
        assertEquals(Arrays.asList(Tuple.of(1, 10), Tuple.of(2, 10)), index.getRowHeader());
        assertEquals("y", index.getCell(1, 0));
    }

    @Test
    public void testEveryCellReassemblesItsKey() {
        Map<Tuple, String> cube = new LinkedHashMap<>();
        for (int a = 0; a < 3; a++) {
            for (int b = 0; b < 2; b++) {
                for (int c = 0; c < 2; c++) {
                    if ((a + b + c) % 3 != 0) {
                        cube.put(Tuple.of(a, "b" + b, c), a + ":" + b + ":" + c);
                    }
                }
            }
        }
        index.reset(cube, dims("A", "B", "C"), dims("C"), dims("A"), dims("B"), Tuple.of("b1"));

        for (int row = 0; row < index.getRowHeader().size(); row++) {
            for (int column = 0; column < index.getColumnHeader().size(); column++) {
                Tuple key = index.fullKey(row, column);
                assertEquals("Key component A comes from the column header",
                        index.columnKey(column).getAttribute(0), key.getAttribute(0));
                assertEquals("Key component B comes from the frozen value", "b1", key.getAttribute(1));
                assertEquals("Key component C comes from the row header",
                        index.rowKey(row).getAttribute(0), key.getAttribute(2));
                assertEquals("Cell should hold the payload of " + key, cube.get(key), index.getCell(row, column));
            }
        }
    }

    @Test
    public void testSamePivotDoesNotRecompute() {
        index.reset(relation, AB, null);
        index.setPivot(dims("B"), dims("A"), none(), Tuple.empty());
        int recomputes = index.getRecomputeCount();

        index.setPivot(dims("B"), dims("A"), none(), Tuple.empty());

        assertEquals("An identical pivot should not trigger a recompute", recomputes, index.getRecomputeCount());
    }

    @Test
    public void testAddAppendsAtTail() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());
        List<Tuple> before = index.getRowHeader();

        Map<Tuple, String> entries = new LinkedHashMap<>();
        entries.put(Tuple.of(1, 20), "z");
        entries.put(Tuple.of(3, 10), "w");
        entries.put(Tuple.of(0, 10), "v");
        AxisDelta delta = index.add(entries);

        assertEquals(new AxisDelta(2, 1), delta);
        List<Tuple> after = index.getRowHeader();
        assertEquals("Existing row values should keep their indices", before, after.subList(0, before.size()));
        assertEquals(Arrays.asList(Tuple.of(3), Tuple.of(0)), after.subList(before.size(), after.size()));
        assertEquals(Arrays.asList(Tuple.of(10), Tuple.of(20)), index.getColumnHeader());
        assertEquals("z", index.getCell(0, 1));
    }

    @Test
    public void testDuplicateDimensionRejected() {
        index.reset(relation, AB, null);
        PivotSpec before = index.getPivot();
        try {
            index.setPivot(dims("A"), dims("A", "B"), none(), Tuple.empty());
            fail("Expected InvalidPivotSpecException");
        } catch (InvalidPivotSpecException e) {
            assertEquals("The previous pivot should stay in effect", before, index.getPivot());
        }
    }

    @Test(expected = InvalidPivotSpecException.class)
    public void testUnknownDimensionRejected() {
        index.reset(relation, AB, null);
        index.setPivot(dims("A", "B", "Z"), none(), none(), Tuple.empty());
    }

    @Test(expected = InvalidPivotSpecException.class)
    public void testUnassignedDimensionRejected() {
        index.reset(relation, AB, null);
        index.setPivot(dims("A"), none(), none(), Tuple.empty());
    }

    @Test(expected = InvalidPivotSpecException.class)
    public void testFrozenValueLengthRejectedBySetPivot() {
        index.reset(relation, AB, null);
        index.setPivot(dims("A"), none(), dims("B"), Tuple.empty());
    }

    @Test
    public void testInvalidResetLeavesIndexUntouched() {
        index.reset(relation, AB, null);
        try {
            index.reset(new LinkedHashMap<Tuple, String>(), dims("A", "B", "C"),
                    dims("A"), none(), none(), Tuple.empty());
            fail("Expected InvalidPivotSpecException");
        } catch (InvalidPivotSpecException e) {
            assertEquals("Relation should be kept", 2, index.size());
            assertEquals("Dimensions should be kept", AB, index.getDimensionIds());
        }
    }

    @Test(expected = FrozenValueLengthMismatchException.class)
    public void testFrozenValueLengthMismatch() {
        index.reset(relation, AB, dims("A"), none(), dims("B"), Tuple.of(10));
        index.setFrozenValue(Tuple.of(10, 20));
    }

    @Test
    public void testSetFrozenValueChangesSlice() {
        relation.put(Tuple.of(3, 20), "z");
        index.reset(relation, AB, dims("A"), none(), dims("B"), Tuple.of(10));
        assertEquals(Arrays.asList(Tuple.of(1), Tuple.of(2)), index.getRowHeader());

        index.setFrozenValue(Tuple.of(20));

        assertEquals(Collections.singletonList(Tuple.of(3)), index.getRowHeader());
        assertEquals("z", index.getCell(0, 0));
    }

    @Test
    public void testOutOfRangeIndex() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());
        try {
            index.rowKey(2);
            fail("Expected PivotIndexOutOfRangeException");
        } catch (PivotIndexOutOfRangeException e) {
            assertTrue(e instanceof IndexOutOfBoundsException);
        }
        try {
            index.getCell(0, 1);
            fail("Expected PivotIndexOutOfRangeException");
        } catch (PivotIndexOutOfRangeException e) {
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testEmptySliceYieldsPlaceholder() {
        index.reset(relation, AB, dims("A"), none(), dims("B"), Tuple.of(99));

        assertTrue("Nothing matches the slice", index.getRowHeader().isEmpty());
        assertEquals(Tuple.unresolved(1), index.rowKey(0));
        assertFalse(index.fullKey(0, 0).isResolved());
        assertNull(index.getCell(0, 0));
    }

    @Test
    public void testUnresolvedProjectionsAreNotHeaderValues() {
        List<Optional<Object>> components = new ArrayList<>();
        components.add(Optional.empty());
        components.add(Optional.of(30));
        relation.put(Tuple.ofOptionals(components), "p");
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());

        assertEquals(Arrays.asList(Tuple.of(1), Tuple.of(2)), index.getRowHeader());
        assertEquals(Arrays.asList(Tuple.of(10), Tuple.of(30)), index.getColumnHeader());
    }

    @Test
    public void testNullPayloadDoesNotOverwrite() {
        index.reset(relation, AB, null);
        int recomputes = index.getRecomputeCount();
        Map<Tuple, String> entries = new LinkedHashMap<>();
        entries.put(Tuple.of(1, 10), null);

        assertEquals(AxisDelta.NONE, index.add(entries));
        assertEquals("x", index.getCell(0, 0));
        assertEquals("Nothing addable means no recompute", recomputes, index.getRecomputeCount());
    }

    @Test
    public void testNullPayloadMakesKeyAddressable() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());
        Map<Tuple, String> entries = new LinkedHashMap<>();
        entries.put(Tuple.of(5, 10), null);

        assertEquals(new AxisDelta(1, 0), index.add(entries));
        assertTrue(index.containsKey(Tuple.of(5, 10)));
        assertNull(index.getCell(2, 0));
    }

    @Test
    public void testAddPicksFrozenValue() {
        index.reset(new LinkedHashMap<Tuple, String>(), AB, dims("A"), none(), dims("B"), Tuple.unresolved(1));

        index.add(relation);

        assertEquals("Frozen value should come from the first key", Tuple.of(10), index.getFrozenValue());
        assertEquals(Arrays.asList(Tuple.of(1), Tuple.of(2)), index.getRowHeader());
    }

    @Test
    public void testUpdateOnlyTouchesKnownKeys() {
        index.reset(relation, AB, null);
        int recomputes = index.getRecomputeCount();
        Map<Tuple, String> entries = new LinkedHashMap<>();
        entries.put(Tuple.of(1, 10), "x2");
        entries.put(Tuple.of(9, 9), "ignored");

        assertEquals(1, index.update(entries));
        assertEquals("x2", index.getCell(0, 0));
        assertEquals("Update should not grow the relation", 2, index.size());
        assertEquals("Update should not recompute headers", recomputes, index.getRecomputeCount());
    }

    @Test
    public void testPivotedData() {
        index.reset(relation, AB, dims("B"), dims("A"), none(), Tuple.empty());

        List<List<String>> data = index.pivotedData(Collections.singletonList(0), Arrays.asList(1, 0));

        assertEquals(Collections.singletonList(Arrays.asList("y", "x")), data);
    }

    @Test
    public void testPivotedDataWithoutAxesOrFullSlice() {
        index.reset(new LinkedHashMap<Tuple, String>(), AB, dims("A"), none(), dims("B"), Tuple.of(10));

        assertTrue(index.pivotedData(Collections.singletonList(0), Collections.singletonList(0)).isEmpty());
    }

    @Test
    public void testDimensionValuesFollowRelation() {
        index.reset(relation, AB, null);
        Map<Tuple, String> entries = new LinkedHashMap<>();
        entries.put(Tuple.of(3, 20), "z");
        index.add(entries);
        assertEquals(new LinkedHashSet<>(Arrays.asList(1, 2, 3)), index.dimensionValues("A"));

        index.remove(Arrays.asList(Tuple.of(1, 10), Tuple.of(2, 10)));

        assertEquals(Collections.singleton(3), index.dimensionValues("A"));
        assertEquals(Collections.singleton(20), index.dimensionValues("B"));
        assertTrue(index.dimensionValues("Z").isEmpty());
    }

    @Test
    public void testFrozenValues() {
        index.reset(relation, AB, dims("A"), none(), dims("B"), Tuple.of(10));

        Set<Tuple> values = index.frozenValues(Arrays.asList(Tuple.of(1, 10), Tuple.of(4, 20), Tuple.of(2, 10)));

        assertEquals(new LinkedHashSet<>(Arrays.asList(Tuple.of(10), Tuple.of(20))), values);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUniqueAxisValuesOfUnknownDimension() {
        index.reset(relation, AB, null);
        index.uniqueAxisValues(dims("Q"));
    }

    @Test
    public void testClear() {
        index.reset(relation, AB, dims("A"), dims("B"), none(), Tuple.empty());

        index.clear();

        assertEquals(0, index.size());
        assertTrue(index.getDimensionIds().isEmpty());
        assertEquals(Tuple.empty(), index.rowKey(0));
        assertEquals(Tuple.empty(), index.fullKey(0, 0));
    }
}
