package ed.inf.adbs.pivotgrid;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class AxisFilterParserTest {

    @Test
    public void testInList() {
        Map<String, Set<Object>> filters = AxisFilterParser.parse("region IN ('north', 'south')");

        assertEquals(Collections.singleton("region"), filters.keySet());
        assertEquals(new LinkedHashSet<Object>(Arrays.asList("north", "south")), filters.get("region"));
    }

    @Test
    public void testConjunctionOfDimensions() {
        Map<String, Set<Object>> filters = AxisFilterParser.parse("A = 1 AND B IN (10, 20) AND C = 'x'");

        assertEquals(Arrays.asList("A", "B", "C"), Arrays.asList(filters.keySet().toArray()));
        assertEquals(Collections.singleton(1), filters.get("A"));
        assertEquals(new LinkedHashSet<Object>(Arrays.asList(10, 20)), filters.get("B"));
        assertEquals(Collections.singleton("x"), filters.get("C"));
    }

    @Test
    public void testIntegerLiteralsAreIntegers() {
        Object value = AxisFilterParser.parse("A = 7").get("A").iterator().next();

        assertTrue("Small literals should be Integer, got " + value.getClass(), value instanceof Integer);
    }

    @Test
    public void testNegativeLiteral() {
        assertEquals(Collections.singleton(-3), AxisFilterParser.parse("A = -3").get("A"));
    }

    @Test
    public void testRepeatedDimensionIntersects() {
        Map<String, Set<Object>> filters = AxisFilterParser.parse("A IN (1, 2, 3) AND A IN (2, 3, 4)");

        assertEquals(new LinkedHashSet<Object>(Arrays.asList(2, 3)), filters.get("A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDisjunctionRejected() {
        AxisFilterParser.parse("A = 1 OR A = 2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRangeRejected() {
        AxisFilterParser.parse("A >= 1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotInRejected() {
        AxisFilterParser.parse("A NOT IN (1, 2)");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testColumnComparisonRejected() {
        AxisFilterParser.parse("A = B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSyntaxErrorRejected() {
        AxisFilterParser.parse("A IN (1, ");
    }
}
