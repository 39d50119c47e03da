package ed.inf.adbs.pivotgrid;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class KeyPermutationTest {

    private static final List<String> DIMENSIONS = Arrays.asList("A", "B", "C");

    @Test
    public void testIdentity() {
        KeyPermutation permutation = KeyPermutation.of(DIMENSIONS, DIMENSIONS);

        assertEquals(Tuple.of(1, 2, 3), permutation.apply(Tuple.of(1, 2, 3)));
        assertEquals(3, permutation.arity());
    }

    @Test
    public void testReordersIntoCanonicalOrder() {
        // pivoted as rows [C], columns [A], frozen [B]
        KeyPermutation permutation = KeyPermutation.of(DIMENSIONS, Arrays.asList("C", "A", "B"));

        assertEquals(Tuple.of("a", "b", "c"), permutation.apply(Tuple.of("c", "a", "b")));
    }

    @Test
    public void testUnresolvedComponentsTravel() {
        KeyPermutation permutation = KeyPermutation.of(DIMENSIONS, Arrays.asList("B", "C", "A"));
        Tuple pivoted = Tuple.concat(Tuple.unresolved(1), Tuple.of(3, 1));

        Tuple key = permutation.apply(pivoted);

        assertEquals(1, key.getAttribute(0));
        assertFalse("B should stay unresolved", key.get(1).isPresent());
        assertEquals(3, key.getAttribute(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testArityMismatch() {
        KeyPermutation.of(DIMENSIONS, DIMENSIONS).apply(Tuple.of(1, 2));
    }

    @Test
    public void testPositionsOf() {
        assertArrayEquals(new int[]{2, 0}, KeyPermutation.positionsOf(DIMENSIONS, Arrays.asList("C", "A")));
    }
}
