package ed.inf.adbs.pivotgrid;

import java.util.List;

/**
 * Reassembly rule turning a pivoted key (row values, then column values, then
 * frozen values) back into a relation key in canonical dimension order.
 * Built once per pivot and applied by a plain gather loop.
 */
public final class KeyPermutation {

    // sourcePositions[i] is the position in the pivoted key of canonical dimension i
    private final int[] sourcePositions;

    private KeyPermutation(int[] sourcePositions) {
        this.sourcePositions = sourcePositions;
    }

    /**
     * Derive the permutation for a pivot.
     * @param dimensionIds Dimensions in canonical order.
     * @param pivotOrder The same dimensions in rows, columns, frozen order.
     * @return The permutation.
     */
    public static KeyPermutation of(List<String> dimensionIds, List<String> pivotOrder) {
        int[] sourcePositions = new int[dimensionIds.size()];
        for (int i = 0; i < pivotOrder.size(); i++) {
            sourcePositions[dimensionIds.indexOf(pivotOrder.get(i))] = i;
        }
        return new KeyPermutation(sourcePositions);
    }

    /**
     * Positions of some dimensions within the canonical order, for projecting relation keys onto them.
     * @param dimensionIds Dimensions in canonical order.
     * @param dimensions The dimensions to locate.
     * @return One canonical position per requested dimension.
     */
    public static int[] positionsOf(List<String> dimensionIds, List<String> dimensions) {
        int[] positions = new int[dimensions.size()];
        for (int i = 0; i < dimensions.size(); i++) {
            positions[i] = dimensionIds.indexOf(dimensions.get(i));
        }
        return positions;
    }

    /**
     * Reassemble a relation key.
     * @param pivotedKey Row, column and frozen values concatenated.
     * @return The key in canonical order.
     */
    public Tuple apply(Tuple pivotedKey) {
        if (pivotedKey.size() != sourcePositions.length) {
            throw new IllegalArgumentException("pivoted key " + pivotedKey + " must have "
                    + sourcePositions.length + " components");
        }
        return pivotedKey.select(sourcePositions);
    }

    /**
     * @return number of components of a reassembled key.
     */
    public int arity() {
        return sourcePositions.length;
    }
}
