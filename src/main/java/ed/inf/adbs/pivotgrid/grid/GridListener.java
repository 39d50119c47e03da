package ed.inf.adbs.pivotgrid.grid;

/**
 * Receives change notifications from a grid. All positions are inclusive.
 */
public interface GridListener {

    /**
     * The whole grid changed, previously read geometry and content are stale.
     */
    default void gridReset() {
    }

    default void rowsInserted(int first, int last) {
    }

    default void rowsRemoved(int first, int last) {
    }

    default void columnsInserted(int first, int last) {
    }

    default void columnsRemoved(int first, int last) {
    }

    /**
     * Content changed inside a rectangle, geometry is unchanged.
     * @param topLeft Top left cell of the rectangle.
     * @param bottomRight Bottom right cell of the rectangle.
     */
    default void dataChanged(GridPosition topLeft, GridPosition bottomRight) {
    }
}
