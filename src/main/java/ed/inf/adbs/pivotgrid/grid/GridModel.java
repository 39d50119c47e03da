package ed.inf.adbs.pivotgrid.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract class representing a two-dimensional view over a pivoted relation.
 * Grids can be stacked: a grid reading from another one keeps it as its source
 * and maps its own coordinates onto the source's. Edits always travel down to
 * the bottom grid, which turns them into requests to external collaborators.
 * <p>Every grid publishes its changes to registered {@link GridListener}s.
 */
public abstract class GridModel {

    private final List<GridListener> listeners = new ArrayList<>();

    /**
     * @return Number of rows currently presented.
     */
    public abstract int rowCount();

    /**
     * @return Number of columns currently presented.
     */
    public abstract int columnCount();

    /**
     * Get the content of a cell: a dimension name, a header label, a payload, or null.
     * @param row Zero-based row.
     * @param column Zero-based column.
     * @return The cell content.
     */
    public abstract Object data(int row, int column);

    /**
     * Apply edits to several cells in one go.
     * @param positions Edited cells.
     * @param values New values, one per position.
     * @return Whether anything was changed, and the items that were rejected.
     */
    public abstract EditResult batchSetData(List<GridPosition> positions, List<?> values);

    /**
     * Edit a single cell.
     * @see #batchSetData(List, List)
     */
    public EditResult setData(int row, int column, Object value) {
        List<Object> values = new ArrayList<>();
        values.add(value);
        List<GridPosition> positions = new ArrayList<>();
        positions.add(new GridPosition(row, column));
        return batchSetData(positions, values);
    }

    public void addListener(GridListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GridListener listener) {
        listeners.remove(listener);
    }

    protected void fireGridReset() {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.gridReset();
        }
    }

    protected void fireRowsInserted(int first, int last) {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.rowsInserted(first, last);
        }
    }

    protected void fireRowsRemoved(int first, int last) {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.rowsRemoved(first, last);
        }
    }

    protected void fireColumnsInserted(int first, int last) {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.columnsInserted(first, last);
        }
    }

    protected void fireColumnsRemoved(int first, int last) {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.columnsRemoved(first, last);
        }
    }

    protected void fireDataChanged(GridPosition topLeft, GridPosition bottomRight) {
        for (GridListener listener : new ArrayList<>(listeners)) {
            listener.dataChanged(topLeft, bottomRight);
        }
    }
}
