package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.AxisFilterParser;
import ed.inf.adbs.pivotgrid.PivotIndex;
import ed.inf.adbs.pivotgrid.Tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The AxisFilterProxy hides data rows and columns of a {@link GridProjector}
 * whose header values are not accepted by per-dimension filters.
 * Unlike the frozen slice, which removes a dimension from view altogether, a
 * filter keeps its dimension on the axis and only hides some of its values.
 * Header rows and columns, the corner and the trailing empty row and column are
 * never hidden, so new entries can always be typed in.
 * <p>The proxy listens to its source and recomputes the visible rows and
 * columns on every change.
 * @param <P> Payload type of the underlying relation.
 */
public class AxisFilterProxy<P> extends GridModel implements GridListener {

    private final GridProjector<P> source;
    private final Map<String, Set<Object>> filters = new HashMap<>();

    private List<Integer> visibleRows = Collections.emptyList();
    private List<Integer> visibleColumns = Collections.emptyList();

    public AxisFilterProxy(GridProjector<P> source) {
        this.source = source;
        source.addListener(this);
        refilter();
    }

    /**
     * Restrict a dimension to a set of values.
     * @param dimension The dimension id.
     * @param accepted The accepted values, or null to lift the restriction.
     */
    public void setFilter(String dimension, Set<?> accepted) {
        if (accepted == null) {
            filters.remove(dimension);
        } else {
            filters.put(dimension, new LinkedHashSet<>(accepted));
        }
        refilter();
        fireGridReset();
    }

    /**
     * Replace all filters by those of a condition such as
     * {@code region IN ('north', 'south') AND quarter = 3}.
     * @param condition The filter condition.
     * @throws IllegalArgumentException if the condition is not understood; the current filters are kept.
     * @see AxisFilterParser
     */
    public void setFilter(String condition) {
        Map<String, Set<Object>> parsed = AxisFilterParser.parse(condition);
        filters.clear();
        filters.putAll(parsed);
        refilter();
        fireGridReset();
    }

    public void clearFilter() {
        filters.clear();
        refilter();
        fireGridReset();
    }

    /**
     * @param dimension The dimension id.
     * @return The accepted values, or null if the dimension is unrestricted.
     */
    public Set<Object> getFilter(String dimension) {
        Set<Object> accepted = filters.get(dimension);
        return accepted == null ? null : Collections.unmodifiableSet(accepted);
    }

    /**
     * @param sourceRow A row of the source grid.
     * @return true if the row is shown.
     */
    public boolean filterAcceptsRow(int sourceRow) {
        int dataRow = sourceRow - source.headerRowCount();
        if (dataRow < 0 || dataRow >= source.dataRowCount()) {
            return true;
        }
        PivotIndex<P> index = source.getIndex();
        return accepts(index.getPivotRows(), index.rowKey(dataRow));
    }

    /**
     * @param sourceColumn A column of the source grid.
     * @return true if the column is shown.
     */
    public boolean filterAcceptsColumn(int sourceColumn) {
        int dataColumn = sourceColumn - source.headerColumnCount();
        if (dataColumn < 0 || dataColumn >= source.dataColumnCount()) {
            return true;
        }
        PivotIndex<P> index = source.getIndex();
        return accepts(index.getPivotColumns(), index.columnKey(dataColumn));
    }

    // unresolved components belong to the blank line of an empty axis and always pass
    private boolean accepts(List<String> axisDimensions, Tuple key) {
        for (int i = 0; i < axisDimensions.size(); i++) {
            Set<Object> accepted = filters.get(axisDimensions.get(i));
            if (accepted == null || i >= key.size() || !key.get(i).isPresent()) {
                continue;
            }
            if (!accepted.contains(key.getAttribute(i))) {
                return false;
            }
        }
        return true;
    }

    private void refilter() {
        List<Integer> rows = new ArrayList<>();
        for (int row = 0; row < source.rowCount(); row++) {
            if (filterAcceptsRow(row)) {
                rows.add(row);
            }
        }
        List<Integer> columns = new ArrayList<>();
        for (int column = 0; column < source.columnCount(); column++) {
            if (filterAcceptsColumn(column)) {
                columns.add(column);
            }
        }
        visibleRows = rows;
        visibleColumns = columns;
    }

    /**
     * @param row A row of this grid.
     * @param column A column of this grid.
     * @return The matching cell of the source grid.
     */
    public GridPosition mapToSource(int row, int column) {
        if (row < 0 || row >= visibleRows.size() || column < 0 || column >= visibleColumns.size()) {
            throw new IndexOutOfBoundsException("cell " + new GridPosition(row, column) + " outside grid of "
                    + rowCount() + " x " + columnCount());
        }
        return new GridPosition(visibleRows.get(row), visibleColumns.get(column));
    }

    @Override
    public int rowCount() {
        return visibleRows.size();
    }

    @Override
    public int columnCount() {
        return visibleColumns.size();
    }

    @Override
    public Object data(int row, int column) {
        GridPosition position = mapToSource(row, column);
        return source.data(position.getRow(), position.getColumn());
    }

    @Override
    public EditResult batchSetData(List<GridPosition> positions, List<?> values) {
        List<GridPosition> mapped = new ArrayList<>(positions.size());
        for (GridPosition position : positions) {
            mapped.add(mapToSource(position.getRow(), position.getColumn()));
        }
        return source.batchSetData(mapped, values);
    }

    public GridProjector<P> getSource() {
        return source;
    }

    @Override
    public void gridReset() {
        refilter();
        fireGridReset();
    }

    @Override
    public void rowsInserted(int first, int last) {
        gridReset();
    }

    @Override
    public void rowsRemoved(int first, int last) {
        gridReset();
    }

    @Override
    public void columnsInserted(int first, int last) {
        gridReset();
    }

    @Override
    public void columnsRemoved(int first, int last) {
        gridReset();
    }

    @Override
    public void dataChanged(GridPosition topLeft, GridPosition bottomRight) {
        List<Integer> rowsBefore = visibleRows;
        List<Integer> columnsBefore = visibleColumns;
        refilter();
        if (!rowsBefore.equals(visibleRows) || !columnsBefore.equals(visibleColumns)) {
            fireGridReset();
        } else if (rowCount() > 0 && columnCount() > 0) {
            fireDataChanged(new GridPosition(0, 0), new GridPosition(rowCount() - 1, columnCount() - 1));
        }
    }
}
