package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.AxisDelta;
import ed.inf.adbs.pivotgrid.Constants;
import ed.inf.adbs.pivotgrid.Dimension;
import ed.inf.adbs.pivotgrid.DimensionKind;
import ed.inf.adbs.pivotgrid.PivotIndex;
import ed.inf.adbs.pivotgrid.PivotIndexOutOfRangeException;
import ed.inf.adbs.pivotgrid.PivotSpec;
import ed.inf.adbs.pivotgrid.Tuple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The GridProjector presents a {@link PivotIndex} as a two-dimensional grid.
 * The grid is laid out as follows:
 * <pre>
 *   corner with dimension names | column header band      | empty column
 *   ----------------------------+-------------------------+-------------
 *   row header band             | data band               |
 *   empty row                   |                         |
 * </pre>
 * The column header band is one row per column dimension, plus one row naming
 * the row dimensions when there are any. The row header band is one column per
 * row dimension. The trailing empty row (column) exists only when the row
 * (column) axis has dimensions and is where brand new axis values are entered.
 * <p>Data rows and columns are materialised in chunks. Each axis keeps its own
 * fetched count which grows by {@link #fetchMore(Axis)} until it reaches the
 * header length. An axis without dimensions always presents exactly one data line.
 * <p>Edits are translated into requests to external collaborators; the grid and
 * its index change only when the backing store reports back through
 * {@link #add(Map)}, {@link #remove(Collection)} or {@link #update(Map)}.
 * @param <P> Payload type of the underlying relation.
 */
public class GridProjector<P> extends GridModel {

    private final PivotIndex<P> index;
    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();

    private final EntityNameResolver nameResolver;
    private final EntityRenamer renamer;
    private final EntityCreator creator;
    private final RelationMutator mutator;

    private final int fetchChunkSize;
    private int fetchedRowCount;
    private int fetchedColumnCount;

    /**
     * Construct a grid over an index with the default fetch chunk size.
     * @see #GridProjector(PivotIndex, EntityNameResolver, EntityRenamer, EntityCreator, RelationMutator, int)
     */
    public GridProjector(PivotIndex<P> index, EntityNameResolver nameResolver, EntityRenamer renamer,
                         EntityCreator creator, RelationMutator mutator) {
        this(index, nameResolver, renamer, creator, mutator, Constants.DEFAULT_FETCH_CHUNK_SIZE);
    }

    /**
     * Construct a grid over an index.
     * @param index The index to present. The grid only reads it, apart from forwarding store updates.
     * @param nameResolver Resolves header values to labels.
     * @param renamer Receives header edits.
     * @param creator Receives new axis values entered in the empty row or column.
     * @param mutator Receives data edits.
     * @param fetchChunkSize Number of rows or columns materialised per fetch.
     */
    public GridProjector(PivotIndex<P> index, EntityNameResolver nameResolver, EntityRenamer renamer,
                         EntityCreator creator, RelationMutator mutator, int fetchChunkSize) {
        if (fetchChunkSize <= 0) {
            throw new IllegalArgumentException("fetch chunk size must be positive, got " + fetchChunkSize);
        }
        this.index = index;
        this.nameResolver = nameResolver;
        this.renamer = renamer;
        this.creator = creator;
        this.mutator = mutator;
        this.fetchChunkSize = fetchChunkSize;
    }

    /**
     * Load a relation and present it under the given pivot.
     * Nothing is materialised until the first fetch.
     * @param relation Entries, keys in the order of {@code dimensions}.
     * @param dimensionList Dimensions of the relation in canonical order.
     * @param pivot Initial pivot, null for all dimensions as rows.
     */
    public void reset(Map<Tuple, ? extends P> relation, List<Dimension> dimensionList, PivotSpec pivot) {
        List<String> dimensionIds = new ArrayList<>();
        for (Dimension dimension : dimensionList) {
            dimensionIds.add(dimension.getId());
        }
        index.reset(relation, dimensionIds, pivot);
        dimensions.clear();
        for (Dimension dimension : dimensionList) {
            dimensions.put(dimension.getId(), dimension);
        }
        restartFetching();
    }

    public void clear() {
        index.clear();
        dimensions.clear();
        restartFetching();
    }

    /**
     * Apply a new pivot. An unchanged pivot keeps the materialised window.
     * @param pivot The new pivot.
     */
    public void setPivot(PivotSpec pivot) {
        PivotSpec before = index.getPivot();
        index.setPivot(pivot);
        if (!before.equals(index.getPivot())) {
            restartFetching();
        }
    }

    /**
     * Select another slice of the frozen dimensions.
     * @param value One component per frozen dimension.
     */
    public void setFrozenValue(Tuple value) {
        PivotSpec before = index.getPivot();
        index.setFrozenValue(value);
        if (!before.equals(index.getPivot())) {
            restartFetching();
        }
    }

    /**
     * Forward entries added in the store. New header values land at the tail
     * of the headers, so the window grows by exactly the reported delta.
     * @param entries Added entries.
     */
    public void add(Map<Tuple, ? extends P> entries) {
        if (entries.isEmpty()) {
            return;
        }
        Tuple frozenBefore = index.getFrozenValue();
        AxisDelta delta = index.add(entries);
        if (!frozenBefore.equals(index.getFrozenValue())) {
            // a frozen value was picked, the headers were rebuilt for another slice
            restartFetching();
            return;
        }
        if (delta.getRows() > 0 && !index.getPivotRows().isEmpty()) {
            int count = Math.min(delta.getRows(), index.getRowHeader().size() - fetchedRowCount);
            if (count > 0) {
                int first = headerRowCount() + dataRowCount();
                fetchedRowCount += count;
                fireRowsInserted(first, first + count - 1);
            }
        }
        if (delta.getColumns() > 0 && !index.getPivotColumns().isEmpty()) {
            int count = Math.min(delta.getColumns(), index.getColumnHeader().size() - fetchedColumnCount);
            if (count > 0) {
                int first = headerColumnCount() + dataColumnCount();
                fetchedColumnCount += count;
                fireColumnsInserted(first, first + count - 1);
            }
        }
    }

    /**
     * Forward keys removed from the store.
     * Header values that remain may have moved, so the window is trimmed at its
     * tail to the new header lengths and the whole data band is reported changed.
     * @param keys Removed keys.
     */
    public void remove(Collection<Tuple> keys) {
        if (keys.isEmpty()) {
            return;
        }
        AxisDelta delta = index.remove(keys);
        if (delta.equals(AxisDelta.NONE)) {
            fireDataBandChanged();
            return;
        }
        // both counters must match the index before any listener reads the grid
        int rowExcess = Math.max(0, fetchedRowCount - index.getRowHeader().size());
        int columnExcess = Math.max(0, fetchedColumnCount - index.getColumnHeader().size());
        int lastRow = headerRowCount() + dataRowCount() - 1;
        int lastColumn = headerColumnCount() + dataColumnCount() - 1;
        fetchedRowCount -= rowExcess;
        fetchedColumnCount -= columnExcess;
        if (rowExcess > 0) {
            fireRowsRemoved(lastRow - rowExcess + 1, lastRow);
        }
        if (columnExcess > 0) {
            fireColumnsRemoved(lastColumn - columnExcess + 1, lastColumn);
        }
        fireDataBandChanged();
    }

    /**
     * Forward payload changes from the store. The geometry does not change.
     * @param entries Changed entries.
     */
    public void update(Map<Tuple, ? extends P> entries) {
        if (index.update(entries) > 0) {
            fireDataBandChanged();
        }
    }

    /**
     * @param axis An axis.
     * @return true while the axis has header values not yet materialised.
     */
    public boolean canFetchMore(Axis axis) {
        return getFetchedCount(axis) < headerLength(axis);
    }

    /**
     * Materialise the next chunk of an axis.
     * @param axis The axis to grow.
     * @return Number of rows or columns added to the grid.
     */
    public int fetchMore(Axis axis) {
        int count = Math.min(fetchChunkSize, headerLength(axis) - getFetchedCount(axis));
        if (count <= 0) {
            return 0;
        }
        if (axis == Axis.ROWS) {
            int first = headerRowCount() + dataRowCount();
            fetchedRowCount += count;
            fireRowsInserted(first, first + count - 1);
        } else {
            int first = headerColumnCount() + dataColumnCount();
            fetchedColumnCount += count;
            fireColumnsInserted(first, first + count - 1);
        }
        return count;
    }

    /**
     * @param axis An axis.
     * @return Number of header values materialised on that axis.
     */
    public int getFetchedCount(Axis axis) {
        return axis == Axis.ROWS ? fetchedRowCount : fetchedColumnCount;
    }

    private int headerLength(Axis axis) {
        if (axis == Axis.ROWS) {
            return index.getPivotRows().isEmpty() ? 0 : index.getRowHeader().size();
        }
        return index.getPivotColumns().isEmpty() ? 0 : index.getColumnHeader().size();
    }

    private void restartFetching() {
        fetchedRowCount = 0;
        fetchedColumnCount = 0;
        fireGridReset();
    }

    /**
     * @return Rows above the data band: one per column dimension, plus one naming the row dimensions.
     */
    public int headerRowCount() {
        return index.getPivotColumns().size() + (index.getPivotRows().isEmpty() ? 0 : 1);
    }

    /**
     * @return Columns left of the data band: one per row dimension, at least one if there are column dimensions.
     */
    public int headerColumnCount() {
        return Math.max(index.getPivotColumns().isEmpty() ? 0 : 1, index.getPivotRows().size());
    }

    public int dataRowCount() {
        return index.getPivotRows().isEmpty() ? 1 : fetchedRowCount;
    }

    public int dataColumnCount() {
        return index.getPivotColumns().isEmpty() ? 1 : fetchedColumnCount;
    }

    public int emptyRowCount() {
        return index.getPivotRows().isEmpty() ? 0 : 1;
    }

    public int emptyColumnCount() {
        return index.getPivotColumns().isEmpty() ? 0 : 1;
    }

    @Override
    public int rowCount() {
        return headerRowCount() + dataRowCount() + emptyRowCount();
    }

    @Override
    public int columnCount() {
        return headerColumnCount() + dataColumnCount() + emptyColumnCount();
    }

    /**
     * Classify a cell.
     * @param row Zero-based grid row.
     * @param column Zero-based grid column.
     * @return The region the cell belongs to.
     */
    public GridRegion regionOf(int row, int column) {
        if (row < 0 || row >= rowCount() || column < 0 || column >= columnCount()) {
            throw new IndexOutOfBoundsException("cell " + new GridPosition(row, column) + " outside grid of "
                    + rowCount() + " x " + columnCount());
        }
        List<String> rows = index.getPivotRows();
        List<String> columns = index.getPivotColumns();
        int headerRows = headerRowCount();
        int headerColumns = headerColumnCount();
        if (row < headerRows && column < headerColumns) {
            if (!rows.isEmpty() && row == columns.size() && column < rows.size()) {
                return GridRegion.ROW_DIMENSION_NAME;
            }
            if (!columns.isEmpty() && column == headerColumns - 1 && row < columns.size()) {
                return GridRegion.COLUMN_DIMENSION_NAME;
            }
            return GridRegion.CORNER;
        }
        if (row < columns.size() && column >= headerColumns && column < headerColumns + dataColumnCount()) {
            return GridRegion.COLUMN_HEADER;
        }
        if (column < rows.size() && row >= headerRows && row < headerRows + dataRowCount()) {
            return GridRegion.ROW_HEADER;
        }
        if (emptyColumnCount() > 0 && row < columns.size() && column == columnCount() - 1) {
            return GridRegion.EMPTY_COLUMN_HEADER;
        }
        if (emptyRowCount() > 0 && column < rows.size() && row == rowCount() - 1) {
            return GridRegion.EMPTY_ROW_HEADER;
        }
        if (row >= headerRows && row < rowCount() - emptyRowCount()
                && column >= headerColumns && column < columnCount() - emptyColumnCount()) {
            return GridRegion.DATA;
        }
        return GridRegion.BLANK;
    }

    /**
     * Translate a grid cell to a row and column of the pivot index.
     * @param row Zero-based grid row.
     * @param column Zero-based grid column.
     * @return The index coordinates, meaningful for data and header cells.
     */
    public GridPosition mapToPivot(int row, int column) {
        return new GridPosition(row - headerRowCount(), column - headerColumnCount());
    }

    /**
     * Cells naming the dimensions: first the row dimensions, left to right, then
     * the column dimensions, top to bottom.
     * @return Positions in the top left corner.
     */
    public List<GridPosition> topLeftPositions() {
        List<GridPosition> positions = new ArrayList<>();
        int columnDimensionCount = index.getPivotColumns().size();
        for (int column = 0; column < index.getPivotRows().size(); column++) {
            positions.add(new GridPosition(columnDimensionCount, column));
        }
        int nameColumn = headerColumnCount() - 1;
        for (int row = 0; row < columnDimensionCount; row++) {
            positions.add(new GridPosition(row, nameColumn));
        }
        return positions;
    }

    /**
     * Find the dimension owning a header, dimension name or empty header cell.
     * @param row Zero-based grid row.
     * @param column Zero-based grid column.
     * @return The dimension, or null for other cells.
     */
    public Dimension topLeftDimension(int row, int column) {
        switch (regionOf(row, column)) {
            case ROW_HEADER:
            case EMPTY_ROW_HEADER:
            case ROW_DIMENSION_NAME:
                return dimensionOf(index.getPivotRows().get(column));
            case COLUMN_HEADER:
            case EMPTY_COLUMN_HEADER:
            case COLUMN_DIMENSION_NAME:
                return dimensionOf(index.getPivotColumns().get(row));
            default:
                return null;
        }
    }

    /**
     * Get the raw dimension value shown by a header cell.
     * @param row Zero-based grid row.
     * @param column Zero-based grid column.
     * @return The value id, or null if the cell is not a header or the value is unresolved.
     */
    public Object headerValue(int row, int column) {
        GridRegion region = regionOf(row, column);
        GridPosition pivot = mapToPivot(row, column);
        if (region == GridRegion.ROW_HEADER) {
            return index.rowKey(pivot.getRow()).getAttribute(column);
        }
        if (region == GridRegion.COLUMN_HEADER) {
            return index.columnKey(pivot.getColumn()).getAttribute(row);
        }
        return null;
    }

    /**
     * Resolve the label of a header cell. Index values are shown as they are,
     * other values go through the name resolver.
     * @param row Zero-based grid row.
     * @param column Zero-based grid column.
     * @return The label, or null if the cell is not a header.
     */
    public String headerName(int row, int column) {
        Object value = headerValue(row, column);
        if (value == null) {
            return null;
        }
        Dimension dimension = topLeftDimension(row, column);
        if (dimension.getKind() == DimensionKind.INDEX) {
            return String.valueOf(value);
        }
        return nameResolver.resolve(dimension, value);
    }

    /**
     * @param row Zero-based grid row of a data cell.
     * @param column Zero-based grid column of a data cell.
     * @return The relation key the cell addresses.
     */
    public Tuple fullKey(int row, int column) {
        GridPosition pivot = mapToPivot(row, column);
        return index.fullKey(pivot.getRow(), pivot.getColumn());
    }

    /**
     * @param row Zero-based grid row of a data cell.
     * @param column Zero-based grid column of a data cell.
     * @return The payload, or null if there is none.
     */
    public P payloadAt(int row, int column) {
        GridPosition pivot = mapToPivot(row, column);
        return index.getCell(pivot.getRow(), pivot.getColumn());
    }

    /**
     * Get cell content. Index errors mean this grid is out of step with its
     * viewer; they are reported on the error stream and the cell reads as empty.
     */
    @Override
    public Object data(int row, int column) {
        try {
            switch (regionOf(row, column)) {
                case ROW_DIMENSION_NAME:
                    return index.getPivotRows().get(column);
                case COLUMN_DIMENSION_NAME:
                    return index.getPivotColumns().get(row);
                case ROW_HEADER:
                case COLUMN_HEADER:
                    return headerName(row, column);
                case DATA:
                    return payloadAt(row, column);
                default:
                    return null;
            }
        } catch (PivotIndexOutOfRangeException e) {
            System.err.println("Grid out of step with pivot index at " + new GridPosition(row, column)
                    + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Apply edits region by region. Data edits update, delete or create relation
     * entries; header edits rename the values behind the headers; edits in the
     * empty row or column create new values of the owning dimension.
     * The three groups are applied independently and a rejected item is skipped
     * and reported without affecting its siblings.
     * One data-changed notification covers all edited cells.
     */
    @Override
    public EditResult batchSetData(List<GridPosition> positions, List<?> values) {
        if (positions.size() != values.size()) {
            throw new IllegalArgumentException("got " + positions.size() + " positions but "
                    + values.size() + " values");
        }
        if (positions.isEmpty()) {
            return EditResult.unchanged();
        }
        Map<GridPosition, Object> dataEdits = new LinkedHashMap<>();
        Map<GridPosition, Object> headerEdits = new LinkedHashMap<>();
        Map<GridPosition, Object> newValueEdits = new LinkedHashMap<>();
        List<GridPosition> dispatched = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            GridPosition position = positions.get(i);
            switch (regionOf(position.getRow(), position.getColumn())) {
                case DATA:
                    dataEdits.put(position, values.get(i));
                    break;
                case ROW_HEADER:
                case COLUMN_HEADER:
                    headerEdits.put(position, values.get(i));
                    break;
                case EMPTY_ROW_HEADER:
                case EMPTY_COLUMN_HEADER:
                    newValueEdits.put(position, values.get(i));
                    break;
                default:
                    continue;
            }
            dispatched.add(position);
        }
        List<String> errors = new ArrayList<>();
        boolean changed = setDataBand(dataEdits, errors);
        changed |= setHeaders(headerEdits, errors);
        changed |= addNewValues(newValueEdits, errors);
        if (changed) {
            fireBoundingDataChanged(dispatched);
        }
        return new EditResult(changed, errors);
    }

    private boolean setDataBand(Map<GridPosition, Object> edits, List<String> errors) {
        boolean changed = false;
        for (Map.Entry<GridPosition, Object> edit : edits.entrySet()) {
            GridPosition pivot = mapToPivot(edit.getKey().getRow(), edit.getKey().getColumn());
            Tuple key = index.fullKey(pivot.getRow(), pivot.getColumn());
            boolean existing = index.getCell(pivot.getRow(), pivot.getColumn()) != null;
            boolean blank = isBlank(edit.getValue());
            try {
                if (existing && !blank) {
                    mutator.upsert(key, edit.getValue());
                    changed = true;
                } else if (existing) {
                    mutator.delete(key);
                    changed = true;
                } else if (!blank) {
                    Tuple resolvedKey = createMissingValues(key);
                    if (!resolvedKey.isResolved()) {
                        errors.add("Cannot add a value at " + edit.getKey() + ": key " + resolvedKey
                                + " has unresolved components");
                        continue;
                    }
                    mutator.upsert(resolvedKey, edit.getValue());
                    changed = true;
                }
            } catch (EditRejectedException e) {
                errors.add("Edit at " + edit.getKey() + " rejected: " + e.getMessage());
            }
        }
        return changed;
    }

    private Tuple createMissingValues(Tuple key) throws EditRejectedException {
        List<String> dimensionIds = index.getDimensionIds();
        Tuple resolved = key;
        for (int i = 0; i < dimensionIds.size(); i++) {
            Dimension dimension = dimensionOf(dimensionIds.get(i));
            Optional<Object> value = key.get(i);
            if (!value.isPresent() || dimension.getKind() == DimensionKind.INDEX) {
                continue;
            }
            if (!creator.exists(dimension, value.get())) {
                Object id = creator.create(dimension, String.valueOf(value.get()));
                resolved = resolved.with(i, id);
            }
        }
        return resolved;
    }

    private boolean setHeaders(Map<GridPosition, Object> edits, List<String> errors) {
        boolean changed = false;
        for (Map.Entry<GridPosition, Object> edit : edits.entrySet()) {
            int row = edit.getKey().getRow();
            int column = edit.getKey().getColumn();
            if (isBlank(edit.getValue())) {
                continue;
            }
            Dimension dimension = topLeftDimension(row, column);
            if (dimension.getKind() == DimensionKind.INDEX) {
                errors.add("Values of dimension '" + dimension.getId() + "' cannot be renamed");
                continue;
            }
            try {
                renamer.rename(dimension, headerValue(row, column), edit.getValue().toString());
                changed = true;
            } catch (EditRejectedException e) {
                errors.add("Rename in dimension '" + dimension.getId() + "' rejected: " + e.getMessage());
            }
        }
        return changed;
    }

    private boolean addNewValues(Map<GridPosition, Object> edits, List<String> errors) {
        Map<Dimension, Set<String>> namesByDimension = new LinkedHashMap<>();
        for (Map.Entry<GridPosition, Object> edit : edits.entrySet()) {
            if (isBlank(edit.getValue())) {
                continue;
            }
            Dimension dimension = topLeftDimension(edit.getKey().getRow(), edit.getKey().getColumn());
            namesByDimension.computeIfAbsent(dimension, d -> new LinkedHashSet<>()).add(edit.getValue().toString());
        }
        boolean changed = false;
        for (Map.Entry<Dimension, Set<String>> entry : namesByDimension.entrySet()) {
            Dimension dimension = entry.getKey();
            if (dimension.getKind() == DimensionKind.INDEX) {
                errors.add("Values of dimension '" + dimension.getId() + "' cannot be created from the grid");
                continue;
            }
            for (String name : entry.getValue()) {
                try {
                    creator.create(dimension, name);
                    changed = true;
                } catch (EditRejectedException e) {
                    errors.add("Cannot create '" + name + "' in dimension '" + dimension.getId() + "': "
                            + e.getMessage());
                }
            }
        }
        return changed;
    }

    /**
     * A blank value deletes an existing entry and never creates one.
     * @param value An edited value.
     * @return true for null, blank strings and {@code Boolean.FALSE}.
     */
    static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).trim().isEmpty();
        }
        return Boolean.FALSE.equals(value);
    }

    private void fireBoundingDataChanged(List<GridPosition> positions) {
        int top = Integer.MAX_VALUE;
        int left = Integer.MAX_VALUE;
        int bottom = Integer.MIN_VALUE;
        int right = Integer.MIN_VALUE;
        for (GridPosition position : positions) {
            top = Math.min(top, position.getRow());
            left = Math.min(left, position.getColumn());
            bottom = Math.max(bottom, position.getRow());
            right = Math.max(right, position.getColumn());
        }
        fireDataChanged(new GridPosition(top, left), new GridPosition(bottom, right));
    }

    private void fireDataBandChanged() {
        int lastRow = headerRowCount() + dataRowCount() - 1;
        int lastColumn = headerColumnCount() + dataColumnCount() - 1;
        if (lastRow < headerRowCount() || lastColumn < headerColumnCount()) {
            return;
        }
        fireDataChanged(new GridPosition(headerRowCount(), headerColumnCount()),
                new GridPosition(lastRow, lastColumn));
    }

    public PivotIndex<P> getIndex() {
        return index;
    }

    /**
     * @param id A dimension id.
     * @return The dimension registered at the last reset, or null.
     */
    public Dimension getDimension(String id) {
        return dimensions.get(id);
    }

    // an index reset directly, bypassing reset(), carries plain ids only
    private Dimension dimensionOf(String id) {
        Dimension dimension = dimensions.get(id);
        return dimension != null ? dimension : Dimension.entity(id);
    }
}
