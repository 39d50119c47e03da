package ed.inf.adbs.pivotgrid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The PivotIndex owns a sparse relation, a mapping from fixed-arity keys of
 * dimension values to payloads, together with the pivot currently applied to it.
 * From the two it derives the distinct values along the row and column axes
 * (the header caches) and the permutation that turns a row value, a column
 * value and the frozen value back into a relation key.
 * <p>Header caches list projections in the order they are first met while
 * iterating the relation. The relation keeps insertion order, so entries added
 * later can only append new header values, existing header indices never move.
 * <p>All derived state lives in an immutable {@link AxisSnapshot} replaced as a
 * whole on each structural change. Every recomputation is a full scan of the relation.
 * @param <P> Payload type. A key may map to null, meaning the key is known but holds no payload.
 */
public class PivotIndex<P> {

    private Map<Tuple, P> relation = new LinkedHashMap<>();
    private List<String> dimensionIds = Collections.emptyList();
    private PivotSpec spec = PivotSpec.allRows(Collections.emptyList());
    private AxisSnapshot snapshot = AxisSnapshot.EMPTY;

    // Distinct resolved values per dimension, in first-seen order
    private final Map<String, Set<Object>> dimensionValues = new LinkedHashMap<>();

    private int recomputeCount;

    /**
     * Replace the relation and the pivot.
     * An empty or null pivot puts every dimension on the row axis.
     * @param relation Entries to copy into the index.
     * @param dimensionIds Dimensions in the canonical order of the relation keys.
     * @param pivot Initial pivot, may be null.
     * @throws InvalidPivotSpecException if the pivot does not partition the dimensions;
     *         the index is left as it was.
     */
    public void reset(Map<Tuple, ? extends P> relation, List<String> dimensionIds, PivotSpec pivot) {
        List<String> dimensions = Collections.unmodifiableList(new ArrayList<>(dimensionIds));
        PivotSpec effective = pivot == null || pivot.isEmpty() ? PivotSpec.allRows(dimensions) : pivot;
        effective.validate(dimensions);
        for (Tuple key : relation.keySet()) {
            checkArity(key, dimensions.size());
        }

        this.relation = new LinkedHashMap<>(relation);
        this.dimensionIds = dimensions;
        rebuildDimensionValues();
        this.spec = effective;
        recompute();
    }

    /**
     * Replace the relation and the pivot given as separate axis lists.
     * @see #reset(Map, List, PivotSpec)
     */
    public void reset(Map<Tuple, ? extends P> relation, List<String> dimensionIds, List<String> rows,
                      List<String> columns, List<String> frozen, Tuple frozenValue) {
        reset(relation, dimensionIds, new PivotSpec(rows, columns, frozen, frozenValue));
    }

    /**
     * Drop the relation, the dimensions and the pivot.
     */
    public void clear() {
        relation = new LinkedHashMap<>();
        dimensionIds = Collections.emptyList();
        dimensionValues.clear();
        spec = PivotSpec.allRows(Collections.emptyList());
        snapshot = AxisSnapshot.EMPTY;
    }

    /**
     * Apply a new pivot. Nothing is recomputed if the pivot equals the current one.
     * @param pivot The pivot to apply.
     * @throws InvalidPivotSpecException if the pivot does not partition the dimensions;
     *         the current pivot stays in effect.
     */
    public void setPivot(PivotSpec pivot) {
        pivot.validate(dimensionIds);
        if (pivot.equals(spec)) {
            return;
        }
        spec = pivot;
        recompute();
    }

    /**
     * Apply a new pivot given as separate axis lists.
     * @see #setPivot(PivotSpec)
     */
    public void setPivot(List<String> rows, List<String> columns, List<String> frozen, Tuple frozenValue) {
        setPivot(new PivotSpec(rows, columns, frozen, frozenValue));
    }

    /**
     * Select another slice of the frozen dimensions.
     * @param value One component per frozen dimension.
     * @throws FrozenValueLengthMismatchException if the length does not match the frozen dimensions.
     */
    public void setFrozenValue(Tuple value) {
        if (value.size() != spec.getFrozen().size()) {
            throw new FrozenValueLengthMismatchException(spec.getFrozen().size(), value.size());
        }
        if (value.equals(spec.getFrozenValue())) {
            return;
        }
        setPivot(spec.withFrozenValue(value));
    }

    /**
     * Merge entries into the relation and recompute the header caches.
     * An entry with a null payload never overwrites a key that is already present.
     * If frozen dimensions exist but no frozen value has been resolved yet, the
     * frozen value of the first suitable relation key is selected.
     * <p>New header values are appended after the existing ones, so callers can
     * grow a materialised window by the returned delta.
     * @param entries Keys in canonical order mapped to payloads.
     * @return Growth of the row and column headers.
     */
    public AxisDelta add(Map<Tuple, ? extends P> entries) {
        Map<Tuple, P> addable = new LinkedHashMap<>();
        for (Map.Entry<Tuple, ? extends P> entry : entries.entrySet()) {
            checkArity(entry.getKey(), dimensionIds.size());
            if (entry.getValue() != null || !relation.containsKey(entry.getKey())) {
                addable.put(entry.getKey(), entry.getValue());
            }
        }
        if (addable.isEmpty()) {
            return AxisDelta.NONE;
        }
        relation.putAll(addable);
        for (Tuple key : addable.keySet()) {
            collectDimensionValues(key);
        }
        if (!spec.getFrozen().isEmpty() && isEntirelyUnresolved(spec.getFrozenValue())) {
            Tuple firstFrozen = firstResolvedFrozenValue();
            if (firstFrozen != null) {
                spec = spec.withFrozenValue(firstFrozen);
            }
        }
        return recomputeAndMeasure();
    }

    /**
     * Remove keys from the relation and recompute the header caches.
     * Unlike {@link #add(Map)}, removal may shift header values that remain,
     * so the returned delta says how much an axis shrank, not where.
     * @param keys Keys in canonical order.
     * @return Change of the row and column header lengths, zero or negative.
     */
    public AxisDelta remove(Collection<Tuple> keys) {
        if (!relation.keySet().removeAll(new HashSet<>(keys))) {
            return AxisDelta.NONE;
        }
        rebuildDimensionValues();
        return recomputeAndMeasure();
    }

    /**
     * Replace payloads of keys already in the relation. Headers are not affected,
     * keys not in the relation are ignored.
     * @param entries Keys in canonical order mapped to new payloads.
     * @return Number of payloads replaced.
     */
    public int update(Map<Tuple, ? extends P> entries) {
        int updated = 0;
        for (Map.Entry<Tuple, ? extends P> entry : entries.entrySet()) {
            if (relation.containsKey(entry.getKey())) {
                relation.put(entry.getKey(), entry.getValue());
                updated++;
            }
        }
        return updated;
    }

    /**
     * Collect the frozen projections of some keys.
     * @param keys Keys in canonical order.
     * @return Distinct frozen values, in the order met.
     */
    public Set<Tuple> frozenValues(Collection<Tuple> keys) {
        int[] frozenPositions = KeyPermutation.positionsOf(dimensionIds, spec.getFrozen());
        Set<Tuple> values = new LinkedHashSet<>();
        for (Tuple key : keys) {
            values.add(key.select(frozenPositions));
        }
        return values;
    }

    /**
     * Compute the distinct values along an axis.
     * Keys outside the current frozen slice are skipped, projections holding an
     * unresolved component are left out, duplicates keep their first position.
     * @param axisDimensions Dimensions of the axis, in axis order.
     * @return Header values in first-seen order.
     */
    public List<Tuple> uniqueAxisValues(List<String> axisDimensions) {
        if (axisDimensions.isEmpty()) {
            return new ArrayList<>();
        }
        for (String dimension : axisDimensions) {
            if (!dimensionIds.contains(dimension)) {
                throw new IllegalArgumentException("unknown dimension '" + dimension + "'");
            }
        }
        int[] axisPositions = KeyPermutation.positionsOf(dimensionIds, axisDimensions);
        int[] frozenPositions = KeyPermutation.positionsOf(dimensionIds, spec.getFrozen());
        boolean sliced = frozenPositions.length > 0;
        Tuple frozenValue = spec.getFrozenValue();

        Set<Tuple> unique = new LinkedHashSet<>();
        for (Tuple key : relation.keySet()) {
            if (sliced && !key.select(frozenPositions).equals(frozenValue)) {
                continue;
            }
            Tuple projection = key.select(axisPositions);
            if (projection.isResolved()) {
                unique.add(projection);
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * Get the row axis value at a row.
     * With row dimensions but an empty header, row 0 yields a placeholder of
     * unresolved components, so a view can still offer one row for new entries.
     * Without row dimensions, row 0 yields the empty tuple.
     * @param row Zero-based row.
     * @return The row axis value.
     * @throws PivotIndexOutOfRangeException if the row is not addressable.
     */
    public Tuple rowKey(int row) {
        return axisKey("row", spec.getRows(), snapshot.rowHeader, row);
    }

    /**
     * Get the column axis value at a column.
     * @see #rowKey(int) for the placeholder and empty axis rules.
     * @param column Zero-based column.
     * @return The column axis value.
     * @throws PivotIndexOutOfRangeException if the column is not addressable.
     */
    public Tuple columnKey(int column) {
        return axisKey("column", spec.getColumns(), snapshot.columnHeader, column);
    }

    private static Tuple axisKey(String axis, List<String> dimensions, List<Tuple> header, int index) {
        if (dimensions.isEmpty() || header.isEmpty()) {
            if (index == 0) {
                return dimensions.isEmpty() ? Tuple.empty() : Tuple.unresolved(dimensions.size());
            }
            throw new PivotIndexOutOfRangeException(axis, index, 1);
        }
        if (index < 0 || index >= header.size()) {
            throw new PivotIndexOutOfRangeException(axis, index, header.size());
        }
        return header.get(index);
    }

    /**
     * Reassemble the relation key addressed by a cell.
     * @param row Zero-based row.
     * @param column Zero-based column.
     * @return The key in canonical order, possibly holding unresolved components.
     */
    public Tuple fullKey(int row, int column) {
        Tuple pivotedKey = Tuple.concat(rowKey(row), columnKey(column), spec.getFrozenValue());
        return snapshot.permutation.apply(pivotedKey);
    }

    /**
     * Look up the payload of a cell.
     * @param row Zero-based row.
     * @param column Zero-based column.
     * @return The payload, or null if the addressed key is absent or holds no payload.
     */
    public P getCell(int row, int column) {
        return relation.get(fullKey(row, column));
    }

    /**
     * Look up payloads for every combination of the given rows and columns.
     * With neither row nor column header values, the single fully sliced cell is
     * returned when every dimension is frozen, otherwise no data at all.
     * @param rowMask Rows to read.
     * @param columnMask Columns to read.
     * @return One list per requested row, one payload (or null) per requested column.
     */
    public List<List<P>> pivotedData(List<Integer> rowMask, List<Integer> columnMask) {
        List<List<P>> data = new ArrayList<>();
        if (snapshot.rowHeader.isEmpty() && snapshot.columnHeader.isEmpty()) {
            if (!spec.getFrozen().isEmpty() && spec.getFrozen().size() == dimensionIds.size()) {
                data.add(Collections.singletonList(getCell(0, 0)));
            }
            return data;
        }
        for (int row : rowMask) {
            Tuple rowKey = rowKey(row);
            List<P> dataRow = new ArrayList<>(columnMask.size());
            for (int column : columnMask) {
                Tuple pivotedKey = Tuple.concat(rowKey, columnKey(column), spec.getFrozenValue());
                dataRow.add(relation.get(snapshot.permutation.apply(pivotedKey)));
            }
            data.add(dataRow);
        }
        return data;
    }

    /**
     * @return The row header cache.
     */
    public List<Tuple> getRowHeader() {
        return snapshot.rowHeader;
    }

    /**
     * @return The column header cache.
     */
    public List<Tuple> getColumnHeader() {
        return snapshot.columnHeader;
    }

    public PivotSpec getPivot() {
        return spec;
    }

    public List<String> getPivotRows() {
        return spec.getRows();
    }

    public List<String> getPivotColumns() {
        return spec.getColumns();
    }

    public List<String> getPivotFrozen() {
        return spec.getFrozen();
    }

    public Tuple getFrozenValue() {
        return spec.getFrozenValue();
    }

    public List<String> getDimensionIds() {
        return dimensionIds;
    }

    /**
     * Get the distinct resolved values a dimension takes in the relation.
     * @param dimension A dimension id.
     * @return Values in first-seen order, empty for unknown dimensions.
     */
    public Set<Object> dimensionValues(String dimension) {
        Set<Object> values = dimensionValues.get(dimension);
        return values == null ? Collections.emptySet() : Collections.unmodifiableSet(values);
    }

    /**
     * @param key A key in canonical order.
     * @return true if the relation holds the key, with or without payload.
     */
    public boolean containsKey(Tuple key) {
        return relation.containsKey(key);
    }

    /**
     * @return Number of entries in the relation.
     */
    public int size() {
        return relation.size();
    }

    /**
     * @return How many times the header caches have been rebuilt.
     */
    public int getRecomputeCount() {
        return recomputeCount;
    }

    private AxisDelta recomputeAndMeasure() {
        int oldRowCount = snapshot.rowHeader.size();
        int oldColumnCount = snapshot.columnHeader.size();
        recompute();
        return new AxisDelta(snapshot.rowHeader.size() - oldRowCount,
                snapshot.columnHeader.size() - oldColumnCount);
    }

    private void recompute() {
        KeyPermutation permutation = KeyPermutation.of(dimensionIds, spec.concatenatedDimensions());
        List<Tuple> rowHeader = uniqueAxisValues(spec.getRows());
        List<Tuple> columnHeader = uniqueAxisValues(spec.getColumns());
        snapshot = new AxisSnapshot(permutation, rowHeader, columnHeader);
        recomputeCount++;
    }

    private void rebuildDimensionValues() {
        dimensionValues.clear();
        for (Tuple key : relation.keySet()) {
            collectDimensionValues(key);
        }
    }

    private void collectDimensionValues(Tuple key) {
        for (int i = 0; i < dimensionIds.size(); i++) {
            Set<Object> values = dimensionValues.computeIfAbsent(dimensionIds.get(i), k -> new LinkedHashSet<>());
            key.get(i).ifPresent(values::add);
        }
    }

    private Tuple firstResolvedFrozenValue() {
        int[] frozenPositions = KeyPermutation.positionsOf(dimensionIds, spec.getFrozen());
        for (Tuple key : relation.keySet()) {
            Tuple frozen = key.select(frozenPositions);
            if (frozen.isResolved()) {
                return frozen;
            }
        }
        return null;
    }

    private static boolean isEntirelyUnresolved(Tuple value) {
        for (int i = 0; i < value.size(); i++) {
            if (value.get(i).isPresent()) {
                return false;
            }
        }
        return true;
    }

    private static void checkArity(Tuple key, int arity) {
        if (key.size() != arity) {
            throw new IllegalArgumentException("key " + key + " must have " + arity + " components");
        }
    }
}
