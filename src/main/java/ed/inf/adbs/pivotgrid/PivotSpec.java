package ed.inf.adbs.pivotgrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assignment of every dimension of a relation to exactly one of the row axis,
 * the column axis, or the frozen set, together with the value selected for the
 * frozen dimensions. Instances are immutable.
 */
public final class PivotSpec {

    private final List<String> rows;
    private final List<String> columns;
    private final List<String> frozen;
    private final Tuple frozenValue;

    /**
     * Construct a pivot specification. No partition checks happen here.
     * @see #validate(List)
     * @param rows Dimensions laid out along the row axis, outermost first.
     * @param columns Dimensions laid out along the column axis, outermost first.
     * @param frozen Dimensions collapsed to a single slice.
     * @param frozenValue The selected slice, one component per frozen dimension.
     */
    public PivotSpec(List<String> rows, List<String> columns, List<String> frozen, Tuple frozenValue) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rows, "rows")));
        this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
        this.frozen = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(frozen, "frozen")));
        this.frozenValue = Objects.requireNonNull(frozenValue, "frozenValue");
    }

    /**
     * The default pivot: every dimension on the row axis.
     * @param dimensionIds Dimensions in canonical order.
     * @return A spec with all dimensions as rows.
     */
    public static PivotSpec allRows(List<String> dimensionIds) {
        return new PivotSpec(dimensionIds, Collections.emptyList(), Collections.emptyList(), Tuple.empty());
    }

    public List<String> getRows() {
        return rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getFrozen() {
        return frozen;
    }

    public Tuple getFrozenValue() {
        return frozenValue;
    }

    /**
     * @return true if no dimension has been assigned to any axis.
     */
    public boolean isEmpty() {
        return rows.isEmpty() && columns.isEmpty() && frozen.isEmpty();
    }

    /**
     * @return rows, then columns, then frozen dimensions.
     */
    public List<String> concatenatedDimensions() {
        List<String> all = new ArrayList<>(rows.size() + columns.size() + frozen.size());
        all.addAll(rows);
        all.addAll(columns);
        all.addAll(frozen);
        return all;
    }

    /**
     * Return a spec with the same axes and another frozen value.
     * @param value The new frozen value.
     * @return The modified copy.
     */
    public PivotSpec withFrozenValue(Tuple value) {
        return new PivotSpec(rows, columns, frozen, value);
    }

    /**
     * Check this spec against the dimensions of a relation.
     * Fails when an id is listed twice, when an id is unknown, when some dimension
     * is not assigned to any axis, or when the frozen value does not match the frozen dimensions.
     * @param dimensionIds Dimensions of the relation in canonical order.
     * @throws InvalidPivotSpecException describing the first violation found.
     */
    public void validate(List<String> dimensionIds) {
        Set<String> known = new HashSet<>(dimensionIds);
        if (known.size() != dimensionIds.size()) {
            throw new InvalidPivotSpecException("dimension ids must be unique");
        }
        List<String> assigned = concatenatedDimensions();
        Set<String> seen = new HashSet<>();
        for (String id : assigned) {
            if (!seen.add(id)) {
                throw new InvalidPivotSpecException("dimension '" + id + "' is assigned more than once");
            }
        }
        for (String id : assigned) {
            if (!known.contains(id)) {
                throw new InvalidPivotSpecException("unknown dimension '" + id + "'");
            }
        }
        if (seen.size() != known.size()) {
            Set<String> missing = new HashSet<>(known);
            missing.removeAll(seen);
            throw new InvalidPivotSpecException("dimensions " + missing + " are not assigned to any axis");
        }
        if (frozen.size() != frozenValue.size()) {
            throw new InvalidPivotSpecException("frozen value must be same length as frozen dimensions");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PivotSpec that = (PivotSpec) o;
        return rows.equals(that.rows)
                && columns.equals(that.columns)
                && frozen.equals(that.frozen)
                && frozenValue.equals(that.frozenValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, frozen, frozenValue);
    }

    @Override
    public String toString() {
        return "rows=" + rows + " columns=" + columns + " frozen=" + frozen + " frozenValue=" + frozenValue;
    }
}
