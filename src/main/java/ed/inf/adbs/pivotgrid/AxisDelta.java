package ed.inf.adbs.pivotgrid;

/**
 * Signed change in header length on both axes caused by adding or removing relation entries.
 */
public final class AxisDelta {

    public static final AxisDelta NONE = new AxisDelta(0, 0);

    private final int rows;
    private final int columns;

    public AxisDelta(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AxisDelta that = (AxisDelta) o;
        return rows == that.rows && columns == that.columns;
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns;
    }

    @Override
    public String toString() {
        return "(" + rows + ", " + columns + ")";
    }
}
