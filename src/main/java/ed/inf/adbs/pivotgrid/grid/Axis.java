package ed.inf.adbs.pivotgrid.grid;

/**
 * The two axes of a grid.
 */
public enum Axis {
    ROWS,
    COLUMNS
}
