package ed.inf.adbs.pivotgrid.grid;

/**
 * Disjoint areas of a pivot grid.
 * @see GridProjector#regionOf(int, int)
 */
public enum GridRegion {

    // top left cell showing the name of a row dimension
    ROW_DIMENSION_NAME,

    // top left cell showing the name of a column dimension
    COLUMN_DIMENSION_NAME,

    // remaining top left cells
    CORNER,

    // column header values
    COLUMN_HEADER,

    // row header values
    ROW_HEADER,

    // payloads
    DATA,

    // trailing row where new row axis values are entered
    EMPTY_ROW_HEADER,

    // trailing column where new column axis values are entered
    EMPTY_COLUMN_HEADER,

    // cells that hold nothing, e.g. the line between column headers and data
    BLANK
}
