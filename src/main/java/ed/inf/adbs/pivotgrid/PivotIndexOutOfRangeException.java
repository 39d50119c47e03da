package ed.inf.adbs.pivotgrid;

/**
 * Thrown when a row or column index lies outside the current axis header.
 * Seeing this means a view's geometry went out of step with the index it displays.
 */
public class PivotIndexOutOfRangeException extends IndexOutOfBoundsException {

    public PivotIndexOutOfRangeException(String axis, int index, int length) {
        super("index " + index + " out of range for current " + axis + " pivot of length " + length);
    }
}
