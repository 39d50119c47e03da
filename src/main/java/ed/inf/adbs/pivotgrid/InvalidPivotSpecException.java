package ed.inf.adbs.pivotgrid;

/**
 * Thrown when rows, columns and frozen dimensions do not partition the
 * dimensions of a relation, or when the frozen value does not fit the frozen dimensions.
 * The pivot in effect before the failing call stays untouched.
 */
public class InvalidPivotSpecException extends IllegalArgumentException {

    public InvalidPivotSpecException(String message) {
        super(message);
    }
}
