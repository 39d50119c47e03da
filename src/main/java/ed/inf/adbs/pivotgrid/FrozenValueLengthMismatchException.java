package ed.inf.adbs.pivotgrid;

/**
 * Thrown when a frozen value is set whose length differs from the number of frozen dimensions.
 */
public class FrozenValueLengthMismatchException extends IllegalArgumentException {

    public FrozenValueLengthMismatchException(int expected, int actual) {
        super("frozen value must have " + expected + " components, got " + actual);
    }
}
