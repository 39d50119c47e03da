package ed.inf.adbs.pivotgrid.grid;

/**
 * Thrown by a collaborator that refuses a rename, a creation or a relation change,
 * for instance because a value is not in the value list of its parameter.
 */
public class EditRejectedException extends Exception {

    public EditRejectedException(String reason) {
        super(reason);
    }
}
