package ed.inf.adbs.pivotgrid.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch edit: whether any change request was issued, plus one
 * message per item that a collaborator rejected or that could not be addressed.
 * Rejected items never stop the rest of the batch.
 */
public final class EditResult {

    private final boolean changed;
    private final List<String> errors;

    public EditResult(boolean changed, List<String> errors) {
        this.changed = changed;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static EditResult unchanged() {
        return new EditResult(false, Collections.emptyList());
    }

    public boolean isChanged() {
        return changed;
    }

    public List<String> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
