package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.Dimension;

/**
 * Renames the entity behind a dimension value.
 */
public interface EntityRenamer {

    void rename(Dimension dimension, Object id, String newName) throws EditRejectedException;
}
