package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.Dimension;

/**
 * Creates new values of a dimension in the backing store.
 */
public interface EntityCreator {

    /**
     * Create a dimension value.
     * @param dimension The dimension to extend.
     * @param name Name of the new value.
     * @return Id of the created value.
     * @throws EditRejectedException if the store refuses the value.
     */
    Object create(Dimension dimension, String name) throws EditRejectedException;

    /**
     * Tell whether a value referenced by a relation key exists in the store.
     * Values reported missing are created before an entry using them is added.
     * @param dimension The dimension of the value.
     * @param id The value.
     * @return true if no creation is needed.
     */
    default boolean exists(Dimension dimension, Object id) {
        return true;
    }
}
