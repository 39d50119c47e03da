package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.Tuple;

/**
 * Writes relation entries to the backing store. The store reports accepted
 * changes back to the grid, which is never modified here directly.
 */
public interface RelationMutator {

    /**
     * Create an entry or replace its payload.
     * @param key Fully resolved key in canonical dimension order.
     * @param value The edited value.
     * @throws EditRejectedException if the store refuses the value.
     */
    void upsert(Tuple key, Object value) throws EditRejectedException;

    /**
     * Delete an entry.
     * @param key Key in canonical dimension order.
     * @throws EditRejectedException if the store refuses the deletion.
     */
    void delete(Tuple key) throws EditRejectedException;
}
