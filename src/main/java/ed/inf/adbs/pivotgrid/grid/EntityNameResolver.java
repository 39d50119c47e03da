package ed.inf.adbs.pivotgrid.grid;

import ed.inf.adbs.pivotgrid.Dimension;

/**
 * Turns a dimension value id into the label shown in a header.
 */
public interface EntityNameResolver {

    /**
     * @param dimension The dimension the value belongs to.
     * @param id The value id.
     * @return Display label.
     */
    String resolve(Dimension dimension, Object id);
}
