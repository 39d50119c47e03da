package ed.inf.adbs.pivotgrid;

import java.util.Objects;

/**
 * One dimension of a relation as seen by the grid and its collaborators:
 * the id used in pivots plus the kind of values it holds.
 * This is the context handed to name resolution, renaming and creation.
 */
public final class Dimension {

    private final String id;
    private final DimensionKind kind;

    public Dimension(String id, DimensionKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Shorthand for an entity dimension.
     * @param id Dimension id.
     * @return A dimension of kind {@link DimensionKind#ENTITY}.
     */
    public static Dimension entity(String id) {
        return new Dimension(id, DimensionKind.ENTITY);
    }

    public String getId() {
        return id;
    }

    public DimensionKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dimension that = (Dimension) o;
        return id.equals(that.id) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return id;
    }
}
