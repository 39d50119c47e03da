package ed.inf.adbs.pivotgrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The Tuple class represents an ordered combination of dimension values.
 * Tuples are used both as full relation keys and as projections of a key onto
 * the dimensions of one axis.
 * A component may be unresolved, which is represented by an empty Optional
 * rather than by a sentinel value, so it can never collide with a real value.
 * The tuple is immutable and unaware of which dimensions its components belong to.
 */
public final class Tuple {

    private static final Tuple EMPTY = new Tuple(Collections.emptyList());

    // Component values, empty Optional for unresolved components
    private final List<Optional<Object>> attributes;

    private Tuple(List<Optional<Object>> attributes) {
        this.attributes = attributes;
    }

    /**
     * Construct a fully resolved tuple.
     * @param values The component values in order, none of them null.
     * @return A tuple holding the given values.
     */
    public static Tuple of(Object... values) {
        List<Optional<Object>> attributes = new ArrayList<>(values.length);
        for (Object value : values) {
            attributes.add(Optional.of(Objects.requireNonNull(value, "tuple component")));
        }
        return new Tuple(Collections.unmodifiableList(attributes));
    }

    /**
     * Construct a tuple from components that may be unresolved.
     * @param attributes The components, an empty Optional marks an unresolved one.
     * @return A tuple holding the given components.
     */
    public static Tuple ofOptionals(List<Optional<Object>> attributes) {
        return new Tuple(Collections.unmodifiableList(new ArrayList<>(attributes)));
    }

    /**
     * Construct a tuple of the given length where every component is unresolved.
     * @param arity Number of components.
     * @return A placeholder tuple.
     */
    public static Tuple unresolved(int arity) {
        return new Tuple(Collections.nCopies(arity, Optional.empty()));
    }

    /**
     * @return The tuple with no components.
     */
    public static Tuple empty() {
        return EMPTY;
    }

    /**
     * Get the number of components.
     * @return The arity of this tuple.
     */
    public int size() {
        return attributes.size();
    }

    /**
     * Get a single component.
     * @param i The zero-based index of the component to retrieve.
     * @return The component, empty if unresolved.
     */
    public Optional<Object> get(int i) {
        return attributes.get(i);
    }

    /**
     * Get a single resolved component value.
     * @param i The zero-based index of the component to retrieve.
     * @return The value, or null if the component is unresolved.
     */
    public Object getAttribute(int i) {
        return attributes.get(i).orElse(null);
    }

    /**
     * Get the list of components.
     * @return An ordered, unmodifiable list of components.
     */
    public List<Optional<Object>> getTuple() {
        return attributes;
    }

    /**
     * Check that no component is unresolved.
     * @return true if every component holds a value.
     */
    public boolean isResolved() {
        for (Optional<Object> attribute : attributes) {
            if (!attribute.isPresent()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Pick components by position.
     * @param positions Source positions, one per component of the result.
     * @return A new tuple whose i-th component is this tuple's component at positions[i].
     */
    public Tuple select(int[] positions) {
        List<Optional<Object>> selected = new ArrayList<>(positions.length);
        for (int position : positions) {
            selected.add(attributes.get(position));
        }
        return new Tuple(Collections.unmodifiableList(selected));
    }

    /**
     * Concatenate tuples in order.
     * @param parts The tuples to join.
     * @return A tuple holding the components of all parts.
     */
    public static Tuple concat(Tuple... parts) {
        List<Optional<Object>> joined = new ArrayList<>();
        for (Tuple part : parts) {
            joined.addAll(part.attributes);
        }
        return new Tuple(Collections.unmodifiableList(joined));
    }

    /**
     * Return a copy with one component replaced.
     * @param i Position of the component to replace.
     * @param value The new, resolved value.
     * @return The modified copy.
     */
    public Tuple with(int i, Object value) {
        List<Optional<Object>> copy = new ArrayList<>(attributes);
        copy.set(i, Optional.of(Objects.requireNonNull(value, "tuple component")));
        return new Tuple(Collections.unmodifiableList(copy));
    }

    /**
     * Converts the tuple to a comma-separated string in parentheses.
     * Unresolved components are written as '?'.
     * @return A string representation of the components.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < attributes.size(); i++) {
            sb.append(attributes.get(i).map(String::valueOf).orElse("?"));
            if (i < attributes.size() - 1) {
                sb.append(", ");
            }
        }
        return sb.append(')').toString();
    }

    /**
     * Two tuples are equal if they have the same number of components
     * and each component at the same position is equal, unresolved matching unresolved.
     * @param o The object to compare with.
     * @return true if given object is a tuple with identical components in the same order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tuple other = (Tuple) o;
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }
}
