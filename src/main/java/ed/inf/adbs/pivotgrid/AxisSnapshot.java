package ed.inf.adbs.pivotgrid;

import java.util.Collections;
import java.util.List;

/**
 * Everything derived from the relation and the pivot: the key permutation and
 * both axis header caches. A snapshot is never modified; structural changes
 * replace it as a whole so a reader always sees a consistent set.
 */
final class AxisSnapshot {

    static final AxisSnapshot EMPTY = new AxisSnapshot(
            KeyPermutation.of(Collections.emptyList(), Collections.emptyList()),
            Collections.emptyList(), Collections.emptyList());

    final KeyPermutation permutation;
    final List<Tuple> rowHeader;
    final List<Tuple> columnHeader;

    AxisSnapshot(KeyPermutation permutation, List<Tuple> rowHeader, List<Tuple> columnHeader) {
        this.permutation = permutation;
        this.rowHeader = Collections.unmodifiableList(rowHeader);
        this.columnHeader = Collections.unmodifiableList(columnHeader);
    }
}
