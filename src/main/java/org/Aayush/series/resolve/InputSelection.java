package org.Aayush.series.resolve;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable ascending set of input indices chosen for one request.
 */
@ToString
@EqualsAndHashCode
public final class InputSelection {
    private final IntSortedSet indices;

    InputSelection(IntSortedSet indices) {
        this.indices = IntSortedSets.unmodifiable(new IntRBTreeSet(indices));
    }

    /**
     * Creates a selection from explicit indices.
     */
    public static InputSelection of(int... indices) {
        return new InputSelection(new IntRBTreeSet(indices));
    }

    /**
     * Returns selected indices in ascending order.
     */
    public IntSortedSet indices() {
        return indices;
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Returns whether exactly one input was chosen.
     */
    public boolean isSingle() {
        return indices.size() == 1;
    }

    /**
     * Returns the only selected index.
     *
     * @throws IllegalStateException when the selection is not single.
     */
    public int single() {
        if (!isSingle()) {
            throw new IllegalStateException("selection holds " + indices.size() + " inputs");
        }
        return indices.firstInt();
    }
}
