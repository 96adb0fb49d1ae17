package org.Aayush.series.input;

/**
 * Ordered mapping from dense input index to opaque source identifier.
 */
public interface InputEnumerator {

    /**
     * Appends one source identifier at index {@link #size()}.
     *
     * @param source non-null source identifier.
     */
    void append(String source);

    /**
     * Removes every source identifier.
     */
    void clear();

    /**
     * Returns number of sources.
     */
    int size();

    /**
     * Returns source identifier at one index.
     *
     * @param index dense input index.
     * @return source identifier.
     * @throws IndexOutOfBoundsException when the index is outside {@code [0, size)}.
     */
    String source(int index);

    /**
     * Creates the default mutable enumerator.
     */
    static InputEnumerator create() {
        return new ListInputEnumerator();
    }
}
