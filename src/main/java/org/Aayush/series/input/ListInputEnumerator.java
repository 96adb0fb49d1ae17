package org.Aayush.series.input;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;

/**
 * {@link InputEnumerator} backed by a fastutil list.
 */
public final class ListInputEnumerator implements InputEnumerator {
    private final ObjectArrayList<String> sources = new ObjectArrayList<>();

    @Override
    public void append(String source) {
        sources.add(Objects.requireNonNull(source, "source"));
    }

    @Override
    public void clear() {
        sources.clear();
    }

    @Override
    public int size() {
        return sources.size();
    }

    @Override
    public String source(int index) {
        if (index < 0 || index >= sources.size()) {
            throw new IndexOutOfBoundsException("Input index out of bounds: " + index);
        }
        return sources.get(index);
    }

    @Override
    public String toString() {
        return "ListInputEnumerator" + sources;
    }
}
