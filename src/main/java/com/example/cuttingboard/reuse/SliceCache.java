package com.example.cuttingboard.reuse;

import com.example.cuttingboard.slice.Slice;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * A bounded list of slices, most recently used first.
 *
 * <p>Not thread-safe: the owner serializes lookups, promotions and insertions.
 */
public final class SliceCache {

    private final int capacity;
    private final LinkedList<Slice> slices = new LinkedList<>();

    public SliceCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return slices.size();
    }

    /**
     * The cached slices, most recently used first.
     */
    public List<Slice> slices() {
        return new ArrayList<>(slices);
    }

    /**
     * Moves the slice at {@code index} to the front.
     */
    public Slice promote(int index) {
        Slice slice = slices.remove(index);
        slices.addFirst(slice);
        return slice;
    }

    /**
     * Adds a slice at the front, evicting the least recently used one when full.
     *
     * @return the evicted slice, if any
     */
    public Optional<Slice> insert(Slice slice) {
        slices.addFirst(slice);
        if (slices.size() > capacity) {
            return Optional.of(slices.removeLast());
        }
        return Optional.empty();
    }

    public void clear() {
        slices.clear();
    }
}
