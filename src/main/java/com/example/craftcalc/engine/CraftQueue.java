package com.example.craftcalc.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Min-priority queue of item names keyed by depth. A queued item's depth can only be raised.
 * Equal depths pop in the order the items were first queued.
 */
class CraftQueue {
    static final class Entry {
        final String item;
        final int depth;
        final long sequence;
        Entry(String item, int depth, long sequence) { this.item = item; this.depth = depth; this.sequence = sequence; }
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.depth)
            .thenComparingLong(e -> e.sequence);

    private final TreeSet<Entry> ordered = new TreeSet<>(ORDER);
    private final Map<String, Entry> byItem = new HashMap<>();
    private final int maxDepth;
    private long nextSequence;

    CraftQueue() { this(Integer.MAX_VALUE); }

    CraftQueue(int maxDepth) { this.maxDepth = maxDepth; }

    /** Queues {@code item} at {@code depth}, or raises it there if it is already queued lower. */
    void raise(String item, int depth) {
        Entry existing = byItem.get(item);
        if (existing != null) {
            if (depth <= existing.depth) return;
            ordered.remove(existing);
            Entry raised = new Entry(item, depth, existing.sequence);
            ordered.add(raised);
            byItem.put(item, raised);
            return;
        }
        Entry added = new Entry(item, depth, nextSequence++);
        ordered.add(added);
        byItem.put(item, added);
    }

    /** Removes and returns the shallowest entry, or null when empty. */
    Entry poll() {
        Entry first = ordered.pollFirst();
        if (first != null) byItem.remove(first.item);
        return first;
    }

    /**
     * The depth to give an ingredient of an item popped at {@code depth}. When the bound is
     * reached the queue is compacted first and the depth after the last rank is returned.
     */
    int childDepth(int depth) {
        if (depth < maxDepth) return depth + 1;
        compact();
        return ordered.size();
    }

    /** Renumbers every entry to its rank, keeping pop order. */
    private void compact() {
        List<Entry> entries = new ArrayList<>(ordered);
        ordered.clear();
        int rank = 0;
        for (Entry e : entries) {
            Entry renumbered = new Entry(e.item, rank++, e.sequence);
            ordered.add(renumbered);
            byItem.put(e.item, renumbered);
        }
    }
}
