package com.ai.clinic.structure;

import com.ai.clinic.entity.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Min-heap of emergency tokens. Lower severity is served first; equal
 * severities come out in insertion order.
 */
public class TriageHeap {

    private static final Logger log = LoggerFactory.getLogger(TriageHeap.class);

    static final Comparator<TriageEntry> ORDER = Comparator
            .comparingInt(TriageEntry::severity)
            .thenComparingLong(TriageEntry::sequence);

    private final PriorityQueue<TriageEntry> heap = new PriorityQueue<>(ORDER);
    private long nextSequence;

    public TriageEntry insert(Token token, int severity) {
        TriageEntry entry = new TriageEntry(severity, nextSequence++, token);
        heap.add(entry);
        return entry;
    }

    /**
     * Puts back an entry previously taken out of this heap, keeping its
     * original severity and sequence. The sequence counter is not touched.
     */
    public void restore(TriageEntry entry) {
        if (entry.sequence() >= nextSequence) {
            throw new IllegalArgumentException("Entry was not issued by this heap: sequence " + entry.sequence());
        }
        heap.add(entry);
    }

    public Optional<TriageEntry> extractMin() {
        return Optional.ofNullable(heap.poll());
    }

    public Optional<Token> peek() {
        TriageEntry top = heap.peek();
        return top == null ? Optional.empty() : Optional.of(top.token());
    }

    /**
     * Pops every entry, keeps those that do not match and heapifies them again.
     */
    public Optional<TriageEntry> removeById(long tokenId) {
        List<TriageEntry> kept = new ArrayList<>(heap.size());
        TriageEntry removed = null;
        while (!heap.isEmpty()) {
            TriageEntry e = heap.poll();
            if (removed == null && e.token().getTokenId() == tokenId) {
                removed = e;
            } else {
                kept.add(e);
            }
        }
        heap.addAll(kept);
        log.debug("Heap rebuild for token {}: kept={} removed={}", tokenId, kept.size(), removed != null);
        return Optional.ofNullable(removed);
    }

    /** Entries in the order extractMin would return them. */
    public List<TriageEntry> snapshot() {
        List<TriageEntry> entries = new ArrayList<>(heap);
        entries.sort(ORDER);
        return List.copyOf(entries);
    }

    public int size() {
        return heap.size();
    }
}
