package com.ai.clinic.structure;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * LIFO log of mutations. Inverting a record is up to the caller.
 */
public class UndoLog {

    private final Deque<UndoRecord> stack = new ArrayDeque<>();

    public void push(UndoRecord record) {
        stack.push(record);
    }

    public Optional<UndoRecord> pop() {
        return Optional.ofNullable(stack.poll());
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }
}
