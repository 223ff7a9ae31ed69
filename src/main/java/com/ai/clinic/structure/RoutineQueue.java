package com.ai.clinic.structure;

import com.ai.clinic.entity.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer holding routine tokens in arrival order.
 * enqueue/dequeue/peek are O(1); removal by id is a full drain-and-refill.
 */
public class RoutineQueue {

    private static final Logger log = LoggerFactory.getLogger(RoutineQueue.class);

    private final Token[] buffer;
    private int head;
    private int tail;
    private int size;

    public RoutineQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.buffer = new Token[capacity];
    }

    /**
     * @return false, with nothing changed, when the queue is full
     */
    public boolean enqueue(Token token) {
        if (size == buffer.length) {
            return false;
        }
        buffer[tail] = token;
        tail = (tail + 1) % buffer.length;
        size++;
        return true;
    }

    /**
     * Puts a token back in front of the current head. Used to return a token
     * that was just dequeued to the position it was taken from.
     */
    public boolean enqueueFront(Token token) {
        if (size == buffer.length) {
            return false;
        }
        head = (head - 1 + buffer.length) % buffer.length;
        buffer[head] = token;
        size++;
        return true;
    }

    public Optional<Token> dequeue() {
        if (size == 0) {
            return Optional.empty();
        }
        Token token = buffer[head];
        buffer[head] = null;
        head = (head + 1) % buffer.length;
        size--;
        return Optional.of(token);
    }

    public Optional<Token> peek() {
        return size == 0 ? Optional.empty() : Optional.of(buffer[head]);
    }

    /**
     * Drains the queue once and re-enqueues every token except the one with the
     * given id. Relative order of the remaining tokens is unchanged.
     */
    public Optional<Token> removeById(long tokenId) {
        Token removed = null;
        int n = size;
        for (int i = 0; i < n; i++) {
            Token t = dequeue().orElseThrow();
            if (removed == null && t.getTokenId() == tokenId) {
                removed = t;
            } else {
                enqueue(t);
            }
        }
        log.debug("Queue rebuild for token {}: scanned={} removed={}", tokenId, n, removed != null);
        return Optional.ofNullable(removed);
    }

    public boolean contains(long tokenId) {
        for (int i = 0; i < size; i++) {
            if (buffer[(head + i) % buffer.length].getTokenId() == tokenId) {
                return true;
            }
        }
        return false;
    }

    /** Tokens from head to tail. */
    public List<Token> snapshot() {
        List<Token> tokens = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            tokens.add(buffer[(head + i) % buffer.length]);
        }
        return Collections.unmodifiableList(tokens);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == buffer.length;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }
}
