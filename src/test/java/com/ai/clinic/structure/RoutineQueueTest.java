package com.ai.clinic.structure;

import com.ai.clinic.entity.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutineQueueTest {

    private static Token token(long id) {
        return Token.builder()
                .tokenId(id)
                .patientId(id)
                .doctorId(1L)
                .slotId(id + 100)
                .type(Token.Type.ROUTINE)
                .build();
    }

    private static List<Long> ids(List<Token> tokens) {
        return tokens.stream().map(Token::getTokenId).toList();
    }

    @Test
    void dequeue_returnsTokensInArrivalOrder() {
        RoutineQueue queue = new RoutineQueue(4);
        queue.enqueue(token(1));
        queue.enqueue(token(2));
        queue.enqueue(token(3));

        assertEquals(1L, queue.dequeue().orElseThrow().getTokenId());
        assertEquals(2L, queue.dequeue().orElseThrow().getTokenId());
        assertEquals(3L, queue.dequeue().orElseThrow().getTokenId());
        assertTrue(queue.isEmpty());
        assertTrue(queue.dequeue().isEmpty());
    }

    @Test
    void enqueue_rejectsWhenFullWithoutMutating() {
        RoutineQueue queue = new RoutineQueue(2);
        assertTrue(queue.enqueue(token(1)));
        assertTrue(queue.enqueue(token(2)));

        assertFalse(queue.enqueue(token(3)));
        assertTrue(queue.isFull());
        assertEquals(List.of(1L, 2L), ids(queue.snapshot()));
    }

    @Test
    void wrapsAroundTheBackingArray() {
        RoutineQueue queue = new RoutineQueue(3);
        queue.enqueue(token(1));
        queue.enqueue(token(2));
        queue.dequeue();
        queue.dequeue();
        queue.enqueue(token(3));
        queue.enqueue(token(4));
        queue.enqueue(token(5));

        assertEquals(3, queue.size());
        assertEquals(List.of(3L, 4L, 5L), ids(queue.snapshot()));
        assertEquals(3L, queue.peek().orElseThrow().getTokenId());
    }

    @Test
    void peek_doesNotRemove() {
        RoutineQueue queue = new RoutineQueue(2);
        assertTrue(queue.peek().isEmpty());
        queue.enqueue(token(7));

        assertEquals(7L, queue.peek().orElseThrow().getTokenId());
        assertEquals(1, queue.size());
    }

    @Test
    void removeById_keepsRelativeOrderOfOthers() {
        RoutineQueue queue = new RoutineQueue(5);
        for (long id = 1; id <= 4; id++) queue.enqueue(token(id));

        Token removed = queue.removeById(3).orElseThrow();

        assertEquals(3L, removed.getTokenId());
        assertEquals(List.of(1L, 2L, 4L), ids(queue.snapshot()));
        assertFalse(queue.contains(3));
    }

    @Test
    void removeById_missingTokenLeavesQueueIntact() {
        RoutineQueue queue = new RoutineQueue(3);
        queue.enqueue(token(1));
        queue.enqueue(token(2));

        assertTrue(queue.removeById(99).isEmpty());
        assertEquals(List.of(1L, 2L), ids(queue.snapshot()));
    }

    @Test
    void enqueueFront_putsTokenBackAtHead() {
        RoutineQueue queue = new RoutineQueue(3);
        queue.enqueue(token(1));
        queue.enqueue(token(2));
        Token head = queue.dequeue().orElseThrow();

        assertTrue(queue.enqueueFront(head));
        assertEquals(List.of(1L, 2L), ids(queue.snapshot()));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RoutineQueue(0));
    }
}
