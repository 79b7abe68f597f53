package com.example.footprint.service.queue;

import com.example.footprint.model.CalculationPayload;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobQueueTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();

    @Test
    void shouldDeliverInFifoOrder() {
        queue.enqueue("job-1", CalculationPayload.of("p1"));
        queue.enqueue("job-2", CalculationPayload.of("p2"));

        assertEquals(2, queue.size());
        QueuedJob first = queue.dequeue(Duration.ZERO).orElseThrow();
        QueuedJob second = queue.dequeue(Duration.ZERO).orElseThrow();

        assertEquals("job-1", first.getJobId());
        assertEquals("job-2", second.getJobId());
        assertEquals(InMemoryJobQueue.NAME, first.getSource());
        assertEquals(CalculationPayload.of("p1"), first.getPayload());
        assertEquals(0, queue.size());
    }

    @Test
    void shouldReturnEmptyAfterTimeout() {
        Optional<QueuedJob> next = queue.dequeue(Duration.ofMillis(20));

        assertTrue(next.isEmpty());
    }
}
