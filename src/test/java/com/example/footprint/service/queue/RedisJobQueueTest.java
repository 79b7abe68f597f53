package com.example.footprint.service.queue;

import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.model.CalculationPayload;
import com.example.footprint.model.PayloadKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisJobQueueTest {

    private static final String PENDING = "fp:queue:pending";
    private static final String PROCESSING = "fp:queue:processing:node-1";

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private StringRedisTemplate redis;
    private ListOperations<String, String> lists;
    private RedisJobQueue queue;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        lists = mock(ListOperations.class);
        when(redis.opsForList()).thenReturn(lists);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        queue = new RedisJobQueue(redis, objectMapper, clock, "fp", "node-1");
    }

    @Test
    void shouldPushMessageAndReadItBackReliably() {
        // Given
        queue.enqueue("job-1", CalculationPayload.of("product-1"));
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(lists).leftPush(eq(PENDING), message.capture());
        assertTrue(message.getValue().contains("\"kind\":\"CALCULATION\""));

        when(lists.rightPopAndLeftPush(PENDING, PROCESSING, Duration.ofSeconds(1))).thenReturn(message.getValue());

        // When
        QueuedJob job = queue.dequeue(Duration.ofSeconds(1)).orElseThrow();

        // Then
        assertEquals("job-1", job.getJobId());
        assertEquals(PayloadKind.CALCULATION, job.getPayload().kind());
        assertEquals(CalculationPayload.of("product-1"), job.getPayload());
        assertEquals(RedisJobQueue.NAME, job.getSource());

        queue.ack(job);
        verify(lists).remove(PROCESSING, 1, message.getValue());
    }

    @Test
    void shouldReturnEmptyWhenNothingArrives() {
        when(lists.rightPopAndLeftPush(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertTrue(queue.dequeue(Duration.ofMillis(100)).isEmpty());
    }

    @Test
    void shouldDropMalformedMessage() {
        when(lists.rightPopAndLeftPush(anyString(), anyString(), any(Duration.class))).thenReturn("garbage");

        assertTrue(queue.dequeue(Duration.ofMillis(100)).isEmpty());
        verify(lists).remove(PROCESSING, 1, "garbage");
    }

    @Test
    void shouldRequeueUnacknowledgedMessagesOnRecovery() {
        when(lists.rightPopAndLeftPush(PROCESSING, PENDING)).thenReturn("m1", "m2", null);

        assertEquals(2, queue.recoverUnacknowledged());
    }

    @Test
    void shouldTranslateBackendFailures() {
        when(lists.leftPush(anyString(), anyString())).thenThrow(new RedisConnectionFailureException("down"));
        when(lists.size(PENDING)).thenThrow(new RedisConnectionFailureException("down"));

        assertThrows(QueueUnavailableException.class, () -> queue.enqueue("job-1", CalculationPayload.of("p")));
        assertThrows(QueueUnavailableException.class, queue::size);
    }
}
