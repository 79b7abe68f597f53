package com.example.footprint.service.queue;

import com.example.footprint.model.JobPayload;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Сообщение очереди в сериализованном виде.
 */
@Value
@Builder
@Jacksonized
public class QueueMessage {
    String jobId;
    JobPayload payload;
    Instant enqueuedAt;
}
