package com.example.footprint.service.queue;

import com.example.footprint.model.JobPayload;
import lombok.Builder;
import lombok.Value;

/**
 * Сообщение, выданное воркеру.
 */
@Value
@Builder
public class QueuedJob {
    String jobId;
    JobPayload payload;

    /**
     * Имя бэкенда, из которого получено сообщение; используется для подтверждения.
     */
    String source;

    /**
     * Сырое сообщение бэкенда для подтверждения, может отсутствовать.
     */
    String receipt;
}
