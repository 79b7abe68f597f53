package com.example.footprint.dto;

import com.example.footprint.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {
    private Map<JobStatus, Long> jobsByStatus;
    private long queueDepth;
    private String queueBackend;
    private String cacheBackend;
    private String storeBackend;
}
