package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class CacheEntry {
    String key;
    FootprintResult value;
    Instant writtenAt;
}
