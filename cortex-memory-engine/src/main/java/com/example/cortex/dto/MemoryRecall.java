package com.example.cortex.dto;

import java.time.Instant;

public record MemoryRecall(String content, int relevance, Instant timestamp) {
}
