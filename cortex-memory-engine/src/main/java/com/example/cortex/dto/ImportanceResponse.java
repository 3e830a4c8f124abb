package com.example.cortex.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImportanceResponse {
    String memoryId;
    int importance;
    int revision;
}
