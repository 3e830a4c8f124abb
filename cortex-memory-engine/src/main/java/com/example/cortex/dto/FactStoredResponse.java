package com.example.cortex.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FactStoredResponse {
    String factId;
}
