package com.example.cortex.event;

public enum MemoryEventType {
    MEMORY_SPACE_CREATED,
    MEMORY_STORED,
    MEMORY_IMPORTANCE_REVISED,
    FACT_STORED,
    PROPERTY_INTERACTION_RECORDED
}
