package com.example.cortex.domain;

public enum MemorySpaceStatus {
    ACTIVE,
    ARCHIVED
}
