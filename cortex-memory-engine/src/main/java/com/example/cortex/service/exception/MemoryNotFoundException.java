package com.example.cortex.service.exception;

import org.springframework.http.HttpStatus;

public class MemoryNotFoundException extends CortexException {

    public MemoryNotFoundException(String memoryId) {
        super(HttpStatus.NOT_FOUND, "Memory not found: " + memoryId, "memory_not_found");
    }
}
