package com.example.cortex.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a write needs a memory space that no earlier interaction has created.
 */
public class MemorySpaceNotFoundException extends CortexException {

    public MemorySpaceNotFoundException(String userId) {
        super(HttpStatus.NOT_FOUND, "User memory space not found: " + userId, "memory_space_not_found");
    }
}
