package com.example.cortex.dto;

public record RememberResult(String conversationId, String memoryId, String memorySpaceId) {
}
