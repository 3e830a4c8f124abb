package com.example.cortex.domain;

public enum MessageRole {
    USER,
    AGENT
}
