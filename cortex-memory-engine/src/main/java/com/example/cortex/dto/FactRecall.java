package com.example.cortex.dto;

public record FactRecall(String fact, int confidence, String category, String subject, String object) {
}
