package com.example.cortex.domain;

public enum ParticipantType {
    HUMAN,
    AGENT
}
