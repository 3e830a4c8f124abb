package com.example.cortex.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage implements Serializable {

    private String id;
    private MessageRole role;
    private String content;
    private Instant timestamp;
}
