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
public class SpaceParticipant implements Serializable {

    private String id;
    private ParticipantType type;
    private Instant joinedAt;
}
