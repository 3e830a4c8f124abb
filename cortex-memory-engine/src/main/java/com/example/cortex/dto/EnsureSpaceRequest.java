package com.example.cortex.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EnsureSpaceRequest {

    @NotBlank
    private String userId;
}
