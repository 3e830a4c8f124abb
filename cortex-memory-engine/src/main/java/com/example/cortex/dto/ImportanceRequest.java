package com.example.cortex.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ImportanceRequest {

    @NotBlank
    private String userId;

    /**
     * Values outside 0 to 100 are clamped rather than rejected.
     */
    @NotNull
    private Integer importance;
}
