package com.example.cortex.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class StorePreferenceRequest {

    @NotBlank
    private String userId;

    @NotBlank
    @Size(max = 64)
    private String category;

    @NotBlank
    @JsonAlias("preferenceValue")
    private String preference;

    @NotNull
    @Min(0)
    @Max(100)
    private Integer confidence;

    private Map<String, Object> metadata = new HashMap<>();
}
