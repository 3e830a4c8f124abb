package com.example.cortex.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.Data;

@Data
public class RememberRequest {

    @NotBlank
    private String userId;

    @NotBlank
    @JsonAlias("query")
    private String userQuery;

    @NotBlank
    @JsonAlias("response")
    private String agentResponse;

    @Size(max = 128)
    private String propertyId;

    /**
     * Left {@code null} when no listing snapshot was sent; an empty object is still logged.
     */
    private Map<String, Object> propertyContext;
}
