package com.example.cortex.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Cortex Memory API",
                        version = "1.0",
                        description = "Conversation memory, preference and recall endpoints for the voice search agent.",
                        contact = @Contact(name = "Cortex Memory Team", email = "support@example.com")))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi memoryApi() {
        return GroupedOpenApi.builder()
                .group("memory")
                .pathsToMatch("/api/memory/**")
                .build();
    }
}
