package com.example.bridge.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Conversation Thread Bridge API",
                        version = "1.0",
                        description = "Resolves channel conversations to workflow thread ids and administers stored mappings."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi threadMappingApi() {
        return GroupedOpenApi.builder()
                .group("thread-mappings")
                .pathsToMatch("/api/thread-mappings/**")
                .build();
    }
}
