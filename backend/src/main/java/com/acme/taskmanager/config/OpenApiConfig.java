package com.acme.taskmanager.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI taskManagerOpenApi(@Value("${app.version:1.0.0}") String version) {
        return new OpenAPI().info(new Info()
                .title("Task Manager API")
                .description("Task CRUD, batch creation and aggregate statistics")
                .version(version));
    }
}
