package com.library.circulation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI circulationOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Library Circulation API")
                .description("Loans, renewals, fines and per-title reservation queues. "
                    + "Every borrow, return, renewal and queue change is serialized per title. "
                    + "Callers are expected to be authenticated and authorized upstream.")
                .version("1.0.0"));
    }
}
