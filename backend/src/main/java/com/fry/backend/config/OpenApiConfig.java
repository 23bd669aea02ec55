package com.fry.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI painEngineOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pain Scoring Engine API")
                        .description("Pain-weighted loss scoring, trader tiers and network pain analytics")
                        .version("1.0"));
    }
}
