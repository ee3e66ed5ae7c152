package com.hydra.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hydraOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Hydra Decision Core API")
                        .description("Signals, regime, risk ledger and open positions")
                        .version("0.1"));
    }
}
