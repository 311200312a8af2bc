package com.sommerph.utxoledger.config;

import io.swagger.v3.oas.models.*;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI utxoLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Private UTXO Ledger API")
                        .version("1.0.0")
                        .description("API for depositing into, transferring within and withdrawing from the private UTXO ledger."));
    }

    @Bean
    public GroupedOpenApi ledgerGroup() {
        return GroupedOpenApi.builder()
                .group("ledger")
                .pathsToMatch("/api/ledger/**")
                .build();
    }

    @Bean
    public GroupedOpenApi custodyGroup() {
        return GroupedOpenApi.builder()
                .group("custody")
                .pathsToMatch("/api/custody/**")
                .build();
    }

}
