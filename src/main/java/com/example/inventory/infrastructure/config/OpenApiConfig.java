package com.example.inventory.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI inventoryLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Inventory Ledger API")
                        .description("""
                                Inventory ledger and bundle availability engine.

                                ## Concepts

                                - **Ledger**: append-only inventory change events per (warehouse, product)
                                - **Projection**: current quantity derived from the ledger, rebuildable at any time
                                - **Bundles**: availability resolved recursively from component stock

                                Change submissions accept an optional `X-Idempotency-Key` header.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Inventory Team")
                                .email("inventory@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
