package com.openrangelabs.nycdata.sync.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 / Swagger documentation.
 *
 * <p>Describes the freshness, planning, ingestion and dataset configuration endpoints
 * and the bearer-token scheme they are protected by.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8082}")
    private String serverPort;

    /**
     * Configures the OpenAPI specification for the sync service.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI nycDataSyncOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT token obtained from authentication service")));
    }

    private Info apiInfo() {
        return new Info()
                .title("NYC Open Data Sync API")
                .description("""
                # NYC Open Data Sync Service

                Keeps local copies of NYC Open Data datasets current.

                ## Key Features

                * **Freshness scoring**: compares local record counts with the live source
                * **Sync planning**: tiered recommendations from immediate to this week
                * **Bounded execution**: concurrency cap and wall-clock budget per run
                * **Audit trail**: every ingestion attempt is recorded in the sync log

                ## Security

                Read endpoints require the USER or ADMIN role. Ingestion triggers and
                dataset configuration changes require ADMIN.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://openrangelabs.com/license"));
    }
}
