package com.evidencelocker.core.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI evidenceLockerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Evidence Locker Core API")
                        .description("""
                                Case and evidence management with relation-based access control.

                                ## Authentication
                                All protected endpoints require a Bearer token. Use `/auth/login` to obtain one.

                                ## Access
                                - Cases are visible to their creator, lead investigator and assignee
                                - Evidence is visible to case members, its uploader and every custody recipient
                                - Administrators see everything

                                ## Records
                                - Every change writes one audit entry in the same transaction
                                - Custody entries are append-only and hash-chained
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
