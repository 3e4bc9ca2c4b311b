package com.evidencelocker.core.config;

import com.evidencelocker.core.application.PrincipalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            PrincipalService principals,
            @Value("${bootstrap.admin.email:}") String adminEmail,
            @Value("${bootstrap.admin.password:}") String adminPassword
    ) {
        return args -> {
            if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.email and bootstrap.admin.password");
                return;
            }

            principals.bootstrapAdmin(adminEmail, adminPassword).ifPresentOrElse(
                    admin -> log.info("Bootstrap admin created: {} ({})", admin.email(), admin.id()),
                    () -> log.info("Bootstrap admin exists: {}", adminEmail));
        };
    }
}
