package com.evidencelocker.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.evidencelocker.core")
@EnableJpaRepositories(basePackages = "com.evidencelocker.core.infrastructure.jpa")
@EntityScan(basePackages = "com.evidencelocker.core.infrastructure.jpa")
public class EvidenceLockerCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(EvidenceLockerCoreApplication.class, args);
	}
}
