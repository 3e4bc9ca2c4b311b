package com.evidencelocker.core.config;

import com.evidencelocker.core.domain.policy.AccessPolicy;
import com.evidencelocker.core.domain.policy.RelationBasedAccessPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public AccessPolicy accessPolicy() {
        return new RelationBasedAccessPolicy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
