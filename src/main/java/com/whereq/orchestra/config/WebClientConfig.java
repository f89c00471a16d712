package com.whereq.orchestra.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the automation service
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient automationWebClient(WebClient.Builder builder, OrchestraProperties properties) {
        return builder
            .baseUrl(properties.getAutomationService().getBaseUrl())
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)) // execution output can be large
            .build();
    }
}
