package com.gridintel.generation.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * Timeouts are fixed per request; nothing upstream is retried.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, GenerationPipelineProperties properties) {
        return builder
                .setConnectTimeout(properties.getFeed().getTimeout())
                .setReadTimeout(properties.getFeed().getTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
