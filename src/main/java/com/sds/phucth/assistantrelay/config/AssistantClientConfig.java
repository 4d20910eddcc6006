package com.sds.phucth.assistantrelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class AssistantClientConfig {

    @Bean
    public RestTemplate assistantRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.assistant.connect-timeout:5s}") Duration connectTimeout,
            @Value("${app.assistant.request-timeout:25s}") Duration requestTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(requestTimeout)
                .build();
    }
}
