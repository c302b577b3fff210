package com.websubrelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Value("${app.http.connect-timeout:PT10S}")
    private Duration connectTimeout;

    @Value("${app.http.read-timeout:PT10S}")
    private Duration readTimeout;

    /**
     * Shared client for the hub, the content API and the messaging API.
     * Every outbound call is bounded by these timeouts.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
