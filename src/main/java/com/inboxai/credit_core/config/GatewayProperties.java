package com.inboxai.credit_core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Endpoints of the mailbox gateway and the AI worker.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Getter @Setter
public class GatewayProperties {
    private Endpoint mailbox = new Endpoint("http://localhost:8081");
    private Endpoint ai = new Endpoint("http://localhost:8082");

    @Getter @Setter
    public static class Endpoint {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
