package com.inboxai.credit_core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient mailboxRestClient(GatewayProperties properties) {
        return build(properties.getMailbox());
    }

    @Bean
    public RestClient aiRestClient(GatewayProperties properties) {
        return build(properties.getAi());
    }

    private RestClient build(GatewayProperties.Endpoint endpoint) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(endpoint.getConnectTimeout());
        requestFactory.setReadTimeout(endpoint.getReadTimeout());

        return RestClient.builder()
            .baseUrl(endpoint.getBaseUrl())
            .requestFactory(requestFactory)
            .build();
    }
}
