package com.inboxai.credit_core.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inboxai.credit_core.credit.ActionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.UUID;

@Component
@Slf4j
public class HttpActionExecutor implements ActionExecutor {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpActionExecutor(@Qualifier("aiRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode execute(ActionType actionType, UUID userId, UUID orgId, JsonNode input) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("user_id", userId.toString());
        request.put("org_id", orgId.toString());
        request.set("input", input != null ? input : objectMapper.createObjectNode());

        long start = System.currentTimeMillis();
        try {
            JsonNode result = restClient.post()
                .uri("/actions/{action}", actionType.code())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);

            log.debug("AI action {} completed in {}ms", actionType.code(), System.currentTimeMillis() - start);
            return result != null ? result : objectMapper.nullNode();
        } catch (RestClientException e) {
            throw new IntegrationException("AI action " + actionType.code() + " failed: " + e.getMessage(), e);
        }
    }
}
