package com.inboxai.credit_core.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@Slf4j
public class HttpMailboxClient implements MailboxClient {

    private static final ParameterizedTypeReference<List<MailboxMessage>> MESSAGE_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HttpMailboxClient(@Qualifier("mailboxRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<MailboxMessage> fetchNewMessages(UUID mailboxId, Instant since, int limit) {
        try {
            List<MailboxMessage> messages = restClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/mailboxes/{id}/messages")
                    .queryParamIfPresent("since", Optional.ofNullable(since))
                    .queryParam("limit", limit)
                    .build(mailboxId))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(MESSAGE_LIST);
            return messages != null ? messages : List.of();
        } catch (RestClientException e) {
            throw new IntegrationException("Mailbox fetch failed for " + mailboxId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public MessageSummary fetchAndSummarize(UUID ownerId, String criteriaType, Instant since) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("criteria_type", criteriaType);
        request.put("since", since);

        try {
            MessageSummary summary = restClient.post()
                .uri("/mailboxes/{id}/summaries", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(MessageSummary.class);
            if (summary == null) {
                throw new IntegrationException("Empty summary response for " + ownerId);
            }
            return summary;
        } catch (RestClientException e) {
            throw new IntegrationException("Summary failed for " + ownerId + ": " + e.getMessage(), e);
        }
    }
}
