package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.credit.CreditAuthority;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The open follow-up limit holds when one tenant creates follow-ups from several requests at once.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class FollowUpLimitIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("credit_core_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("scheduler.enabled", () -> "false");
    }

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private SchedulePersistenceService persistence;

    @Autowired
    private CreditAuthority creditAuthority;

    @Test
    @DisplayName("Concurrent follow-ups for one tenant never exceed the tier limit")
    void concurrentFollowUpsRespectLimit() throws Exception {
        UUID userId = UUID.randomUUID();
        UUID orgId = UUID.randomUUID();
        creditAuthority.onboard(userId, orgId, SubscriptionTier.FREE);
        int limit = SubscriptionTier.FREE.maxPendingFollowUps();
        for (int i = 0; i < limit - 2; i++) {
            createFollowUp(userId, orgId);
        }

        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                createFollowUp(userId, orgId);
                return true;
            }));
        }
        start.countDown();

        int accepted = 0;
        int rejected = 0;
        for (Future<Boolean> result : results) {
            try {
                result.get(30, TimeUnit.SECONDS);
                accepted++;
            } catch (ExecutionException e) {
                assertInstanceOf(TierLimitExceededException.class, e.getCause());
                rejected++;
            }
        }
        executor.shutdown();

        assertEquals(2, accepted);
        assertEquals(threads - 2, rejected);
        assertEquals(limit, persistence.countOpenFollowUps(userId, orgId));
    }

    private void createFollowUp(UUID userId, UUID orgId) {
        scheduleService.createFollowUp(userId, orgId, UUID.randomUUID(), Instant.now().plus(Duration.ofDays(1)),
            "bob@example.com", FollowUpType.REMINDER, "Any news?", null);
    }
}
