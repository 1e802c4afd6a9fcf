package com.inboxai.credit_core.exception;

import com.inboxai.credit_core.action.ActionController;
import com.inboxai.credit_core.action.ActionExecution;
import com.inboxai.credit_core.action.ActionService;
import com.inboxai.credit_core.config.JacksonConfig;
import com.inboxai.credit_core.credit.ActionExecutionException;
import com.inboxai.credit_core.credit.ActionType;
import com.inboxai.credit_core.credit.CreditAuthority;
import com.inboxai.credit_core.credit.CreditController;
import com.inboxai.credit_core.credit.InsufficientCreditsException;
import com.inboxai.credit_core.integration.IntegrationException;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.LedgerWriteConflictException;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Error body contract: {@code {error, message, details, timestamp}} with the credit numbers
 * in details.
 */
@WebMvcTest(controllers = {CreditController.class, ActionController.class})
@Import({GlobalExceptionHandler.class, JacksonConfig.class})
class GlobalExceptionHandlerTest {

    private static final UUID USER = UUID.randomUUID();
    private static final UUID ORG = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreditAuthority creditAuthority;

    @MockBean
    private ActionService actionService;

    @Nested
    @DisplayName("Credit endpoints")
    class Credits {

        @Test
        @DisplayName("Balance is returned with snake_case fields")
        void balance() throws Exception {
            CreditBalance balance = new CreditBalance(UUID.randomUUID(), USER, ORG, 400, 6, 394,
                SubscriptionTier.FREE, Instant.parse("2026-07-01T00:00:00Z"));
            when(creditAuthority.getBalance(USER, ORG)).thenReturn(Optional.of(balance));

            mockMvc.perform(get("/api/credits")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available_credits").value(394))
                .andExpect(jsonPath("$.subscription_tier").value("free"))
                .andExpect(jsonPath("$.monthly_credits").value(400))
                .andExpect(jsonPath("$.credits_reset_at").value("2026-07-01T00:00:00Z"));
        }

        @Test
        @DisplayName("A tenant without a balance gets 404")
        void noBalance() throws Exception {
            when(creditAuthority.getBalance(USER, ORG)).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/credits")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString()))
                .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("A missing tenant header is a 400")
        void missingHeader() throws Exception {
            mockMvc.perform(get("/api/credits")
                    .header(CreditController.USER_ID_HEADER, USER.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"))
                .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("A malformed tenant id is a 400")
        void malformedHeader() throws Exception {
            mockMvc.perform(get("/api/credits")
                    .header(CreditController.USER_ID_HEADER, "not-a-uuid")
                    .header(CreditController.ORG_ID_HEADER, ORG.toString()))
                .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("A non-positive grant fails validation with field details")
        void invalidGrant() throws Exception {
            mockMvc.perform(post("/api/credits/grants")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 0, \"description\": \"refund\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.amount").value("Amount must be positive"));
        }

        @Test
        @DisplayName("Ledger contention that outlasts the retries is a 503")
        void ledgerBusy() throws Exception {
            when(creditAuthority.grant(eq(USER), eq(ORG), anyInt(), anyString()))
                .thenThrow(new LedgerWriteConflictException("could not serialize access", null));

            mockMvc.perform(post("/api/credits/grants")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"amount\": 50, \"description\": \"refund for failed draft\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Ledger Busy"));
        }

        @Test
        @DisplayName("An unknown tier is a 400")
        void unknownTier() throws Exception {
            mockMvc.perform(post("/api/credits/onboarding")
                    .param("tier", "platinum")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown subscription tier: platinum"));
        }
    }

    @Nested
    @DisplayName("Action endpoint")
    class Actions {

        @Test
        @DisplayName("Insufficient credits is a 402 with required and available credits")
        void insufficientCredits() throws Exception {
            when(actionService.execute(eq("key-1"), eq(USER), eq(ORG), eq(ActionType.SENDER_RESEARCH_DEEP), any()))
                .thenThrow(new InsufficientCreditsException(USER, ORG, "sender_research_deep", 5, 4));

            mockMvc.perform(action("key-1", "sender_research_deep"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("Insufficient Credits"))
                .andExpect(jsonPath("$.details.action_type").value("sender_research_deep"))
                .andExpect(jsonPath("$.details.required_credits").value(5))
                .andExpect(jsonPath("$.details.available_credits").value(4));
        }

        @Test
        @DisplayName("A failure after charging is a 502 reporting the credits used")
        void failedAfterCharging() throws Exception {
            when(actionService.execute(eq("key-2"), eq(USER), eq(ORG), eq(ActionType.EMAIL_DRAFT_LONG), any()))
                .thenThrow(new ActionExecutionException(ActionType.EMAIL_DRAFT_LONG, 7, 93,
                    new IntegrationException("model overloaded")));

            mockMvc.perform(action("key-2", "email_draft_long"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Action Failed"))
                .andExpect(jsonPath("$.details.credits_used").value(7))
                .andExpect(jsonPath("$.details.available_credits").value(93));
        }

        @Test
        @DisplayName("A successful action returns its raw result")
        void succeeded() throws Exception {
            Instant now = Instant.parse("2026-06-10T12:00:00Z");
            ActionExecution done = ActionExecution.start("key-3", USER, ORG, ActionType.EMAIL_DRAFT_SHORT, now)
                .succeed("{\"draft\":\"Hi\"}", 3, 397, now);
            when(actionService.execute(eq("key-3"), eq(USER), eq(ORG), eq(ActionType.EMAIL_DRAFT_SHORT), any()))
                .thenReturn(done);

            mockMvc.perform(action("key-3", "email_draft_short"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.result.draft").value("Hi"))
                .andExpect(jsonPath("$.credits_used").value(3));
        }

        @Test
        @DisplayName("An unknown action type is a 400")
        void unknownActionType() throws Exception {
            mockMvc.perform(action("key-4", "teleport"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown action type: teleport"));
        }

        @Test
        @DisplayName("A request without an Idempotency-Key is a 400")
        void missingIdempotencyKey() throws Exception {
            mockMvc.perform(post("/api/actions")
                    .header(CreditController.USER_ID_HEADER, USER.toString())
                    .header(CreditController.ORG_ID_HEADER, ORG.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"action_type\": \"email_classification\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Required header 'Idempotency-Key' is missing"));
        }

        private org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder action(String key, String type) {
            return post("/api/actions")
                .header(CreditController.USER_ID_HEADER, USER.toString())
                .header(CreditController.ORG_ID_HEADER, ORG.toString())
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action_type\": \"" + type + "\", \"input\": {\"thread_id\": \"t-1\"}}");
        }
    }
}
