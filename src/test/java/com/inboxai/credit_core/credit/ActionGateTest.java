package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.config.CreditProperties;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import com.inboxai.credit_core.observability.CreditMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionGateTest {

    private static final UUID USER = UUID.randomUUID();
    private static final UUID ORG = UUID.randomUUID();

    @Mock
    private CreditAuthority creditAuthority;

    @Mock
    private CreditMetrics creditMetrics;

    private ActionGate gate;

    @BeforeEach
    void setUp() {
        gate = new ActionGate(new ActionCostTable(new CreditProperties()), creditAuthority, creditMetrics);
    }

    @Test
    @DisplayName("Affordable action is charged its cost and run")
    void chargesAndRuns() {
        when(creditAuthority.tryDeduct(eq(USER), eq(ORG), eq(7), eq("email_draft_long"), any(), anyMap()))
            .thenReturn(CreditDeduction.approved(balance(93), 7));

        GatedActionResult<String> result = gate.execute(USER, ORG, ActionType.EMAIL_DRAFT_LONG, "draft", () -> "Dear Bob");

        assertEquals("Dear Bob", result.getValue());
        assertEquals(7, result.getCreditsUsed());
        assertEquals(93, result.getAvailableCredits());
        verify(creditMetrics).recordActionExecuted(eq("email_draft_long"), eq("succeeded"), any());
    }

    @Test
    @DisplayName("Unaffordable action is rejected and never run")
    void rejectsWithoutRunning() {
        when(creditAuthority.tryDeduct(eq(USER), eq(ORG), eq(5), eq("sender_research_deep"), any(), anyMap()))
            .thenReturn(CreditDeduction.insufficient(5, 4));
        AtomicBoolean ran = new AtomicBoolean(false);

        InsufficientCreditsException e = assertThrows(InsufficientCreditsException.class,
            () -> gate.execute(USER, ORG, ActionType.SENDER_RESEARCH_DEEP, "research", () -> {
                ran.set(true);
                return null;
            }));

        assertFalse(ran.get());
        assertEquals(5, e.getRequiredCredits());
        assertEquals(4, e.getAvailableCredits());
        verify(creditMetrics).recordActionExecuted(eq("sender_research_deep"), eq("rejected"), any());
    }

    @Test
    @DisplayName("A failing action stays charged and reports what was charged")
    void failureIsNotRefunded() {
        when(creditAuthority.tryDeduct(eq(USER), eq(ORG), eq(2), eq("workflow_execution"), any(), anyMap()))
            .thenReturn(CreditDeduction.approved(balance(10), 2));

        ActionExecutionException e = assertThrows(ActionExecutionException.class,
            () -> gate.execute(USER, ORG, ActionType.WORKFLOW_EXECUTION, "workflow", Map.of("workflow", "triage"), () -> {
                throw new IllegalStateException("worker crashed");
            }));

        assertEquals(2, e.getCreditsUsed());
        assertEquals(10, e.getAvailableCredits());
        assertEquals("worker crashed", e.getCause().getMessage());
        verify(creditMetrics).recordActionExecuted(eq("workflow_execution"), eq("failed"), any());
    }

    private static CreditBalance balance(int available) {
        return new CreditBalance(UUID.randomUUID(), USER, ORG, 400, 400 - available, available, SubscriptionTier.FREE, null);
    }
}
