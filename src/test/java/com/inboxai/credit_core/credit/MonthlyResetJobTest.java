package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.config.CreditProperties;
import com.inboxai.credit_core.ledger.CreditBalance;
import com.inboxai.credit_core.ledger.LedgerStore;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import com.inboxai.credit_core.observability.CreditMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonthlyResetJobTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private CreditAuthority creditAuthority;

    @Mock
    private CreditMetrics creditMetrics;

    private MonthlyResetJob job;

    @BeforeEach
    void setUp() {
        job = new MonthlyResetJob(ledgerStore, creditAuthority, creditMetrics, new CreditProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Due balances are reset with their own tier")
    void resetsDueBalances() {
        CreditBalance free = balance(SubscriptionTier.FREE);
        CreditBalance pro = balance(SubscriptionTier.PRO);
        when(ledgerStore.findBalancesDueForReset(eq(NOW), any(), any(), anyInt()))
            .thenReturn(List.of(free, pro))
            .thenReturn(List.of());
        when(creditAuthority.resetIfUnchanged(any(), any())).thenReturn(Optional.of(free));

        ResetSummary summary = job.runTick(NOW);

        assertEquals(2, summary.getExamined());
        assertEquals(2, summary.getReset());
        verify(creditAuthority).resetIfUnchanged(free, SubscriptionTier.FREE);
        verify(creditAuthority).resetIfUnchanged(pro, SubscriptionTier.PRO);
    }

    @Test
    @DisplayName("One failing tenant does not stop the others and is retried next tick")
    void failureIsolated() {
        CreditBalance failing = balance(SubscriptionTier.FREE);
        CreditBalance healthy = balance(SubscriptionTier.BUSINESS);
        when(ledgerStore.findBalancesDueForReset(eq(NOW), any(), any(), anyInt()))
            .thenReturn(List.of(failing, healthy))
            .thenReturn(List.of(failing));
        when(creditAuthority.resetIfUnchanged(failing, SubscriptionTier.FREE))
            .thenThrow(new IllegalStateException("connection reset"));
        when(creditAuthority.resetIfUnchanged(healthy, SubscriptionTier.BUSINESS))
            .thenReturn(Optional.of(healthy));

        ResetSummary summary = job.runTick(NOW);

        assertEquals(1, summary.getReset());
        assertEquals(2, summary.getFailed());
        verify(creditMetrics, times(2)).recordResetFailure();
        verify(ledgerStore, times(2)).findBalancesDueForReset(eq(NOW), any(), any(), anyInt());
    }

    @Test
    @DisplayName("A balance months behind catches up within one tick")
    void catchesUpSeveralMonths() {
        CreditBalance behind = balance(SubscriptionTier.FREE);
        when(ledgerStore.findBalancesDueForReset(eq(NOW), any(), any(), anyInt()))
            .thenReturn(List.of(behind))
            .thenReturn(List.of(behind))
            .thenReturn(List.of(behind))
            .thenReturn(List.of());
        when(creditAuthority.resetIfUnchanged(behind, SubscriptionTier.FREE)).thenReturn(Optional.of(behind));

        ResetSummary summary = job.runTick(NOW);

        assertEquals(3, summary.getReset());
    }

    @Test
    @DisplayName("A full batch of failing balances does not block balances behind it")
    void failingBatchDoesNotBlockLaterBalances() {
        CreditProperties properties = new CreditProperties();
        properties.getReset().setBatchSize(2);
        job = new MonthlyResetJob(ledgerStore, creditAuthority, creditMetrics, properties,
            Clock.fixed(NOW, ZoneOffset.UTC));

        CreditBalance failingA = balance(SubscriptionTier.FREE);
        CreditBalance failingB = balance(SubscriptionTier.FREE);
        CreditBalance later = balance(SubscriptionTier.PRO);
        when(ledgerStore.findBalancesDueForReset(eq(NOW), isNull(), isNull(), eq(2)))
            .thenReturn(List.of(failingA, failingB));
        when(ledgerStore.findBalancesDueForReset(eq(NOW), eq(failingB.getCreditsResetAt()), eq(failingB.getId()), eq(2)))
            .thenReturn(List.of(later))
            .thenReturn(List.of());
        when(creditAuthority.resetIfUnchanged(failingA, SubscriptionTier.FREE))
            .thenThrow(new IllegalStateException("row locked"));
        when(creditAuthority.resetIfUnchanged(failingB, SubscriptionTier.FREE))
            .thenThrow(new IllegalStateException("row locked"));
        when(creditAuthority.resetIfUnchanged(later, SubscriptionTier.PRO)).thenReturn(Optional.of(later));

        ResetSummary summary = job.runTick(NOW);

        assertEquals(1, summary.getReset());
        assertEquals(4, summary.getFailed());
        verify(creditAuthority).resetIfUnchanged(later, SubscriptionTier.PRO);
        verify(ledgerStore, times(2)).findBalancesDueForReset(eq(NOW), isNull(), isNull(), eq(2));
    }

    @Test
    @DisplayName("Nothing due means nothing reset")
    void nothingDue() {
        when(ledgerStore.findBalancesDueForReset(eq(NOW), any(), any(), anyInt())).thenReturn(List.of());

        ResetSummary summary = job.runTick(NOW);

        assertEquals(0, summary.getExamined());
        verify(creditAuthority, times(0)).resetIfUnchanged(any(), any());
    }

    private static CreditBalance balance(SubscriptionTier tier) {
        return new CreditBalance(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            tier.monthlyCredits(), 10, tier.monthlyCredits() - 10, tier, Instant.parse("2026-02-01T00:00:00Z"));
    }
}
