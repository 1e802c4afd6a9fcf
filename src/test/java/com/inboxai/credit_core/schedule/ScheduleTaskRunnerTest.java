package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.credit.ActionGate;
import com.inboxai.credit_core.credit.ActionType;
import com.inboxai.credit_core.credit.GatedActionResult;
import com.inboxai.credit_core.credit.InsufficientCreditsException;
import com.inboxai.credit_core.integration.MailboxClient;
import com.inboxai.credit_core.integration.MessageSender;
import com.inboxai.credit_core.integration.MessageSummary;
import com.inboxai.credit_core.integration.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalTime;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleTaskRunnerTest {

    private static final Instant NOW = Instant.parse("2026-06-10T09:00:00Z");

    @Mock
    private MailboxClient mailboxClient;

    @Mock
    private MessageSender messageSender;

    @Mock
    private ActionGate actionGate;

    private ScheduleTaskRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ScheduleTaskRunner(mailboxClient, messageSender, actionGate);
    }

    @Test
    @DisplayName("A digest summary is sent to the recipient without charging credits")
    void digestSent() {
        ScheduleEntry entry = digest();
        when(mailboxClient.fetchAndSummarize(entry.getOwnerId(), "important", null))
            .thenReturn(new MessageSummary(4, "", "4 important messages"));

        runner.run(entry);

        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(messageSender).send(captor.capture());
        assertEquals("owner@example.com", captor.getValue().getRecipient());
        assertEquals(ScheduleTaskRunner.DEFAULT_DIGEST_SUBJECT, captor.getValue().getSubject());
        verify(actionGate, never()).execute(any(), any(), any(), anyString(), anyMap(), any());
    }

    @Test
    @DisplayName("An empty digest sends nothing")
    void emptyDigest() {
        ScheduleEntry entry = digest();
        when(mailboxClient.fetchAndSummarize(entry.getOwnerId(), "important", null))
            .thenReturn(new MessageSummary(0, null, null));

        runner.run(entry);

        verify(messageSender, never()).send(any());
    }

    @Test
    @DisplayName("A follow-up is charged through the gate and sent inside it")
    @SuppressWarnings("unchecked")
    void followUpCharged() {
        ScheduleEntry entry = followUp();
        when(actionGate.execute(eq(entry.getUserId()), eq(entry.getOrgId()), eq(ActionType.FOLLOW_UP_SEND),
                anyString(), anyMap(), any()))
            .thenAnswer(invocation -> {
                Supplier<Object> action = invocation.getArgument(5);
                return new GatedActionResult<>(action.get(), ActionType.FOLLOW_UP_SEND, 1, 99);
            });

        runner.run(entry);

        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(messageSender).send(captor.capture());
        assertEquals("Closing the loop", captor.getValue().getSubject());
        assertEquals("Closing this out", captor.getValue().getBody());
    }

    @Test
    @DisplayName("A follow-up the tenant cannot afford is not sent")
    void followUpUnaffordable() {
        ScheduleEntry entry = followUp();
        when(actionGate.execute(any(), any(), eq(ActionType.FOLLOW_UP_SEND), anyString(), anyMap(), any()))
            .thenThrow(new InsufficientCreditsException(entry.getUserId(), entry.getOrgId(), "follow_up_send", 1, 0));

        assertThrows(InsufficientCreditsException.class, () -> runner.run(entry));
        verify(messageSender, never()).send(any());
    }

    private static ScheduleEntry digest() {
        return ScheduleEntry.digest(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            LocalTime.of(9, 0), "UTC", "owner@example.com", "important", 3, NOW);
    }

    private static ScheduleEntry followUp() {
        return ScheduleEntry.followUp(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            NOW, "bob@example.com", FollowUpType.CLOSING, "Closing this out", 3, NOW);
    }
}
