package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.config.CreditProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionCostTableTest {

    @Test
    @DisplayName("Built-in costs apply when nothing is overridden")
    void defaultCosts() {
        ActionCostTable table = new ActionCostTable(new CreditProperties());

        assertEquals(1, table.costOf(ActionType.EMAIL_CLASSIFICATION));
        assertEquals(3, table.costOf(ActionType.EMAIL_DRAFT_SHORT));
        assertEquals(7, table.costOf(ActionType.EMAIL_DRAFT_LONG));
        assertEquals(2, table.costOf(ActionType.SENDER_RESEARCH_BASIC));
        assertEquals(5, table.costOf(ActionType.SENDER_RESEARCH_DEEP));
        assertEquals(2, table.costOf(ActionType.WORKFLOW_EXECUTION));
        assertEquals(1, table.costOf(ActionType.FOLLOW_UP_SEND));
    }

    @Test
    @DisplayName("Configured overrides replace only the named actions")
    void overrides() {
        CreditProperties properties = new CreditProperties();
        properties.setCosts(Map.of("email_draft_long", 8, "workflow-execution", 4));

        ActionCostTable table = new ActionCostTable(properties);

        assertEquals(8, table.costOf(ActionType.EMAIL_DRAFT_LONG));
        assertEquals(4, table.costOf(ActionType.WORKFLOW_EXECUTION));
        assertEquals(3, table.costOf(ActionType.EMAIL_DRAFT_SHORT));
    }

    @Test
    @DisplayName("Non-positive overrides fail at startup")
    void rejectsNonPositiveOverride() {
        CreditProperties properties = new CreditProperties();
        properties.setCosts(Map.of("email_classification", 0));

        assertThrows(IllegalArgumentException.class, () -> new ActionCostTable(properties));
    }

    @Test
    @DisplayName("Unknown action codes in overrides fail at startup")
    void rejectsUnknownAction() {
        CreditProperties properties = new CreditProperties();
        properties.setCosts(Map.of("teleport", 3));

        assertThrows(IllegalArgumentException.class, () -> new ActionCostTable(properties));
    }
}
