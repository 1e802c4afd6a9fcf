package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.config.CreditProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Cost of each action, fixed at startup. Overrides come from {@code credits.costs.<action>}.
 */
@Component
@Slf4j
public class ActionCostTable {

    private final Map<ActionType, Integer> costs;

    public ActionCostTable(CreditProperties properties) {
        EnumMap<ActionType, Integer> table = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            table.put(type, type.defaultCost());
        }

        properties.getCosts().forEach((code, cost) -> {
            ActionType type = ActionType.fromCode(code.replace('-', '_'));
            if (cost == null || cost <= 0) {
                throw new IllegalArgumentException("Cost for " + code + " must be positive, got " + cost);
            }
            table.put(type, cost);
            log.info("Action cost override: {}={} (default {})", type.code(), cost, type.defaultCost());
        });

        this.costs = Collections.unmodifiableMap(table);
    }

    public int costOf(ActionType actionType) {
        return costs.get(actionType);
    }

    public Map<ActionType, Integer> asMap() {
        return costs;
    }
}
