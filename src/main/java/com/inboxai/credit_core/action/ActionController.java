package com.inboxai.credit_core.action;

import com.inboxai.credit_core.action.dto.ActionExecutionResponse;
import com.inboxai.credit_core.action.dto.ExecuteActionRequest;
import com.inboxai.credit_core.credit.ActionType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static com.inboxai.credit_core.credit.CreditController.ORG_ID_HEADER;
import static com.inboxai.credit_core.credit.CreditController.USER_ID_HEADER;

/**
 * Interactive gated actions.
 *
 * Requires an Idempotency-Key header. Repeating a request with the same key returns the
 * first outcome (success or error) without charging again.
 */
@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
@Slf4j
public class ActionController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ActionService actionService;

    @PostMapping
    public ActionExecutionResponse execute(@RequestHeader(USER_ID_HEADER) UUID userId,
                                           @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                           @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                           @Valid @RequestBody ExecuteActionRequest request) {
        ActionType actionType = ActionType.fromCode(request.getActionType());
        log.info("Action requested: type={}, idempotencyKey={}", actionType.code(), idempotencyKey);

        ActionExecution execution = actionService.execute(idempotencyKey, userId, orgId, actionType, request.getInput());
        return ActionExecutionResponse.from(execution);
    }
}
