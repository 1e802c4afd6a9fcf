package com.inboxai.credit_core.credit;

import com.inboxai.credit_core.credit.dto.AssignTierRequest;
import com.inboxai.credit_core.credit.dto.CreditBalanceResponse;
import com.inboxai.credit_core.credit.dto.CreditTransactionResponse;
import com.inboxai.credit_core.credit.dto.GrantCreditsRequest;
import com.inboxai.credit_core.credit.dto.ReconciliationResponse;
import com.inboxai.credit_core.ledger.SubscriptionTier;
import com.inboxai.credit_core.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Credit balance and administration endpoints.
 *
 * The tenant comes from the X-User-Id and X-Org-Id headers set by the upstream gateway after
 * authentication.
 */
@RestController
@RequestMapping("/api/credits")
@RequiredArgsConstructor
@Slf4j
public class CreditController {

    public static final String USER_ID_HEADER = CorrelationContext.USER_ID_HEADER;
    public static final String ORG_ID_HEADER = CorrelationContext.ORG_ID_HEADER;

    private final CreditAuthority creditAuthority;

    @GetMapping
    public ResponseEntity<CreditBalanceResponse> getBalance(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                            @RequestHeader(ORG_ID_HEADER) UUID orgId) {
        return creditAuthority.getBalance(userId, orgId)
            .map(balance -> ResponseEntity.ok(CreditBalanceResponse.from(balance)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/transactions")
    public List<CreditTransactionResponse> getTransactions(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                           @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                                           @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return creditAuthority.getTransactions(userId, orgId, limit).stream()
            .map(CreditTransactionResponse::from)
            .toList();
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                            @RequestHeader(ORG_ID_HEADER) UUID orgId) {
        return creditAuthority.reconcile(userId, orgId)
            .map(reconciliation -> ResponseEntity.ok(ReconciliationResponse.from(reconciliation)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/grants")
    public ResponseEntity<CreditBalanceResponse> grant(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                       @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                                       @Valid @RequestBody GrantCreditsRequest request) {
        log.info("Administrative grant requested: amount={}", request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(CreditBalanceResponse.from(creditAuthority.grant(userId, orgId, request.getAmount(), request.getDescription())));
    }

    @PutMapping("/tier")
    public CreditBalanceResponse assignTier(@RequestHeader(USER_ID_HEADER) UUID userId,
                                            @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                            @Valid @RequestBody AssignTierRequest request) {
        return CreditBalanceResponse.from(
            creditAuthority.assignTier(userId, orgId, SubscriptionTier.fromCode(request.getTier())));
    }

    /**
     * Opens a balance for a new membership. Calling it again returns the existing balance.
     */
    @PostMapping("/onboarding")
    public CreditBalanceResponse onboard(@RequestHeader(USER_ID_HEADER) UUID userId,
                                         @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                         @RequestParam(name = "tier", required = false) String tier) {
        return CreditBalanceResponse.from(creditAuthority.onboard(userId, orgId, SubscriptionTier.fromCode(tier)));
    }
}
