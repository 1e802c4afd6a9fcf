package com.inboxai.credit_core.mailbox;

import com.inboxai.credit_core.mailbox.dto.ConnectMailboxRequest;
import com.inboxai.credit_core.mailbox.dto.MailboxResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.inboxai.credit_core.credit.CreditController.ORG_ID_HEADER;
import static com.inboxai.credit_core.credit.CreditController.USER_ID_HEADER;

@RestController
@RequestMapping("/api/mailboxes")
@RequiredArgsConstructor
public class MailboxController {

    private final MailboxService mailboxService;

    @PostMapping
    public ResponseEntity<MailboxResponse> connect(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                   @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                                   @Valid @RequestBody ConnectMailboxRequest request) {
        Mailbox mailbox = mailboxService.connect(userId, orgId, request.getEmailAddress());
        return ResponseEntity.status(HttpStatus.CREATED).body(MailboxResponse.from(mailbox));
    }

    @GetMapping
    public List<MailboxResponse> list(@RequestHeader(USER_ID_HEADER) UUID userId,
                                      @RequestHeader(ORG_ID_HEADER) UUID orgId) {
        return mailboxService.listForTenant(userId, orgId).stream()
            .map(MailboxResponse::from)
            .toList();
    }
}
