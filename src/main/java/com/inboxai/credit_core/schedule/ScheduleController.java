package com.inboxai.credit_core.schedule;

import com.inboxai.credit_core.schedule.dto.CancelScheduleRequest;
import com.inboxai.credit_core.schedule.dto.CreateDigestScheduleRequest;
import com.inboxai.credit_core.schedule.dto.CreateFollowUpRequest;
import com.inboxai.credit_core.schedule.dto.ScheduleEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.inboxai.credit_core.credit.CreditController.ORG_ID_HEADER;
import static com.inboxai.credit_core.credit.CreditController.USER_ID_HEADER;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping("/digests")
    public ResponseEntity<ScheduleEntryResponse> createDigest(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                              @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                                              @Valid @RequestBody CreateDigestScheduleRequest request) {
        ScheduleEntry entry = scheduleService.createDigest(userId, orgId, request.getOwnerId(),
            request.getScheduleTime(), request.getTimezone(), request.getRecipient(),
            request.getCriteriaType(), request.getMaxRetries());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleEntryResponse.from(entry));
    }

    @PostMapping("/follow-ups")
    public ResponseEntity<ScheduleEntryResponse> createFollowUp(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                                @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                                                @Valid @RequestBody CreateFollowUpRequest request) {
        ScheduleEntry entry = scheduleService.createFollowUp(userId, orgId, request.getOwnerId(),
            request.getScheduledAt(), request.getRecipient(), FollowUpType.fromCode(request.getFollowUpType()),
            request.getTemplateMessage(), request.getMaxRetries());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleEntryResponse.from(entry));
    }

    @GetMapping
    public List<ScheduleEntryResponse> list(@RequestHeader(USER_ID_HEADER) UUID userId,
                                            @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return scheduleService.list(userId, orgId, limit).stream()
            .map(ScheduleEntryResponse::from)
            .toList();
    }

    @GetMapping("/{scheduleId}")
    public ScheduleEntryResponse get(@RequestHeader(USER_ID_HEADER) UUID userId,
                                     @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                     @PathVariable("scheduleId") UUID scheduleId) {
        return ScheduleEntryResponse.from(scheduleService.get(userId, orgId, scheduleId));
    }

    @PostMapping("/{scheduleId}/deactivate")
    public ScheduleEntryResponse deactivate(@RequestHeader(USER_ID_HEADER) UUID userId,
                                            @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                            @PathVariable("scheduleId") UUID scheduleId) {
        return ScheduleEntryResponse.from(scheduleService.deactivate(userId, orgId, scheduleId));
    }

    @PostMapping("/{scheduleId}/activate")
    public ScheduleEntryResponse activate(@RequestHeader(USER_ID_HEADER) UUID userId,
                                          @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                          @PathVariable("scheduleId") UUID scheduleId) {
        return ScheduleEntryResponse.from(scheduleService.activate(userId, orgId, scheduleId));
    }

    @PostMapping("/{scheduleId}/cancel")
    public ScheduleEntryResponse cancel(@RequestHeader(USER_ID_HEADER) UUID userId,
                                        @RequestHeader(ORG_ID_HEADER) UUID orgId,
                                        @PathVariable("scheduleId") UUID scheduleId,
                                        @Valid @RequestBody(required = false) CancelScheduleRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ScheduleEntryResponse.from(scheduleService.cancel(userId, orgId, scheduleId, reason));
    }
}
