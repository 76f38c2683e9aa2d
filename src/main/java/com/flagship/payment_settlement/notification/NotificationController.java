package com.flagship.payment_settlement.notification;

import com.flagship.payment_settlement.notification.dto.BulkNotificationRequest;
import com.flagship.payment_settlement.notification.dto.BulkNotificationResponse;
import com.flagship.payment_settlement.notification.dto.NotificationResponse;
import com.flagship.payment_settlement.notification.dto.SendNotificationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private static final String ORGANIZATION_HEADER = "X-Organization-ID";

    private final NotificationService notificationService;

    /**
     * Queues a notification. The response is 202: delivery happens asynchronously.
     */
    @PostMapping
    public ResponseEntity<NotificationResponse> send(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @Valid @RequestBody SendNotificationRequest request) {

        Notification notification = notificationService.enqueue(NotificationRequest.builder()
                .organizationId(organizationId)
                .recipientType(request.getRecipientType())
                .recipientId(request.getRecipientId())
                .recipientEmail(request.getRecipientEmail())
                .recipientPhone(request.getRecipientPhone())
                .notificationType(request.getNotificationType())
                .channel(request.getChannel())
                .subject(request.getSubject())
                .message(request.getMessage())
                .priority(request.getPriority())
                .scheduledFor(request.getScheduledFor())
                .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(NotificationResponse.from(notification));
    }

    @PostMapping("/bulk")
    public ResponseEntity<BulkNotificationResponse> sendBulk(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @Valid @RequestBody BulkNotificationRequest request) {

        NotificationService.BulkResult result = notificationService.enqueueBulk(
                NotificationService.BulkNotificationRequest.builder()
                        .organizationId(organizationId)
                        .recipientType(request.getRecipientType())
                        .recipientIds(request.getRecipientIds())
                        .notificationType(request.getNotificationType())
                        .channel(request.getChannel())
                        .subject(request.getSubject())
                        .message(request.getMessage())
                        .priority(request.getPriority())
                        .scheduledFor(request.getScheduledFor())
                        .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BulkNotificationResponse.from(result));
    }

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> list(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @RequestParam(value = "payment_id", required = false) UUID paymentId,
            @RequestParam(value = "invoice_id", required = false) UUID invoiceId) {
        return ResponseEntity.ok(notificationService.findRelated(organizationId, paymentId, invoiceId).stream()
                .map(NotificationResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<NotificationResponse> get(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.getForOrganization(id, organizationId)));
    }

    @PostMapping("/{id}/resend")
    public ResponseEntity<NotificationResponse> resend(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(NotificationResponse.from(notificationService.resend(id, organizationId)));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<NotificationResponse> markRead(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.markRead(id, organizationId)));
    }
}
