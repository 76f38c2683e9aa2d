package com.flagship.payment_settlement.notification;

import com.flagship.payment_settlement.notification.dto.PreferenceResponse;
import com.flagship.payment_settlement.notification.dto.UpdatePreferenceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Channel flags left out of the request default to enabled.
 */
@RestController
@RequestMapping("/api/notification-preferences")
@RequiredArgsConstructor
public class NotificationPreferenceController {

    private final NotificationService notificationService;

    @PutMapping
    public ResponseEntity<PreferenceResponse> update(
            @RequestHeader("X-Organization-ID") UUID organizationId,
            @Valid @RequestBody UpdatePreferenceRequest request) {

        NotificationPreference preference = notificationService.updatePreference(
                organizationId,
                request.getRecipientType(),
                request.getRecipientId(),
                !Boolean.FALSE.equals(request.getReceiveSms()),
                !Boolean.FALSE.equals(request.getReceiveEmail()),
                !Boolean.FALSE.equals(request.getReceiveWhatsapp()),
                !Boolean.FALSE.equals(request.getReceivePush()),
                request.getQuietHoursStart(),
                request.getQuietHoursEnd());
        return ResponseEntity.ok(PreferenceResponse.from(preference));
    }
}
