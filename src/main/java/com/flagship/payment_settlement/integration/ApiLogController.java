package com.flagship.payment_settlement.integration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operational lookup of provider audit rows by correlation id (our request id or the
 * provider's checkout id) or by external id.
 */
@RestController
@RequestMapping("/api/integrations/logs")
@RequiredArgsConstructor
public class ApiLogController {

    private final ApiLogService apiLogService;

    @GetMapping
    public ResponseEntity<List<ApiLogResponse>> search(
            @RequestHeader("X-Organization-ID") UUID organizationId,
            @RequestParam(value = "correlationId", required = false) String correlationId,
            @RequestParam(value = "externalId", required = false) String externalId) {

        if ((correlationId == null || correlationId.isBlank()) && (externalId == null || externalId.isBlank())) {
            throw new IllegalArgumentException("Either correlationId or externalId is required");
        }
        List<ApiLog> rows = correlationId != null && !correlationId.isBlank()
                ? apiLogService.findByCorrelationId(correlationId)
                : apiLogService.findByExternalId(externalId);

        // orphan webhooks have no organization and are visible to nobody here
        return ResponseEntity.ok(rows.stream()
                .filter(row -> organizationId.equals(row.getOrganizationId()))
                .map(ApiLogResponse::from)
                .toList());
    }

    @Value
    @Builder
    public static class ApiLogResponse {
        @JsonProperty("id") UUID id;
        @JsonProperty("request_type") ApiRequestType requestType;
        @JsonProperty("endpoint") String endpoint;
        @JsonProperty("method") String method;
        @JsonProperty("status") ApiLogStatus status;
        @JsonProperty("response_status_code") Integer responseStatusCode;
        @JsonProperty("error_message") String errorMessage;
        @JsonProperty("correlation_id") String correlationId;
        @JsonProperty("external_id") String externalId;
        @JsonProperty("payment_id") UUID paymentId;
        @JsonProperty("duration_ms") Long durationMs;
        @JsonProperty("request_timestamp") Instant requestTimestamp;

        static ApiLogResponse from(ApiLog row) {
            return ApiLogResponse.builder()
                    .id(row.getId())
                    .requestType(row.getRequestType())
                    .endpoint(row.getEndpoint())
                    .method(row.getMethod())
                    .status(row.getStatus())
                    .responseStatusCode(row.getResponseStatusCode())
                    .errorMessage(row.getErrorMessage())
                    .correlationId(row.getCorrelationId())
                    .externalId(row.getExternalId())
                    .paymentId(row.getPaymentId())
                    .durationMs(row.getDurationMs())
                    .requestTimestamp(row.getRequestTimestamp())
                    .build();
        }
    }
}
