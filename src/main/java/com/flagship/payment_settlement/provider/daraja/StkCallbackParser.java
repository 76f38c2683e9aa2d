package com.flagship.payment_settlement.provider.daraja;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Reads the {@code Body.stkCallback} envelope Daraja posts to the callback URL.
 *
 * <pre>
 * {"Body": {"stkCallback": {
 *     "MerchantRequestID": "...", "CheckoutRequestID": "...",
 *     "ResultCode": 0, "ResultDesc": "...",
 *     "CallbackMetadata": {"Item": [{"Name": "MpesaReceiptNumber", "Value": "..."}, ...]}}}}
 * </pre>
 *
 * CallbackMetadata is only present on success.
 */
@Component
public class StkCallbackParser {

    private final ObjectMapper objectMapper;

    public StkCallbackParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if the body is not JSON or misses the checkout id
     *                                  or result code
     */
    public StkCallback parse(String rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Callback body is not valid JSON", e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Callback body is empty");
        }

        JsonNode callback = root.path("Body").path("stkCallback");
        if (!callback.isObject()) {
            throw new IllegalArgumentException("Callback has no Body.stkCallback");
        }
        String checkoutRequestId = callback.path("CheckoutRequestID").asText(null);
        if (checkoutRequestId == null || checkoutRequestId.isBlank()) {
            throw new IllegalArgumentException("Callback has no CheckoutRequestID");
        }
        JsonNode resultCode = callback.path("ResultCode");
        if (!resultCode.canConvertToInt() && !resultCode.isTextual()) {
            throw new IllegalArgumentException("Callback has no ResultCode");
        }

        StkCallback.StkCallbackBuilder builder = StkCallback.builder()
                .checkoutRequestId(checkoutRequestId)
                .merchantRequestId(callback.path("MerchantRequestID").asText(null))
                .resultCode(parseResultCode(resultCode))
                .resultDescription(callback.path("ResultDesc").asText(null));

        for (JsonNode item : callback.path("CallbackMetadata").path("Item")) {
            JsonNode value = item.path("Value");
            if (value.isMissingNode() || value.isNull()) {
                continue;
            }
            switch (item.path("Name").asText("")) {
                case "MpesaReceiptNumber" -> builder.receiptNumber(value.asText());
                case "Amount" -> builder.amount(new BigDecimal(value.asText()));
                case "PhoneNumber" -> builder.phoneNumber(value.asText());
                default -> {
                    // TransactionDate, Balance: not used
                }
            }
        }
        return builder.build();
    }

    private static int parseResultCode(JsonNode node) {
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ResultCode is not a number: " + node.asText(), e);
        }
    }
}
