package com.flagship.payment_settlement.exception;

import java.util.UUID;

public class ResourceNotFoundException extends SettlementException {

    public ResourceNotFoundException(String resource, UUID id) {
        super(resource.toUpperCase().replace(' ', '_') + "_NOT_FOUND", resource + " not found: " + id);
    }
}
