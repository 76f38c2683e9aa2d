package com.flagship.payment_settlement.exception;

import java.util.UUID;

/**
 * Cross-tenant access: the record exists but belongs to another organization.
 */
public class OrganizationMismatchException extends SettlementException {

    public OrganizationMismatchException(String resource, UUID resourceId, UUID organizationId) {
        super("ORGANIZATION_MISMATCH",
                resource + " " + resourceId + " does not belong to organization " + organizationId);
    }
}
