package uk.gegc.tokenledger.features.tenant.domain.model;

public enum TenantRole {
    AGENCY_ADMIN,
    ACCOUNT_MANAGER,
    MEMBER
}
