package uk.gegc.tokenledger.features.tenant.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Read-only view of a user's membership in an agency. Rows are owned by the agency
 * administration system.
 */
@Entity
@Table(name = "tenant_memberships",
        uniqueConstraints = @UniqueConstraint(name = "uk_tenant_memberships_tenant_user", columnNames = {"tenant_id", "user_id"}))
@Getter
@Setter
public class TenantMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private TenantRole role;
}
