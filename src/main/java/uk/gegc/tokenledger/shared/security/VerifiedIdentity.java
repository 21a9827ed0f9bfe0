package uk.gegc.tokenledger.shared.security;

import java.util.UUID;

public record VerifiedIdentity(UUID principalId) {
}
