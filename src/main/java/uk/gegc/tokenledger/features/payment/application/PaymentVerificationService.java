package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentRequest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentResponse;

import java.util.UUID;

public interface PaymentVerificationService {

    /**
     * Checks the payment proof, completes the pending intent and credits the tenant exactly once.
     */
    VerifyPaymentResponse verifyAndCredit(UUID principalId, VerifyPaymentRequest request);
}
