package uk.gegc.tokenledger.features.payment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderRequest;
import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderResponse;
import uk.gegc.tokenledger.features.payment.api.dto.PurchaseIntentDto;
import uk.gegc.tokenledger.features.payment.api.dto.TenantBalanceDto;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentRequest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentResponse;
import uk.gegc.tokenledger.features.payment.application.OrderInitiationService;
import uk.gegc.tokenledger.features.payment.application.PaymentVerificationService;
import uk.gegc.tokenledger.features.payment.application.PurchaseQueryService;
import uk.gegc.tokenledger.shared.security.AuthenticatedPrincipals;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Token Purchases", description = "Token purchase orders, payment verification, balances and history")
@SecurityRequirement(name = "bearerAuth")
public class PaymentController {

    private final OrderInitiationService orderInitiationService;
    private final PaymentVerificationService paymentVerificationService;
    private final PurchaseQueryService purchaseQueryService;

    @Operation(
            summary = "Create a token purchase order",
            description = "Prices the purchase, opens a provider order and records a pending purchase. Requires the agency admin role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order created",
                    content = @Content(schema = @Schema(implementation = CreateOrderResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid tier, quantity or body",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Not an admin of the agency",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment provider failed, safe to retry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/orders")
    public ResponseEntity<CreateOrderResponse> createOrder(@RequestBody CreateOrderRequest request,
                                                           Authentication authentication) {
        UUID principalId = AuthenticatedPrincipals.requirePrincipalId(authentication);
        return ResponseEntity.ok(orderInitiationService.createOrder(principalId, request));
    }

    @Operation(
            summary = "Verify a payment and credit tokens",
            description = "Checks the provider signature and credits the purchased tokens exactly once."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tokens credited",
                    content = @Content(schema = @Schema(implementation = VerifyPaymentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid payment signature or body",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No purchase matches the intent and order",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Purchase already processed; currentStatus tells which way",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(@Valid @RequestBody VerifyPaymentRequest request,
                                                               Authentication authentication) {
        UUID principalId = AuthenticatedPrincipals.requirePrincipalId(authentication);
        return ResponseEntity.ok(paymentVerificationService.verifyAndCredit(principalId, request));
    }

    @Operation(summary = "Get tenant token balance", description = "Requires membership in the agency.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance retrieved",
                    content = @Content(schema = @Schema(implementation = TenantBalanceDto.class))),
            @ApiResponse(responseCode = "403", description = "Not a member of the agency",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<TenantBalanceDto> getBalance(
            @Parameter(description = "Tenant UUID", required = true) @RequestParam UUID tenantId,
            Authentication authentication) {
        UUID principalId = AuthenticatedPrincipals.requirePrincipalId(authentication);
        return ResponseEntity.ok(purchaseQueryService.getBalance(principalId, tenantId));
    }

    @Operation(summary = "List token purchases", description = "Newest first. Requires membership in the agency.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Purchases retrieved"),
            @ApiResponse(responseCode = "403", description = "Not a member of the agency",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/purchases")
    public ResponseEntity<Page<PurchaseIntentDto>> listPurchases(
            @Parameter(description = "Tenant UUID", required = true) @RequestParam UUID tenantId,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable,
            Authentication authentication) {
        UUID principalId = AuthenticatedPrincipals.requirePrincipalId(authentication);
        return ResponseEntity.ok(purchaseQueryService.listPurchases(principalId, tenantId, pageable));
    }
}
