package uk.gegc.tokenledger.features.payment.infra.provider;

import com.razorpay.Order;
import com.razorpay.RazorpayClient;
import com.razorpay.RazorpayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;
import uk.gegc.tokenledger.features.payment.application.PaymentProviderClient;
import uk.gegc.tokenledger.features.payment.application.ProviderOrder;
import uk.gegc.tokenledger.features.payment.application.ProviderOrderRequest;
import uk.gegc.tokenledger.features.payment.domain.exception.PaymentProviderException;

/**
 * Opens Razorpay orders through the official SDK.
 */
@Slf4j
@RequiredArgsConstructor
public class RazorpayPaymentProviderClient implements PaymentProviderClient {

    private final RazorpayClient razorpayClient;

    @Override
    public ProviderOrder createOrder(ProviderOrderRequest request) {
        try {
            Order order = razorpayClient.orders.create(buildOrderRequest(request));
            String orderId = order.get("id");
            if (orderId == null || orderId.isBlank()) {
                throw new PaymentProviderException("Razorpay returned an order without id");
            }
            log.debug("Razorpay order {} created for receipt {}", orderId, request.receipt());
            return new ProviderOrder(orderId, request.amountMinor(), request.currency(), request.receipt());
        } catch (RazorpayException e) {
            throw new PaymentProviderException("Razorpay order creation failed: " + e.getMessage(), e);
        }
    }

    JSONObject buildOrderRequest(ProviderOrderRequest request) {
        JSONObject body = new JSONObject();
        body.put("amount", request.amountMinor());
        body.put("currency", request.currency());
        body.put("receipt", request.receipt());
        JSONObject notes = new JSONObject();
        request.notes().forEach(notes::put);
        body.put("notes", notes);
        return body;
    }
}
