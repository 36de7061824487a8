package com.bluecodes.storefront.payment.service;

import com.bluecodes.storefront.payment.client.StripeClient;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stripe 구현체.
 *
 * <p>{@code payment.stripe.api-key}(STRIPE_API_KEY)가 비어 있으면 호출 자체를 하지 않는다.
 * 호출 실패(네트워크, 2xx 외 응답, Circuit Breaker OPEN)는 모두 fallback에서 empty로 바뀐다.</p>
 */
@Slf4j
@Component
public class StripePaymentGateway implements PaymentGateway {

    private final StripeClient stripeClient;
    private final String apiKey;

    public StripePaymentGateway(StripeClient stripeClient,
                                @Value("${payment.stripe.api-key:}") String apiKey) {
        this.stripeClient = stripeClient;
        this.apiKey = apiKey;
    }

    @Override
    @CircuitBreaker(name = "paymentProvider", fallbackMethod = "createPaymentIntentFallback")
    public Optional<PaymentIntent> createPaymentIntent(long amountCents, String currency) {
        if (!StringUtils.hasText(apiKey)) {
            return Optional.empty();
        }

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("amount", amountCents);
        form.put("currency", currency);
        form.put("automatic_payment_methods[enabled]", true);

        StripeClient.PaymentIntentResponse response = stripeClient.createPaymentIntent("Bearer " + apiKey, form);
        log.info("Payment intent created: id={}, amount={} {}", response.id(), amountCents, currency);
        return Optional.of(new PaymentIntent(response.id(), response.clientSecret()));
    }

    private Optional<PaymentIntent> createPaymentIntentFallback(long amountCents, String currency, Throwable t) {
        log.warn("Payment intent creation failed, continuing without client secret: amount={} {}, cause={}",
                amountCents, currency, t.toString());
        return Optional.empty();
    }
}
