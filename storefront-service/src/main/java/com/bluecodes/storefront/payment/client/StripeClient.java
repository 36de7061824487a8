package com.bluecodes.storefront.payment.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.Map;

/**
 * Stripe PaymentIntent API 클라이언트.
 *
 * <p>Stripe는 JSON이 아니라 form-urlencoded 본문을 받는다.
 * 중첩 파라미터는 {@code automatic_payment_methods[enabled]=true} 같은 키 이름으로 보낸다.</p>
 */
@FeignClient(name = "stripe", url = "${payment.stripe.url:https://api.stripe.com}")
public interface StripeClient {

    @PostMapping(value = "/v1/payment_intents", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    PaymentIntentResponse createPaymentIntent(@RequestHeader("Authorization") String authorization,
                                              @RequestBody Map<String, ?> form);

    record PaymentIntentResponse(String id, @JsonProperty("client_secret") String clientSecret) {}
}
