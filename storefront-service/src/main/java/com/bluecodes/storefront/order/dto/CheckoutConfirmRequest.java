package com.bluecodes.storefront.order.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param provider 결제 수단 (stripe, paypal). 결제 완료 여부는 검증하지 않는다.
 */
public record CheckoutConfirmRequest(
        @NotBlank(message = "order_id is required")
        String orderId,

        String provider
) {

    public String providerOrDefault() {
        return provider == null || provider.isBlank() ? "stripe" : provider;
    }
}
