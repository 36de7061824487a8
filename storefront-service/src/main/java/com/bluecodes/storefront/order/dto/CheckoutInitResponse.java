package com.bluecodes.storefront.order.dto;

/**
 * @param clientSecret 결제 의도가 만들어졌을 때만 값이 있다
 */
public record CheckoutInitResponse(String orderId, long totalCents, String clientSecret) {}
