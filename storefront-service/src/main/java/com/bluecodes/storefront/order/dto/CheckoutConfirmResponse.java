package com.bluecodes.storefront.order.dto;

import java.util.List;

// codes: 라인 아이템 순서대로 전달된 교환 코드
public record CheckoutConfirmResponse(String orderId, List<String> codes) {}
