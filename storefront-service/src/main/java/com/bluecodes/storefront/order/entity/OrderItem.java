package com.bluecodes.storefront.order.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

// 주문 문서에 내장(embedded)되는 라인 아이템
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OrderItem {

    private String productId;
    private int quantity;
}
