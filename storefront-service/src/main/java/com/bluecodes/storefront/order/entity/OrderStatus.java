package com.bluecodes.storefront.order.entity;

/**
 * 주문 상태.
 *
 * <pre>
 *   PENDING ──(confirm)──→ FULFILLED
 * </pre>
 * PAID, FAILED, REFUNDED는 결제사 웹훅 연동용으로 정의만 되어 있고
 * 현재 어떤 흐름도 이 상태로 전이시키지 않는다.
 */
public enum OrderStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED,
    FULFILLED
}
