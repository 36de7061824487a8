package com.bluecodes.storefront.payment.service;

import java.util.Optional;

/**
 * 결제사 연동 인터페이스.
 *
 * <p>체크아웃은 결제 의도(payment intent) 생성 결과에 의존하지 않는다.
 * 구현체는 어떤 실패든 예외 대신 {@link Optional#empty()}를 돌려줘야 한다.</p>
 */
public interface PaymentGateway {

    /**
     * 결제 의도를 생성한다. 결제사 키가 없거나 호출이 실패하면 empty.
     *
     * @param amountCents 최소 통화 단위 금액
     * @param currency    ISO 통화 코드 (소문자, e.g. usd)
     */
    Optional<PaymentIntent> createPaymentIntent(long amountCents, String currency);

    /**
     * @param id           결제사 쪽 결제 의도 ID (주문에 저장)
     * @param clientSecret 프론트엔드가 결제 확정에 쓰는 값 (응답으로만 전달)
     */
    record PaymentIntent(String id, String clientSecret) {}
}
