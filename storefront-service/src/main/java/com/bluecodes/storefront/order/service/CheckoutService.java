package com.bluecodes.storefront.order.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.storefront.code.entity.CodeKey;
import com.bluecodes.storefront.code.service.InventoryService;
import com.bluecodes.storefront.order.dto.CartItemRequest;
import com.bluecodes.storefront.order.dto.CheckoutConfirmResponse;
import com.bluecodes.storefront.order.dto.CheckoutInitResponse;
import com.bluecodes.storefront.order.entity.Order;
import com.bluecodes.storefront.order.entity.OrderItem;
import com.bluecodes.storefront.order.entity.OrderStatus;
import com.bluecodes.storefront.order.repository.OrderRepository;
import com.bluecodes.storefront.payment.service.PaymentGateway;
import com.bluecodes.storefront.product.entity.Product;
import com.bluecodes.storefront.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 체크아웃 흐름 - 주문 생성(init)과 코드 할당(confirm).
 *
 * <h3>init</h3>
 * <ol>
 *   <li>카트의 각 상품을 조회 (없거나 판매 중지 → 400 "Invalid product &lt;id&gt;")</li>
 *   <li>subtotal = Σ priceCents × quantity, total = subtotal. 통화가 섞이면 400</li>
 *   <li>PENDING 주문 저장</li>
 *   <li>결제사 키가 있으면 결제 의도 생성 시도. 실패해도 주문은 그대로 두고 client secret만 비운다</li>
 * </ol>
 *
 * <h3>confirm (all-or-nothing)</h3>
 * <pre>
 *   for item in order.items:
 *       reserve(item.productId, item.quantity, orderId)   ← 코드마다 원자적 할당
 *       부족하면 → 지금까지 잡은 코드 전부 release → 409, 주문은 PENDING 유지
 *   findAndModify({id, status:PENDING}) → FULFILLED + deliveredCodes
 *       다른 요청이 먼저 확정했으면 → 내가 잡은 코드 release → 먼저 확정된 코드 반환
 *       쓰기 자체가 실패하면 → 잡은 코드 release 후 예외 전파
 * </pre>
 * <p>같은 주문의 확정 요청 두 개가 남은 재고를 나눠 잡으면 둘 다 부족으로 release 후 409가 될 수 있다.
 * 재고 한 벌이 온전히 남아 있어도 그렇다. 이때 주문은 PENDING으로 남고 코드는 하나도 할당되지 않으므로
 * 클라이언트가 다시 확정하면 된다. 서버에서 자동 재시도는 하지 않는다.</p>
 * 단일 문서 연산만으로 구성되므로 DB 트랜잭션 없이 여러 인스턴스에서 동시에 실행해도
 * 같은 코드가 두 주문에 들어가지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final OrderRepository orderRepository;
    private final ProductService productService;
    private final InventoryService inventoryService;
    private final PaymentGateway paymentGateway;

    public CheckoutInitResponse initCheckout(List<CartItemRequest> cart, String email, String name, String userId) {
        long subtotal = 0;
        String currency = null;
        List<OrderItem> items = new ArrayList<>(cart.size());

        for (CartItemRequest cartItem : cart) {
            Product product = productService.findPurchasable(cartItem.productId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_PRODUCT,
                            "Invalid product " + cartItem.productId()));
            if (currency != null && !currency.equalsIgnoreCase(product.getCurrency())) {
                throw new BusinessException(ErrorCode.MIXED_CURRENCY);
            }
            currency = product.getCurrency();
            subtotal += (long) product.getPriceCents() * cartItem.quantity();
            items.add(new OrderItem(cartItem.productId(), cartItem.quantity()));
        }

        Order order = Order.builder()
                .userId(userId)
                .email(email)
                .name(name)
                .items(items)
                .subtotalCents(subtotal)
                .currency(currency)
                .build();
        String orderId = orderRepository.save(order);
        log.info("Order created: orderId={}, email={}, total={} {}", orderId, email, order.getTotalCents(), currency);

        String clientSecret = paymentGateway.createPaymentIntent(order.getTotalCents(), currency)
                .map(intent -> {
                    attachPaymentIntent(orderId, intent.id());
                    return intent.clientSecret();
                })
                .orElse(null);

        return new CheckoutInitResponse(orderId, order.getTotalCents(), clientSecret);
    }

    public CheckoutConfirmResponse confirmCheckout(String orderId, String provider) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (order.getStatus() == OrderStatus.FULFILLED) {
            // 같은 주문 재확정: 이미 전달한 코드를 다시 돌려준다
            return new CheckoutConfirmResponse(orderId, order.getDeliveredCodes());
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order " + orderId + " is " + order.getStatus());
        }

        List<CodeKey> claimed;
        try {
            claimed = reserveAll(order);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.INSUFFICIENT_STOCK) {
                throw e;
            }
            // 같은 주문의 다른 확정 요청이 재고를 먼저 가져간 경우라면 그 결과를 돌려준다
            return orderRepository.findById(orderId)
                    .filter(current -> current.getStatus() == OrderStatus.FULFILLED)
                    .map(current -> new CheckoutConfirmResponse(orderId, current.getDeliveredCodes()))
                    .orElseThrow(() -> e);
        }
        List<String> codes = claimed.stream().map(CodeKey::getCode).toList();

        Optional<Order> fulfilled;
        try {
            fulfilled = orderRepository.markFulfilled(orderId, codes);
        } catch (RuntimeException e) {
            // 주문은 PENDING 그대로, 잡은 코드는 되돌린다
            releaseAfterFailure(orderId, claimed, e);
            throw e;
        }
        if (fulfilled.isEmpty()) {
            inventoryService.release(orderId, claimed);
            Order current = orderRepository.findById(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
            if (current.getStatus() == OrderStatus.FULFILLED) {
                log.info("Order already fulfilled by a concurrent confirmation: orderId={}", orderId);
                return new CheckoutConfirmResponse(orderId, current.getDeliveredCodes());
            }
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order " + orderId + " is " + current.getStatus());
        }

        log.info("Order fulfilled: orderId={}, provider={}, codes={}", orderId, provider, codes.size());
        return new CheckoutConfirmResponse(orderId, codes);
    }

    /**
     * 주문의 모든 라인 아이템에 대해 코드를 잡는다. 하나라도 모자라면 이번에 잡은 코드를 전부 되돌린다.
     */
    private List<CodeKey> reserveAll(Order order) {
        String orderId = order.getId();
        List<CodeKey> claimed = new ArrayList<>(order.totalQuantity());
        try {
            for (OrderItem item : order.getItems()) {
                List<CodeKey> reserved = inventoryService.reserve(item.getProductId(), item.getQuantity(), orderId);
                claimed.addAll(reserved);
                if (reserved.size() < item.getQuantity()) {
                    log.warn("Insufficient stock: orderId={}, productId={}, requested={}, available={}",
                            orderId, item.getProductId(), item.getQuantity(), reserved.size());
                    throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK);
                }
            }
            return claimed;
        } catch (RuntimeException e) {
            releaseAfterFailure(orderId, claimed, e);
            throw e;
        }
    }

    private void releaseAfterFailure(String orderId, List<CodeKey> claimed, RuntimeException cause) {
        try {
            inventoryService.release(orderId, claimed);
        } catch (RuntimeException releaseFailure) {
            cause.addSuppressed(releaseFailure);
            log.error("Failed to release {} codes for orderId={}", claimed.size(), orderId, releaseFailure);
        }
    }

    private void attachPaymentIntent(String orderId, String paymentIntentId) {
        try {
            orderRepository.attachPaymentIntent(orderId, paymentIntentId);
        } catch (RuntimeException e) {
            log.warn("Could not store payment intent on order: orderId={}, paymentIntentId={}, cause={}",
                    orderId, paymentIntentId, e.toString());
        }
    }
}
