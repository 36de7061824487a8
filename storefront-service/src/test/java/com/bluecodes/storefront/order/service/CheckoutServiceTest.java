package com.bluecodes.storefront.order.service;

import com.bluecodes.common.document.BaseDocument;
import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentUpdate;
import com.bluecodes.common.document.InMemoryDocumentStore;
import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.storefront.code.entity.CodeKey;
import com.bluecodes.storefront.order.dto.CartItemRequest;
import com.bluecodes.storefront.order.dto.CheckoutConfirmResponse;
import com.bluecodes.storefront.order.dto.CheckoutInitResponse;
import com.bluecodes.storefront.order.entity.Order;
import com.bluecodes.storefront.order.entity.OrderStatus;
import com.bluecodes.storefront.payment.service.PaymentGateway;
import com.bluecodes.storefront.support.InMemoryStorefront;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 체크아웃 흐름 테스트 - 메모리 저장소 위에서 실제 서비스 조합으로 검증한다.
 */
class CheckoutServiceTest {

    private final InMemoryStorefront storefront = new InMemoryStorefront();
    private final CheckoutService checkoutService = storefront.checkoutService;

    @Test
    @DisplayName("주문 생성 - 1999 × 2 = 3998, total == subtotal, PENDING 저장")
    void initCheckout_ComputesTotals() {
        // Given
        String productId = storefront.product("vbucks", 1999);

        // When
        CheckoutInitResponse response = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 2)), "buyer@example.com", "Buyer", null);

        // Then
        assertThat(response.totalCents()).isEqualTo(3998);
        assertThat(response.clientSecret()).isNull();
        Order order = storefront.orderRepository.findById(response.orderId()).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getSubtotalCents()).isEqualTo(3998);
        assertThat(order.getTotalCents()).isEqualTo(order.getSubtotalCents());
        assertThat(order.getCurrency()).isEqualTo("usd");
        assertThat(order.getDeliveredCodes()).isEmpty();
    }

    @Test
    @DisplayName("같은 상품 두 줄 (각 1개) - total 3998")
    void initCheckout_TwoLines() {
        String productId = storefront.product("skin", 1999);

        CheckoutInitResponse response = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 1), new CartItemRequest(productId, 1)),
                "buyer@example.com", null, "user-1");

        assertThat(response.totalCents()).isEqualTo(3998);
        Order order = storefront.orderRepository.findById(response.orderId()).orElseThrow();
        assertThat(order.getUserId()).isEqualTo("user-1");
        assertThat(order.getItems()).hasSize(2);
    }

    @Test
    @DisplayName("없는 상품 - INVALID_PRODUCT, 메시지에 상품 ID 포함, 주문 저장 안 함")
    void initCheckout_UnknownProduct() {
        assertThatThrownBy(() -> checkoutService.initCheckout(
                List.of(new CartItemRequest("missing-id", 1)), "buyer@example.com", null, null))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Invalid product missing-id")
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PRODUCT);

        assertThat(storefront.orderRepository.findAll(0)).isEmpty();
    }

    @Test
    @DisplayName("판매 중지 상품도 INVALID_PRODUCT")
    void initCheckout_InactiveProduct() {
        String productId = storefront.product("retired", 500, "usd", false);

        assertThatThrownBy(() -> checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 1)), "buyer@example.com", null, null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PRODUCT);
    }

    @Test
    @DisplayName("통화가 섞인 카트 - MIXED_CURRENCY")
    void initCheckout_MixedCurrency() {
        String usd = storefront.product("usd-item", 500, "usd", true);
        String eur = storefront.product("eur-item", 500, "eur", true);

        assertThatThrownBy(() -> checkoutService.initCheckout(
                List.of(new CartItemRequest(usd, 1), new CartItemRequest(eur, 1)), "buyer@example.com", null, null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.MIXED_CURRENCY);
    }

    @Test
    @DisplayName("결제 의도가 만들어지면 client secret 반환 + 주문에 paymentIntentId 저장")
    void initCheckout_WithPaymentIntent() {
        // Given
        PaymentGateway gateway = (amountCents, currency) ->
                Optional.of(new PaymentGateway.PaymentIntent("pi_123", "pi_123_secret_abc"));
        InMemoryStorefront withPayments = new InMemoryStorefront(gateway);
        String productId = withPayments.product("vbucks", 1000);

        // When
        CheckoutInitResponse response = withPayments.checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 1)), "buyer@example.com", null, null);

        // Then
        assertThat(response.clientSecret()).isEqualTo("pi_123_secret_abc");
        assertThat(withPayments.orderRepository.findById(response.orderId()).orElseThrow().getPaymentIntentId())
                .isEqualTo("pi_123");
    }

    @Test
    @DisplayName("확정 성공 - 수량만큼 서로 다른 코드, 라인 순서 유지, 주문 FULFILLED")
    void confirmCheckout_Success() {
        // Given
        String first = storefront.product("first", 100);
        String second = storefront.product("second", 200);
        storefront.stock(first, "FIRST", 3);
        storefront.stock(second, "SECOND", 3);
        String orderId = checkoutService.initCheckout(
                List.of(new CartItemRequest(first, 2), new CartItemRequest(second, 1)),
                "buyer@example.com", null, null).orderId();

        // When
        CheckoutConfirmResponse response = checkoutService.confirmCheckout(orderId, "stripe");

        // Then
        assertThat(response.orderId()).isEqualTo(orderId);
        assertThat(response.codes()).containsExactly("FIRST-1", "FIRST-2", "SECOND-1");

        Order order = storefront.orderRepository.findById(orderId).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(order.getDeliveredCodes()).hasSize(order.totalQuantity());

        List<CodeKey> assigned = assignedTo(orderId);
        assertThat(assigned).extracting(CodeKey::getCode)
                .containsExactlyInAnyOrder("FIRST-1", "FIRST-2", "SECOND-1");
        assertThat(assigned).allMatch(CodeKey::isAssigned);
        assertThat(storefront.inventoryService.countAvailable(first)).isEqualTo(1);
    }

    @Test
    @DisplayName("재고 부족 - 409, 주문은 PENDING, 이미 잡은 다른 라인의 코드도 되돌린다")
    void confirmCheckout_InsufficientStock_NoPartialCommit() {
        // Given
        String plenty = storefront.product("plenty", 100);
        String scarce = storefront.product("scarce", 100);
        storefront.stock(plenty, "PLENTY", 5);
        storefront.stock(scarce, "SCARCE", 1);
        String orderId = checkoutService.initCheckout(
                List.of(new CartItemRequest(plenty, 2), new CartItemRequest(scarce, 2)),
                "buyer@example.com", null, null).orderId();

        // When & Then
        assertThatThrownBy(() -> checkoutService.confirmCheckout(orderId, "stripe"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Insufficient stock")
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_STOCK);

        Order order = storefront.orderRepository.findById(orderId).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getDeliveredCodes()).isEmpty();
        assertThat(assignedTo(orderId)).isEmpty();
        assertThat(storefront.inventoryService.countAvailable(plenty)).isEqualTo(5);
        assertThat(storefront.inventoryService.countAvailable(scarce)).isEqualTo(1);
    }

    @Test
    @DisplayName("재고를 채운 뒤 다시 확정하면 성공한다")
    void confirmCheckout_RetryAfterRestock() {
        String productId = storefront.product("restock", 100);
        storefront.stock(productId, "OLD", 1);
        String orderId = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 2)), "buyer@example.com", null, null).orderId();
        assertThatThrownBy(() -> checkoutService.confirmCheckout(orderId, "stripe"))
                .isInstanceOf(BusinessException.class);

        storefront.stock(productId, "NEW", 1);
        CheckoutConfirmResponse response = checkoutService.confirmCheckout(orderId, "stripe");

        assertThat(response.codes()).containsExactly("OLD-1", "NEW-1");
    }

    @Test
    @DisplayName("확정 쓰기가 실패하면 잡은 코드를 되돌리고, 재시도는 같은 코드를 받는다")
    void confirmCheckout_FulfilWriteFails_ReleasesCodes() {
        // Given: 주문 문서의 첫 findAndModify(PENDING → FULFILLED)만 저장소 오류
        FailingOrderWriteStore failingStore = new FailingOrderWriteStore();
        InMemoryStorefront flaky = new InMemoryStorefront(failingStore);
        String productId = flaky.product("flaky", 500);
        flaky.stock(productId, "FL", 4);
        String orderId = flaky.checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 2)), "buyer@example.com", null, null).orderId();

        // When
        assertThatThrownBy(() -> flaky.checkoutService.confirmCheckout(orderId, "stripe"))
                .isInstanceOf(DataAccessResourceFailureException.class);

        // Then: 주문은 PENDING, 이 주문에 묶인 코드 없음, 재고 원상복구
        assertThat(flaky.orderRepository.findById(orderId).orElseThrow().getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(flaky.store.find(CodeKey.COLLECTION,
                DocumentQuery.where().eq("orderId", orderId), 0, CodeKey.class)).isEmpty();
        assertThat(flaky.inventoryService.countAvailable(productId)).isEqualTo(4);

        // 재시도: 되돌린 코드부터 다시 잡고, 주문이 가진 코드 수 == 전달한 코드 수
        CheckoutConfirmResponse retry = flaky.checkoutService.confirmCheckout(orderId, "stripe");
        assertThat(retry.codes()).containsExactly("FL-1", "FL-2");
        assertThat(flaky.store.find(CodeKey.COLLECTION,
                DocumentQuery.where().eq("orderId", orderId), 0, CodeKey.class)).hasSize(2);
        assertThat(flaky.inventoryService.countAvailable(productId)).isEqualTo(2);
    }

    @Test
    @DisplayName("이미 확정된 주문을 다시 확정하면 같은 코드를 돌려주고 추가 할당은 없다")
    void confirmCheckout_Repeat_ReturnsSameCodes() {
        String productId = storefront.product("repeat", 100);
        storefront.stock(productId, "R", 4);
        String orderId = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 2)), "buyer@example.com", null, null).orderId();

        CheckoutConfirmResponse first = checkoutService.confirmCheckout(orderId, "stripe");
        CheckoutConfirmResponse second = checkoutService.confirmCheckout(orderId, "paypal");

        assertThat(second.codes()).isEqualTo(first.codes());
        assertThat(storefront.inventoryService.countAvailable(productId)).isEqualTo(2);
    }

    @Test
    @DisplayName("없는 주문 - ORDER_NOT_FOUND")
    void confirmCheckout_UnknownOrder() {
        assertThatThrownBy(() -> checkoutService.confirmCheckout("nope", "stripe"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("동시 확정 - 마지막 N개 코드를 두 주문이 다투면 합계 N개 이하, 중복 없음")
    void confirmCheckout_ConcurrentOrders_NeverDoubleAllocate() throws Exception {
        // Given: 코드 4개, 각 3개씩 원하는 주문 2건
        String productId = storefront.product("contested", 100);
        storefront.stock(productId, "LAST", 4);
        String orderA = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 3)), "a@example.com", null, null).orderId();
        String orderB = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 3)), "b@example.com", null, null).orderId();

        // When
        List<Outcome> outcomes = runConcurrently(List.of(orderA, orderB));

        // Then
        List<String> delivered = outcomes.stream().flatMap(o -> o.codes().stream()).toList();
        assertThat(delivered.size()).isLessThanOrEqualTo(4);
        assertThat(new HashSet<>(delivered)).hasSameSizeAs(delivered);
        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSizeLessThanOrEqualTo(1);
        assertThat(outcomes).filteredOn(o -> !o.succeeded())
                .allMatch(o -> o.error() == ErrorCode.INSUFFICIENT_STOCK);
        // 실패한 주문은 코드를 하나도 들고 있지 않아야 한다
        for (Outcome outcome : outcomes) {
            assertThat(assignedTo(outcome.orderId())).hasSize(outcome.codes().size());
        }
    }

    @Test
    @DisplayName("동시 확정 - 여러 주문이 몰려도 할당된 코드 수 == 성공 주문 수량 합, 중복 없음")
    void confirmCheckout_ManyConcurrentOrders() throws Exception {
        // Given: 코드 20개, 2개씩 원하는 주문 12건
        String productId = storefront.product("rush", 100);
        storefront.stock(productId, "RUSH", 20);
        List<String> orderIds = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            orderIds.add(checkoutService.initCheckout(
                    List.of(new CartItemRequest(productId, 2)), "buyer" + i + "@example.com", null, null).orderId());
        }

        // When
        List<Outcome> outcomes = runConcurrently(orderIds);

        // Then
        List<String> delivered = outcomes.stream().flatMap(o -> o.codes().stream()).toList();
        long succeeded = outcomes.stream().filter(Outcome::succeeded).count();
        assertThat(succeeded).isPositive().isLessThanOrEqualTo(10);
        assertThat(delivered).hasSize((int) succeeded * 2);
        assertThat(new HashSet<>(delivered)).hasSameSizeAs(delivered);
        assertThat(storefront.inventoryService.countAvailable(productId)).isEqualTo(20 - delivered.size());
        for (Outcome outcome : outcomes) {
            OrderStatus expected = outcome.succeeded() ? OrderStatus.FULFILLED : OrderStatus.PENDING;
            assertThat(storefront.orderRepository.findById(outcome.orderId()).orElseThrow().getStatus())
                    .isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("같은 주문을 동시에 두 번 확정해도 코드는 한 벌만 할당된다")
    void confirmCheckout_SameOrderTwiceConcurrently() throws Exception {
        String productId = storefront.product("double-click", 100);
        storefront.stock(productId, "DC", 6);
        String orderId = checkoutService.initCheckout(
                List.of(new CartItemRequest(productId, 2)), "buyer@example.com", null, null).orderId();

        List<Outcome> outcomes = runConcurrently(List.of(orderId, orderId));

        assertThat(outcomes).allMatch(Outcome::succeeded);
        assertThat(outcomes.get(0).codes()).isEqualTo(outcomes.get(1).codes());
        assertThat(assignedTo(orderId)).hasSize(2);
        assertThat(storefront.inventoryService.countAvailable(productId)).isEqualTo(4);
    }

    private List<CodeKey> assignedTo(String orderId) {
        return storefront.store.find(CodeKey.COLLECTION,
                DocumentQuery.where().eq("orderId", orderId), 0, CodeKey.class);
    }

    private List<Outcome> runConcurrently(List<String> orderIds) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(orderIds.size(), 8));
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (String orderId : orderIds) {
                Callable<Outcome> task = () -> {
                    start.await();
                    try {
                        return Outcome.success(orderId, checkoutService.confirmCheckout(orderId, "stripe").codes());
                    } catch (BusinessException e) {
                        return Outcome.failure(orderId, e.getErrorCode());
                    }
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private record Outcome(String orderId, List<String> codes, ErrorCode error) {

        static Outcome success(String orderId, List<String> codes) {
            return new Outcome(orderId, codes, null);
        }

        static Outcome failure(String orderId, ErrorCode error) {
            return new Outcome(orderId, Collections.emptyList(), error);
        }

        boolean succeeded() {
            return error == null;
        }
    }

    /**
     * 주문 컬렉션의 첫 번째 findAndModify만 실패시키는 저장소.
     */
    private static class FailingOrderWriteStore extends InMemoryDocumentStore {

        private boolean failed;

        FailingOrderWriteStore() {
            super(Clock.systemUTC());
        }

        @Override
        public synchronized <T extends BaseDocument> Optional<T> findAndModify(String collection, DocumentQuery query,
                                                                               DocumentUpdate update, Class<T> type) {
            if (Order.COLLECTION.equals(collection) && !failed) {
                failed = true;
                throw new DataAccessResourceFailureException("connection reset");
            }
            return super.findAndModify(collection, query, update, type);
        }
    }
}
