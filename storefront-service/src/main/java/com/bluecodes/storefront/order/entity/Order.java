package com.bluecodes.storefront.order.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * 주문.
 *
 * <p>불변식:
 * <ul>
 *   <li>totalCents == subtotalCents (세금/할인 없음)</li>
 *   <li>FULFILLED 이후: Σ items.quantity == deliveredCodes.size()</li>
 * </ul>
 * 상태 전이는 엔티티 메서드가 아니라 OrderRepository의 조건부 업데이트로 한다.
 * 같은 주문을 두 요청이 동시에 확정하는 경우를 DB가 판정해야 하기 때문이다.</p>
 */
@Document(collection = Order.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseDocument {

    public static final String COLLECTION = "order";

    private String userId;          // 비회원 주문이면 null
    private String email;
    private String name;
    private List<OrderItem> items = new ArrayList<>();
    private long subtotalCents;
    private long totalCents;
    private String currency;
    private String paymentIntentId;
    private OrderStatus status;
    private List<String> deliveredCodes = new ArrayList<>();

    @Builder
    public Order(String userId, String email, String name, List<OrderItem> items,
                 long subtotalCents, String currency) {
        this.userId = userId;
        this.email = email;
        this.name = name;
        this.items = new ArrayList<>(items);
        this.subtotalCents = subtotalCents;
        this.totalCents = subtotalCents;
        this.currency = currency;
        this.status = OrderStatus.PENDING;
        this.deliveredCodes = new ArrayList<>();
    }

    public int totalQuantity() {
        return items.stream().mapToInt(OrderItem::getQuantity).sum();
    }
}
