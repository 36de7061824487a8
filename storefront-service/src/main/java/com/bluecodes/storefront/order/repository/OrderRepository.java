package com.bluecodes.storefront.order.repository;

import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.common.document.DocumentUpdate;
import com.bluecodes.storefront.order.entity.Order;
import com.bluecodes.storefront.order.entity.OrderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepository {

    private final DocumentStore documentStore;

    public String save(Order order) {
        return documentStore.create(Order.COLLECTION, order);
    }

    public Optional<Order> findById(String id) {
        return documentStore.findOne(Order.COLLECTION, DocumentQuery.byId(id), Order.class);
    }

    public List<Order> findByEmail(String email, int limit) {
        return documentStore.find(Order.COLLECTION,
                DocumentQuery.where().eq("email", email).sortBy("createdAt"), limit, Order.class);
    }

    public List<Order> findAll(int limit) {
        return documentStore.find(Order.COLLECTION,
                DocumentQuery.where().sortBy("createdAt"), limit, Order.class);
    }

    /**
     * PENDING → FULFILLED 조건부 전이. 이미 다른 요청이 전이시켰으면 empty.
     */
    public Optional<Order> markFulfilled(String id, List<String> deliveredCodes) {
        return documentStore.findAndModify(Order.COLLECTION,
                DocumentQuery.byId(id).eq("status", OrderStatus.PENDING.name()),
                DocumentUpdate.update()
                        .set("status", OrderStatus.FULFILLED.name())
                        .set("deliveredCodes", deliveredCodes),
                Order.class);
    }

    public void attachPaymentIntent(String id, String paymentIntentId) {
        documentStore.updateMany(Order.COLLECTION, DocumentQuery.byId(id),
                DocumentUpdate.update().set("paymentIntentId", paymentIntentId), Order.class);
    }
}
