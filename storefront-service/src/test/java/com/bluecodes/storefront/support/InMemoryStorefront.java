package com.bluecodes.storefront.support;

import com.bluecodes.common.document.InMemoryDocumentStore;
import com.bluecodes.storefront.code.repository.CodeKeyRepository;
import com.bluecodes.storefront.code.service.InventoryService;
import com.bluecodes.storefront.order.repository.OrderRepository;
import com.bluecodes.storefront.order.service.CheckoutService;
import com.bluecodes.storefront.payment.service.PaymentGateway;
import com.bluecodes.storefront.product.dto.ProductRequest;
import com.bluecodes.storefront.product.repository.ProductRepository;
import com.bluecodes.storefront.product.service.ProductService;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 메모리 저장소 위에 실제 서비스/리포지토리를 조립한 테스트 픽스처.
 * 스프링 컨텍스트 없이 체크아웃 전체 흐름을 돌린다.
 */
public class InMemoryStorefront {

    public final InMemoryDocumentStore store;
    public final ProductRepository productRepository;
    public final ProductService productService;
    public final CodeKeyRepository codeKeyRepository;
    public final InventoryService inventoryService;
    public final OrderRepository orderRepository;
    public final CheckoutService checkoutService;

    public InMemoryStorefront() {
        this(new InMemoryDocumentStore(Clock.systemUTC()));
    }

    public InMemoryStorefront(PaymentGateway paymentGateway) {
        this(new InMemoryDocumentStore(Clock.systemUTC()), paymentGateway);
    }

    // 장애 주입용 저장소를 끼울 때
    public InMemoryStorefront(InMemoryDocumentStore store) {
        this(store, (amountCents, currency) -> Optional.empty());
    }

    public InMemoryStorefront(InMemoryDocumentStore store, PaymentGateway paymentGateway) {
        this.store = store;
        this.productRepository = new ProductRepository(store);
        this.productService = new ProductService(productRepository);
        this.codeKeyRepository = new CodeKeyRepository(store);
        this.inventoryService = new InventoryService(codeKeyRepository, productService);
        this.orderRepository = new OrderRepository(store);
        this.checkoutService = new CheckoutService(orderRepository, productService, inventoryService, paymentGateway);
    }

    public String product(String title, int priceCents) {
        return product(title, priceCents, "usd", true);
    }

    public String product(String title, int priceCents, String currency, boolean active) {
        return productService.createProduct(new ProductRequest(
                title, "Fortnite", "coins", title + " description",
                List.of("https://img.example.com/" + title + ".png"),
                priceCents, currency, active, Set.of("promo")));
    }

    // prefix-1, prefix-2, ... 형태의 코드를 count개 등록
    public List<String> stock(String productId, String prefix, int count) {
        List<String> codes = IntStream.rangeClosed(1, count)
                .mapToObj(i -> prefix + "-" + i)
                .toList();
        inventoryService.addCodes(productId, codes);
        return codes;
    }
}
