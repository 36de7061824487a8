package com.bluecodes.storefront.product.repository;

import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.common.document.DocumentUpdate;
import com.bluecodes.storefront.product.dto.ProductFilter;
import com.bluecodes.storefront.product.entity.Product;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

    private final DocumentStore documentStore;

    public String save(Product product) {
        return documentStore.create(Product.COLLECTION, product);
    }

    public Optional<Product> findById(String id) {
        return documentStore.findOne(Product.COLLECTION, DocumentQuery.byId(id), Product.class);
    }

    // 판매 중(active=true)인 상품만 조회
    public List<Product> findActive(ProductFilter filter, int limit) {
        DocumentQuery query = DocumentQuery.where()
                .eq("active", true)
                .eqIfPresent("game", filter.game())
                .eqIfPresent("rewardType", filter.rewardType())
                .gteIfPresent("priceCents", filter.minPrice())
                .lteIfPresent("priceCents", filter.maxPrice());
        return documentStore.find(Product.COLLECTION, query, limit, Product.class);
    }

    public Optional<Product> update(String id, DocumentUpdate update) {
        return documentStore.findAndModify(Product.COLLECTION, DocumentQuery.byId(id), update, Product.class);
    }
}
