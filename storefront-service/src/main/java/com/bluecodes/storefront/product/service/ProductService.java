package com.bluecodes.storefront.product.service;

import com.bluecodes.common.document.DocumentUpdate;
import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.storefront.product.dto.ProductFilter;
import com.bluecodes.storefront.product.dto.ProductRequest;
import com.bluecodes.storefront.product.dto.ProductUpdateRequest;
import com.bluecodes.storefront.product.entity.Product;
import com.bluecodes.storefront.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 상품 카탈로그 서비스.
 *
 * <p>권한 검사는 컨트롤러에서 AuthService로 먼저 끝낸다. 이 서비스는 관리자 요청이라고 가정한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    static final int LIST_LIMIT = 100;

    private final ProductRepository productRepository;

    public String createProduct(ProductRequest request) {
        String id = productRepository.save(request.toEntity());
        log.info("Product created: id={}, title={}", id, request.title());
        return id;
    }

    public List<Product> listProducts(ProductFilter filter) {
        return productRepository.findActive(filter, LIST_LIMIT);
    }

    // active 여부와 관계없이 조회 (관리자 화면/주문 내역에서 비활성 상품도 보여야 한다)
    public Product getProduct(String id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));
    }

    /**
     * 체크아웃에서 살 수 있는 상품인지 확인한다. 없거나 판매 중지된 상품이면 empty.
     */
    public Optional<Product> findPurchasable(String id) {
        return productRepository.findById(id).filter(Product::isActive);
    }

    /**
     * merge-patch: 요청에 들어온 필드만 바꾼다. 빈 패치면 현재 상태를 그대로 돌려준다.
     */
    public Product updateProduct(String id, ProductUpdateRequest patch) {
        if (patch.isEmpty()) {
            return getProduct(id);
        }
        DocumentUpdate update = DocumentUpdate.update()
                .setIfPresent("title", patch.title())
                .setIfPresent("game", patch.game())
                .setIfPresent("rewardType", patch.rewardType())
                .setIfPresent("description", patch.description())
                .setIfPresent("images", patch.images() == null ? null : new ArrayList<>(patch.images()))
                .setIfPresent("priceCents", patch.priceCents())
                .setIfPresent("currency", patch.currency())
                .setIfPresent("active", patch.active())
                .setIfPresent("tags", patch.tags() == null ? null : new ArrayList<>(patch.tags()));

        Product updated = productRepository.update(id, update)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));
        log.info("Product updated: id={}, fields={}", id, update.getAssignments().keySet());
        return updated;
    }
}
