package com.bluecodes.storefront.code.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.storefront.code.entity.CodeKey;
import com.bluecodes.storefront.code.repository.CodeKeyRepository;
import com.bluecodes.storefront.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 교환 코드 재고 관리.
 *
 * <h3>예약(reserve) 방식</h3>
 * <pre>
 *   loop quantity 회:
 *     findAndModify({productId, assigned:false} 오래된 순) → {assigned:true, orderId}
 *     더 이상 맞는 문서가 없으면 중단
 * </pre>
 * "N개 읽고 나중에 할당 표시"를 하지 않는다. 읽기와 할당 사이에 다른 요청이 끼어들 틈이 없고,
 * 여러 인스턴스가 같은 DB를 써도 동일하게 동작한다.
 *
 * <p>요청 수량보다 적게 잡힐 수 있다. 부족분 판단과 되돌리기(release)는 호출자(CheckoutService)의 몫이다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final CodeKeyRepository codeKeyRepository;
    private final ProductService productService;

    /**
     * 코드 일괄 등록.
     *
     * <ol>
     *   <li>상품이 없으면 404</li>
     *   <li>요청 안에서 같은 코드가 두 번 나오면 400</li>
     *   <li>이미 저장된 코드가 있으면 아무것도 넣지 않고 409</li>
     *   <li>동시 등록으로 검사를 통과한 중복은 unique index가 막는다 (DuplicateKeyException → 409)</li>
     * </ol>
     */
    public List<String> addCodes(String productId, List<String> codes) {
        productService.getProduct(productId);

        Set<String> seen = new HashSet<>();
        Set<String> repeated = new LinkedHashSet<>();
        for (String code : codes) {
            if (!seen.add(code)) {
                repeated.add(code);
            }
        }
        if (!repeated.isEmpty()) {
            throw new BusinessException(ErrorCode.DUPLICATE_CODE_IN_REQUEST,
                    "Duplicate code in request: " + String.join(", ", repeated));
        }

        List<CodeKey> existing = codeKeyRepository.findByCodes(codes);
        if (!existing.isEmpty()) {
            throw new BusinessException(ErrorCode.CODE_ALREADY_EXISTS,
                    "Code already exists: " + existing.size() + " of " + codes.size());
        }

        List<String> inserted = new ArrayList<>(codes.size());
        for (String code : codes) {
            inserted.add(codeKeyRepository.save(new CodeKey(productId, code)));
        }
        log.info("Codes imported: productId={}, count={}", productId, inserted.size());
        return inserted;
    }

    /**
     * productId의 미할당 코드를 최대 quantity개 orderId에 할당한다.
     *
     * @return 실제로 잡은 코드 (quantity보다 적을 수 있음)
     */
    public List<CodeKey> reserve(String productId, int quantity, String orderId) {
        List<CodeKey> reserved = new ArrayList<>(quantity);
        while (reserved.size() < quantity) {
            Optional<CodeKey> claimed = codeKeyRepository.claimOne(productId, orderId);
            if (claimed.isEmpty()) {
                break;
            }
            reserved.add(claimed.get());
        }
        return reserved;
    }

    /**
     * 예약했던 코드를 되돌린다. 지금도 이 주문이 소유한 코드만 풀린다.
     */
    public void release(String orderId, Collection<CodeKey> codes) {
        if (codes.isEmpty()) {
            return;
        }
        List<String> ids = codes.stream().map(CodeKey::getId).toList();
        long released = codeKeyRepository.release(orderId, ids);
        log.info("Codes released: orderId={}, requested={}, released={}", orderId, ids.size(), released);
    }

    public long countAvailable(String productId) {
        productService.getProduct(productId);
        return codeKeyRepository.countAvailable(productId);
    }
}
