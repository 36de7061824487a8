package com.bluecodes.storefront.product.dto;

import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Set;

/**
 * 상품 부분 수정 요청 (merge-patch). null인 필드는 변경하지 않는다.
 */
public record ProductUpdateRequest(
        String title,
        String game,
        String rewardType,
        String description,
        List<String> images,

        @Min(value = 0, message = "price_cents must be >= 0")
        Integer priceCents,

        String currency,
        Boolean active,
        Set<String> tags
) {

    public boolean isEmpty() {
        return title == null && game == null && rewardType == null && description == null
                && images == null && priceCents == null && currency == null && active == null && tags == null;
    }
}
