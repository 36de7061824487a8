package com.bluecodes.storefront.product.dto;

/**
 * 상품 목록 필터. 모든 조건은 선택이며 null이면 적용하지 않는다.
 * 가격 범위는 양 끝을 포함한다.
 */
public record ProductFilter(String game, String rewardType, Integer minPrice, Integer maxPrice) {

    public static ProductFilter none() {
        return new ProductFilter(null, null, null, null);
    }
}
