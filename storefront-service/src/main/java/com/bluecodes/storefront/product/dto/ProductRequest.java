package com.bluecodes.storefront.product.dto;

import com.bluecodes.storefront.product.entity.Product;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Set;

/**
 * 상품 등록 요청. currency 기본값 usd, active 기본값 true.
 */
public record ProductRequest(
        @NotBlank(message = "title is required")
        String title,

        @NotBlank(message = "game is required")
        String game,

        @NotBlank(message = "reward_type is required")
        String rewardType,

        @NotBlank(message = "description is required")
        String description,

        List<String> images,

        @NotNull(message = "price_cents is required")
        @Min(value = 0, message = "price_cents must be >= 0")
        Integer priceCents,

        String currency,
        Boolean active,
        Set<String> tags
) {

    public Product toEntity() {
        return Product.builder()
                .title(title)
                .game(game)
                .rewardType(rewardType)
                .description(description)
                .images(images)
                .priceCents(priceCents)
                .currency(currency)
                .active(active)
                .tags(tags)
                .build();
    }
}
