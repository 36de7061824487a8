package com.bluecodes.storefront.code.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddCodesRequest(
        @NotBlank(message = "product_id is required")
        String productId,

        @NotEmpty(message = "codes must not be empty")
        List<@NotBlank(message = "code must not be blank") String> codes
) {}
