package com.bluecodes.storefront.order.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CheckoutInitRequest(
        @NotEmpty(message = "items must not be empty")
        List<@Valid CartItemRequest> items,

        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        String email,

        String name
) {}
