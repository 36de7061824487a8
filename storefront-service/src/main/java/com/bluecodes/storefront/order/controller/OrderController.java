package com.bluecodes.storefront.order.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.common.security.AuthenticationFilter;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.order.entity.Order;
import com.bluecodes.storefront.order.service.OrderService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @GetMapping
    public ApiResponse<List<Order>> listOrders(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims) {
        return ApiResponse.ok(orderService.listOrders(claims));
    }
}
