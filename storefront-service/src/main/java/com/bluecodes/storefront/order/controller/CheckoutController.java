package com.bluecodes.storefront.order.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.common.security.AuthenticationFilter;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.order.dto.CheckoutConfirmRequest;
import com.bluecodes.storefront.order.dto.CheckoutConfirmResponse;
import com.bluecodes.storefront.order.dto.CheckoutInitRequest;
import com.bluecodes.storefront.order.dto.CheckoutInitResponse;
import com.bluecodes.storefront.order.service.CheckoutService;
import com.bluecodes.storefront.user.entity.User;
import com.bluecodes.storefront.user.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 체크아웃 API. 비회원도 쓸 수 있다. 로그인 상태면 주문에 userId가 남는다.
 */
@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final AuthService authService;

    @PostMapping("/init")
    public ApiResponse<CheckoutInitResponse> init(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims,
            @Valid @RequestBody CheckoutInitRequest request) {
        String userId = authService.findCurrentUser(claims).map(User::getId).orElse(null);
        return ApiResponse.ok(checkoutService.initCheckout(
                request.items(), request.email(), request.name(), userId));
    }

    @PostMapping("/confirm")
    public ApiResponse<CheckoutConfirmResponse> confirm(@Valid @RequestBody CheckoutConfirmRequest request) {
        return ApiResponse.ok(checkoutService.confirmCheckout(request.orderId(), request.providerOrDefault()));
    }
}
