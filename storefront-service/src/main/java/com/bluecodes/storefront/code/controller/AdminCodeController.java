package com.bluecodes.storefront.code.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.common.security.AuthenticationFilter;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.code.dto.AddCodesRequest;
import com.bluecodes.storefront.code.dto.AddCodesResponse;
import com.bluecodes.storefront.code.dto.StockResponse;
import com.bluecodes.storefront.code.service.InventoryService;
import com.bluecodes.storefront.user.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/codes")
@RequiredArgsConstructor
public class AdminCodeController {

    private final InventoryService inventoryService;
    private final AuthService authService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AddCodesResponse> addCodes(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims,
            @Valid @RequestBody AddCodesRequest request) {
        authService.requireAdmin(claims);
        return ApiResponse.ok(new AddCodesResponse(
                inventoryService.addCodes(request.productId(), request.codes())));
    }

    // 판매 가능(미할당) 코드 수
    @GetMapping("/{productId}/stock")
    public ApiResponse<StockResponse> getStock(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims,
            @PathVariable String productId) {
        authService.requireAdmin(claims);
        return ApiResponse.ok(new StockResponse(productId, inventoryService.countAvailable(productId)));
    }
}
