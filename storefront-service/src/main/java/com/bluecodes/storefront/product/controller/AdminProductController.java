package com.bluecodes.storefront.product.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.common.security.AuthenticationFilter;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.product.dto.ProductIdResponse;
import com.bluecodes.storefront.product.dto.ProductRequest;
import com.bluecodes.storefront.product.dto.ProductUpdateRequest;
import com.bluecodes.storefront.product.entity.Product;
import com.bluecodes.storefront.product.service.ProductService;
import com.bluecodes.storefront.user.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 관리자 상품 API. 모든 요청은 role=admin 토큰이 필요하다.
 */
@RestController
@RequestMapping("/api/admin/products")
@RequiredArgsConstructor
public class AdminProductController {

    private final ProductService productService;
    private final AuthService authService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ProductIdResponse> createProduct(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims,
            @Valid @RequestBody ProductRequest request) {
        authService.requireAdmin(claims);
        return ApiResponse.ok(new ProductIdResponse(productService.createProduct(request)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<Product> updateProduct(
            @RequestAttribute(name = AuthenticationFilter.CLAIMS_ATTRIBUTE, required = false) TokenClaims claims,
            @PathVariable String id,
            @Valid @RequestBody ProductUpdateRequest request) {
        authService.requireAdmin(claims);
        return ApiResponse.ok(productService.updateProduct(id, request));
    }
}
