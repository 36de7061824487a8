package com.bluecodes.storefront.product.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.storefront.product.dto.ProductFilter;
import com.bluecodes.storefront.product.entity.Product;
import com.bluecodes.storefront.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 공개 상품 조회 API (인증 불필요).
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    // GET /api/products?game=Fortnite&reward_type=skin&min_price=500&max_price=5000
    @GetMapping
    public ApiResponse<List<Product>> listProducts(
            @RequestParam(required = false) String game,
            @RequestParam(name = "reward_type", required = false) String rewardType,
            @RequestParam(name = "min_price", required = false) Integer minPrice,
            @RequestParam(name = "max_price", required = false) Integer maxPrice) {
        return ApiResponse.ok(productService.listProducts(
                new ProductFilter(game, rewardType, minPrice, maxPrice)));
    }

    @GetMapping("/{id}")
    public ApiResponse<Product> getProduct(@PathVariable String id) {
        return ApiResponse.ok(productService.getProduct(id));
    }
}
