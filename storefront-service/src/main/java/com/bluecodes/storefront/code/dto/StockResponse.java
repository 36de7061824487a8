package com.bluecodes.storefront.code.dto;

public record StockResponse(String productId, long available) {}
