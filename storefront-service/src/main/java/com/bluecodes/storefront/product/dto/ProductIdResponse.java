package com.bluecodes.storefront.product.dto;

public record ProductIdResponse(String id) {}
