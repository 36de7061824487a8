package com.bluecodes.storefront.contact.dto;

public record ContactResponse(boolean ok, String id) {}
