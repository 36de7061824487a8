package com.bluecodes.storefront.code.dto;

import java.util.List;

// 삽입된 CodeKey id 목록 (요청 순서 유지)
public record AddCodesResponse(List<String> inserted) {}
