package com.bluecodes.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 - storefront/gamestat 두 서비스가 같은 응답 포맷을 쓰도록 하는 envelope.
 *
 * <p>success, data, message 세 필드로 구성된다.
 * {@code @JsonInclude(NON_NULL)}로 null 필드는 JSON에서 빠진다.
 * (예: 성공 응답에는 message가 없다)</p>
 *
 * <p>에러 응답은 이 래퍼가 아니라 GlobalExceptionHandler의 ProblemDetail로 내려간다.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
