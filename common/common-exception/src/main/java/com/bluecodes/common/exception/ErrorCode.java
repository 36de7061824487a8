package com.bluecodes.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 - HTTP 상태 코드와 기본 메시지를 한 곳에서 관리한다.
 *
 * <p>도메인별로 그룹화한다:
 * - 공통: INVALID_INPUT, INTERNAL_ERROR, SERVICE_UNAVAILABLE
 * - 인증(Auth): UNAUTHORIZED, ADMIN_ONLY, DUPLICATE_EMAIL, INVALID_CREDENTIALS
 * - 상품(Catalog): PRODUCT_NOT_FOUND, INVALID_PRODUCT
 * - 코드 재고(Inventory): INSUFFICIENT_STOCK, CODE_ALREADY_EXISTS, DUPLICATE_CODE_IN_REQUEST
 * - 주문(Order): ORDER_NOT_FOUND, INVALID_ORDER_STATUS, MIXED_CURRENCY
 * - 게임 스탯(Game-Stat): PLAYER_NOT_FOUND, UPSTREAM_FAILURE</p>
 *
 * <p>GlobalExceptionHandler가 상수 이름을 소문자로 바꿔 ProblemDetail의 type URI로 쓰므로,
 * 상수 이름을 바꾸면 클라이언트가 보는 에러 식별자도 바뀐다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // === 공통 ===
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // === 인증(Auth) ===
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    ADMIN_ONLY(HttpStatus.FORBIDDEN, "Admin only"),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Email already registered"),
    // 이메일 미존재/비밀번호 불일치를 같은 메시지로 응답한다 (어느 쪽이 틀렸는지 노출 금지)
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST, "Invalid credentials"),

    // === 상품(Catalog) ===
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "Product not found"),
    INVALID_PRODUCT(HttpStatus.BAD_REQUEST, "Invalid product"),

    // === 코드 재고(Inventory) ===
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock"),
    CODE_ALREADY_EXISTS(HttpStatus.CONFLICT, "Code already exists"),
    DUPLICATE_CODE_IN_REQUEST(HttpStatus.BAD_REQUEST, "Duplicate code in request"),

    // === 주문(Order) ===
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.CONFLICT, "Invalid order status transition"),
    MIXED_CURRENCY(HttpStatus.BAD_REQUEST, "All cart items must share one currency"),

    // === 게임 스탯(Game-Stat) ===
    PLAYER_NOT_FOUND(HttpStatus.NOT_FOUND, "Player not found"),
    UPSTREAM_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Upstream provider failure");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 기본 에러 메시지 (영문)
}
