package com.bluecodes.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 - {@link ErrorCode}로 HTTP 상태와 메시지가 결정되는 unchecked 예외.
 *
 * <p>서비스 계층은 상태 코드를 직접 다루지 않고 이 예외만 던진다.
 * 상세 메시지가 필요하면 두 번째 생성자를 쓴다.
 * (예: "Invalid product" 대신 "Invalid product 65f0c0...")</p>
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
