package com.bluecodes.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 게임 코드 스토어(storefront) 서비스 진입점.
 *
 * <p>scanBasePackages에 {@code com.bluecodes.common}을 포함시켜
 * 공통 모듈의 GlobalExceptionHandler, AuthenticationFilter, JwtTokenProvider,
 * DocumentStoreConfig를 함께 등록한다.</p>
 */
@SpringBootApplication(scanBasePackages = {"com.bluecodes.storefront", "com.bluecodes.common"})
public class StorefrontApplication {
    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }
}
