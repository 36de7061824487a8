package com.bluecodes.storefront.config;

import feign.Request;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 결제사(Stripe) 호출용 Feign 설정.
 *
 * <p>connect/read 모두 10초. 재시도는 하지 않는다 (Feign 기본 Retryer.NEVER_RETRY).
 * 결제 의도 생성이 실패해도 주문 생성은 계속 진행되므로 느린 응답을 오래 기다릴 이유가 없다.</p>
 */
@Configuration
@EnableFeignClients(basePackages = "com.bluecodes.storefront")
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                10, TimeUnit.SECONDS,   // connectTimeout
                10, TimeUnit.SECONDS,   // readTimeout
                true                    // followRedirects
        );
    }
}
