package com.bluecodes.gamestat.config;

import feign.Request;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * OSRS 하이스코어 / XIVAPI 호출용 Feign 설정. connect/read 10초, 재시도 없음.
 */
@Configuration
@EnableFeignClients(basePackages = "com.bluecodes.gamestat")
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                10, TimeUnit.SECONDS,
                10, TimeUnit.SECONDS,
                true
        );
    }
}
