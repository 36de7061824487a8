package com.bluecodes.gamestat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MMORPG 스탯 조회 도우미(gamestat) 서비스 진입점.
 *
 * <p>인증이 없는 서비스라 common-security는 쓰지 않는다.
 * {@code com.bluecodes.common} 스캔으로 GlobalExceptionHandler와 DocumentStoreConfig만 가져온다.</p>
 */
@SpringBootApplication(scanBasePackages = {"com.bluecodes.gamestat", "com.bluecodes.common"})
public class GamestatApplication {
    public static void main(String[] args) {
        SpringApplication.run(GamestatApplication.class, args);
    }
}
