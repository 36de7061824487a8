package com.bluecodes.gamestat.osrs.service;

import com.bluecodes.gamestat.osrs.client.OsrsHiscoreClient;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 하이스코어 호출에 Circuit Breaker를 씌운다.
 *
 * <p>fallback은 두지 않는다. 404(FeignException.NotFound)는 설정에서 ignore-exceptions로 빼서
 * 없는 플레이어 조회가 회로를 열지 않게 한다. 회로가 열리면 CallNotPermittedException이 그대로 나간다.</p>
 */
@Component
@RequiredArgsConstructor
public class OsrsHiscoreGateway {

    private final OsrsHiscoreClient osrsHiscoreClient;

    @CircuitBreaker(name = "osrsHiscore")
    public String fetchHiscore(String username) {
        return osrsHiscoreClient.fetchHiscore(username);
    }
}
