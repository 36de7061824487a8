package com.bluecodes.gamestat.osrs.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * OSRS 공식 하이스코어 텍스트 API.
 *
 * <p>응답은 한 줄에 {@code rank,level,xp} 하나씩인 평문이다. 없는 플레이어는 404.</p>
 */
@FeignClient(name = "osrsHiscore", url = "${osrs.url:https://secure.runescape.com}")
public interface OsrsHiscoreClient {

    @GetMapping("/m=hiscore_oldschool/index_lite.ws")
    String fetchHiscore(@RequestParam("player") String player);
}
