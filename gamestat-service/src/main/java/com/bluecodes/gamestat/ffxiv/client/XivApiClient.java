package com.bluecodes.gamestat.ffxiv.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.cloud.openfeign.SpringQueryMap;
import org.springframework.web.bind.annotation.GetMapping;

import java.util.List;
import java.util.Map;

/**
 * XIVAPI 캐릭터 검색 클라이언트.
 *
 * <p>XIVAPI 응답은 PascalCase 필드라 전역 SNAKE_CASE 설정과 맞지 않는다.
 * 필드마다 {@code @JsonProperty}로 이름을 고정한다.</p>
 */
@FeignClient(name = "xivApi", url = "${xivapi.url:https://xivapi.com}")
public interface XivApiClient {

    // params: name (필수), server (선택)
    @GetMapping("/character/search")
    CharacterSearchResponse searchCharacters(@SpringQueryMap Map<String, String> params);

    record CharacterSearchResponse(@JsonProperty("Results") List<CharacterResult> results) {}

    record CharacterResult(
            @JsonProperty("ID") Long id,
            @JsonProperty("Name") String name,
            @JsonProperty("Server") String server,
            @JsonProperty("Avatar") String avatar,
            @JsonProperty("DC") String dataCenter
    ) {}
}
