package com.bluecodes.gamestat.ffxiv.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.gamestat.ffxiv.client.XivApiClient;
import com.bluecodes.gamestat.ffxiv.dto.FfxivCharacter;
import com.bluecodes.gamestat.ffxiv.dto.FfxivSearchResponse;
import com.bluecodes.gamestat.searchlog.service.SearchLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FFXIV 캐릭터 검색 (XIVAPI 프록시).
 *
 * <p>world가 있으면 XIVAPI의 server 파라미터로 넘긴다. 결과는 앞에서부터 10건만 돌려준다.
 * 조회 기록에는 실제로 보낸 파라미터(name, server)가 남는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FfxivSearchService {

    static final String GAME = "ffxiv";
    static final int MAX_RESULTS = 10;

    private final XivApiGateway xivApiGateway;
    private final SearchLogService searchLogService;

    public FfxivSearchResponse searchCharacters(String rawName, String rawWorld) {
        String name = rawName == null ? "" : rawName.strip();
        String world = rawWorld == null ? "" : rawWorld.strip();
        if (name.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Name required");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", name);
        if (!world.isEmpty()) {
            params.put("server", world);
        }

        List<XivApiClient.CharacterResult> results;
        try {
            XivApiClient.CharacterSearchResponse response = xivApiGateway.searchCharacters(params);
            results = response == null || response.results() == null ? Collections.emptyList() : response.results();
        } catch (RuntimeException e) {
            log.warn("XIVAPI character search failed: params={}, cause={}", params, e.toString());
            searchLogService.recordFailure(GAME, params,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw new BusinessException(ErrorCode.UPSTREAM_FAILURE, "Failed to search FFXIV characters", e);
        }

        searchLogService.recordSuccess(GAME, params);
        List<FfxivCharacter> trimmed = results.stream()
                .limit(MAX_RESULTS)
                .map(FfxivCharacter::from)
                .toList();
        return new FfxivSearchResponse(GAME, trimmed);
    }
}
