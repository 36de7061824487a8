package com.bluecodes.gamestat.osrs.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.gamestat.osrs.dto.OsrsStatsResponse;
import com.bluecodes.gamestat.searchlog.service.SearchLogService;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * OSRS 하이스코어 조회.
 *
 * <h3>결과별 처리</h3>
 * <pre>
 *   200          → 24개 스킬 파싱, 성공 기록
 *   404          → PLAYER_NOT_FOUND(404), 실패 기록 (note = "Player not found")
 *   그 외 실패   → UPSTREAM_FAILURE(500), 실패 기록 (note = 예외 메시지 앞 200자)
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OsrsStatsService {

    static final String GAME = "osrs";

    private final OsrsHiscoreGateway osrsHiscoreGateway;
    private final SearchLogService searchLogService;

    public OsrsStatsResponse fetchStats(String rawUsername) {
        String username = rawUsername == null ? "" : rawUsername.strip();
        if (username.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Username required");
        }
        Map<String, String> query = Map.of("username", username);

        String body;
        try {
            body = osrsHiscoreGateway.fetchHiscore(username);
        } catch (FeignException.NotFound e) {
            searchLogService.recordFailure(GAME, query, ErrorCode.PLAYER_NOT_FOUND.getMessage());
            throw new BusinessException(ErrorCode.PLAYER_NOT_FOUND);
        } catch (RuntimeException e) {
            log.warn("OSRS hiscore lookup failed: username={}, cause={}", username, e.toString());
            searchLogService.recordFailure(GAME, query, describe(e));
            throw new BusinessException(ErrorCode.UPSTREAM_FAILURE, "Failed to fetch OSRS stats", e);
        }

        OsrsStatsResponse response = new OsrsStatsResponse(GAME, username, HiscoreParser.parse(body));
        searchLogService.recordSuccess(GAME, query);
        return response;
    }

    private String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
