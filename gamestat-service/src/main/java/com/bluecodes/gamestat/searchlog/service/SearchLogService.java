package com.bluecodes.gamestat.searchlog.service;

import com.bluecodes.gamestat.searchlog.entity.SearchLog;
import com.bluecodes.gamestat.searchlog.repository.SearchLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 조회 기록 저장.
 *
 * <p>기록 저장은 부가 기능이다. 저장소 오류가 나도 조회 응답에는 영향을 주지 않고 경고 로그만 남긴다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchLogService {

    private final SearchLogRepository searchLogRepository;

    public void recordSuccess(String game, Map<String, ?> query) {
        record(new SearchLog(game, query, true, null));
    }

    public void recordFailure(String game, Map<String, ?> query, String note) {
        record(new SearchLog(game, query, false, note));
    }

    private void record(SearchLog searchLog) {
        try {
            searchLogRepository.save(searchLog);
        } catch (RuntimeException e) {
            log.warn("Failed to record search log: game={}, resultOk={}, cause={}",
                    searchLog.getGame(), searchLog.isResultOk(), e.toString());
        }
    }
}
