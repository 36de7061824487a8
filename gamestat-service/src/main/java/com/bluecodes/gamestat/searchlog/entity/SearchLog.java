package com.bluecodes.gamestat.searchlog.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 외부 게임 API 조회 기록. 성공/실패 모두 남긴다.
 */
@Document(collection = SearchLog.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SearchLog extends BaseDocument {

    public static final String COLLECTION = "searchlog";
    public static final int NOTE_MAX_LENGTH = 200;

    private String game;                  // osrs | ffxiv
    private Map<String, Object> query;    // 외부 API에 넘긴 파라미터
    private boolean resultOk;
    private String note;                  // 실패 사유, 최대 200자

    public SearchLog(String game, Map<String, ?> query, boolean resultOk, String note) {
        this.game = game;
        this.query = query != null ? new LinkedHashMap<>(query) : new LinkedHashMap<>();
        this.resultOk = resultOk;
        this.note = truncate(note);
    }

    private static String truncate(String note) {
        if (note == null || note.length() <= NOTE_MAX_LENGTH) {
            return note;
        }
        return note.substring(0, NOTE_MAX_LENGTH);
    }
}
