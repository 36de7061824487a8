package com.bluecodes.gamestat.favorite.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 즐겨찾기한 캐릭터/플레이어.
 *
 * <p>payload에는 조회 당시 API 응답을 그대로 넣어 두고 화면을 바로 그릴 때 쓴다. 구조는 게임마다 다르다.</p>
 */
@Document(collection = FavoriteProfile.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FavoriteProfile extends BaseDocument {

    public static final String COLLECTION = "favoriteprofile";

    private String game;          // osrs | ffxiv
    private String label;         // 표시용 이름
    private String identifier;    // 조회 키 (OSRS 사용자명, FFXIV 캐릭터 ID)
    private Map<String, Object> payload;

    @Builder
    public FavoriteProfile(String game, String label, String identifier, Map<String, Object> payload) {
        this.game = game;
        this.label = label;
        this.identifier = identifier;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
    }
}
