package com.bluecodes.gamestat.osrs.dto;

import java.util.Map;

/**
 * @param skills 스킬 이름 → 스탯. Overall부터 Construction까지 24개, 고정 순서
 */
public record OsrsStatsResponse(String game, String username, Map<String, SkillStat> skills) {
}
