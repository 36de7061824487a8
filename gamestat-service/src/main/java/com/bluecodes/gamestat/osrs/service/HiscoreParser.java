package com.bluecodes.gamestat.osrs.service;

import com.bluecodes.gamestat.osrs.dto.SkillStat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * index_lite 응답 파서.
 *
 * <pre>
 *   1234,2277,461000000     ← Overall
 *   5678,99,13034431        ← Attack
 *   ...
 *   -1,1,-1                 ← 랭크 밖
 * </pre>
 *
 * <p>앞의 24줄만 스킬로 읽는다 (그 뒤는 보스/미니게임). 줄이 없거나 숫자 3개로 나뉘지 않으면
 * 해당 스킬만 {@link SkillStat#unranked()}로 채우고 나머지는 계속 읽는다.</p>
 */
final class HiscoreParser {

    static final List<String> SKILLS = List.of(
            "Overall", "Attack", "Defence", "Strength", "Hitpoints", "Ranged",
            "Prayer", "Magic", "Cooking", "Woodcutting", "Fletching", "Fishing",
            "Firemaking", "Crafting", "Smithing", "Mining", "Herblore", "Agility",
            "Thieving", "Slayer", "Farming", "Runecraft", "Hunter", "Construction"
    );

    private HiscoreParser() {
    }

    static Map<String, SkillStat> parse(String body) {
        String[] lines = body == null ? new String[0] : body.strip().split("\n");

        Map<String, SkillStat> skills = new LinkedHashMap<>();
        for (int i = 0; i < SKILLS.size(); i++) {
            skills.put(SKILLS.get(i), i < lines.length ? parseLine(lines[i]) : SkillStat.unranked());
        }
        return Collections.unmodifiableMap(skills);
    }

    private static SkillStat parseLine(String line) {
        String[] parts = line.strip().split(",", -1);
        if (parts.length != 3) {
            return SkillStat.unranked();
        }
        try {
            return new SkillStat(
                    Long.parseLong(parts[0].strip()),
                    Integer.parseInt(parts[1].strip()),
                    Long.parseLong(parts[2].strip()));
        } catch (NumberFormatException e) {
            return SkillStat.unranked();
        }
    }
}
