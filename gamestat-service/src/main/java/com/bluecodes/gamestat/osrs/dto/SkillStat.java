package com.bluecodes.gamestat.osrs.dto;

/**
 * 스킬 하나의 하이스코어. 랭크 밖이거나 줄이 깨져 있으면 {@link #unranked()}.
 */
public record SkillStat(long rank, int level, long xp) {

    private static final SkillStat UNRANKED = new SkillStat(-1, 1, 0);

    public static SkillStat unranked() {
        return UNRANKED;
    }
}
