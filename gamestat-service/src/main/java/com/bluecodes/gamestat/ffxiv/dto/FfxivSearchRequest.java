package com.bluecodes.gamestat.ffxiv.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param world 서버 이름. 비어 있으면 전체 서버에서 찾는다
 */
public record FfxivSearchRequest(
        @NotNull(message = "name is required")
        String name,

        String world
) {}
