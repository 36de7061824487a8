package com.bluecodes.gamestat.osrs.dto;

import jakarta.validation.constraints.NotNull;

// 공백만 있는 이름은 서비스에서 strip 후 400으로 거른다
public record OsrsStatsRequest(
        @NotNull(message = "username is required")
        String username
) {}
