package com.bluecodes.gamestat.favorite.dto;

import com.bluecodes.gamestat.favorite.entity.FavoriteProfile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record FavoriteRequest(
        @NotBlank(message = "game is required")
        String game,

        @NotBlank(message = "label is required")
        String label,

        @NotBlank(message = "identifier is required")
        String identifier,

        @NotNull(message = "payload is required")
        Map<String, Object> payload
) {

    public FavoriteProfile toEntity() {
        return FavoriteProfile.builder()
                .game(game)
                .label(label)
                .identifier(identifier)
                .payload(payload)
                .build();
    }
}
