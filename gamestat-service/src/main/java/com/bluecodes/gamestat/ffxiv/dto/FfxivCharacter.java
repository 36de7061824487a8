package com.bluecodes.gamestat.ffxiv.dto;

import com.bluecodes.gamestat.ffxiv.client.XivApiClient;

public record FfxivCharacter(Long id, String name, String server, String avatar, String dataCenter) {

    public static FfxivCharacter from(XivApiClient.CharacterResult result) {
        return new FfxivCharacter(result.id(), result.name(), result.server(), result.avatar(), result.dataCenter());
    }
}
