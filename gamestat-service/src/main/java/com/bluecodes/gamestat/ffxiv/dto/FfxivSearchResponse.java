package com.bluecodes.gamestat.ffxiv.dto;

import java.util.List;

public record FfxivSearchResponse(String game, List<FfxivCharacter> results) {
}
