package com.bluecodes.gamestat.ffxiv.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.gamestat.ffxiv.dto.FfxivSearchRequest;
import com.bluecodes.gamestat.ffxiv.dto.FfxivSearchResponse;
import com.bluecodes.gamestat.ffxiv.service.FfxivSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ffxiv")
@RequiredArgsConstructor
public class FfxivController {

    private final FfxivSearchService ffxivSearchService;

    @PostMapping("/character")
    public ApiResponse<FfxivSearchResponse> searchCharacter(@Valid @RequestBody FfxivSearchRequest request) {
        return ApiResponse.ok(ffxivSearchService.searchCharacters(request.name(), request.world()));
    }
}
