package com.bluecodes.gamestat.favorite.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.gamestat.favorite.dto.FavoriteCreatedResponse;
import com.bluecodes.gamestat.favorite.dto.FavoriteListResponse;
import com.bluecodes.gamestat.favorite.dto.FavoriteRequest;
import com.bluecodes.gamestat.favorite.service.FavoriteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/favorites")
@RequiredArgsConstructor
public class FavoriteController {

    private final FavoriteService favoriteService;

    @PostMapping
    public ApiResponse<FavoriteCreatedResponse> addFavorite(@Valid @RequestBody FavoriteRequest request) {
        return ApiResponse.ok(new FavoriteCreatedResponse(true, favoriteService.addFavorite(request)));
    }

    @GetMapping
    public ApiResponse<FavoriteListResponse> listFavorites(@RequestParam(defaultValue = "50") int limit) {
        return ApiResponse.ok(new FavoriteListResponse(true, favoriteService.listFavorites(limit)));
    }
}
