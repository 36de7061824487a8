package com.bluecodes.gamestat.favorite.dto;

import com.bluecodes.gamestat.favorite.entity.FavoriteProfile;

import java.util.List;

public record FavoriteListResponse(boolean ok, List<FavoriteProfile> items) {}
