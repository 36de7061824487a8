package com.bluecodes.gamestat.favorite.dto;

public record FavoriteCreatedResponse(boolean ok, String id) {}
