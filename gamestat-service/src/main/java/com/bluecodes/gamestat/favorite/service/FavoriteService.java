package com.bluecodes.gamestat.favorite.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.gamestat.favorite.dto.FavoriteRequest;
import com.bluecodes.gamestat.favorite.entity.FavoriteProfile;
import com.bluecodes.gamestat.favorite.repository.FavoriteProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FavoriteService {

    private final FavoriteProfileRepository favoriteProfileRepository;

    public String addFavorite(FavoriteRequest request) {
        String id = favoriteProfileRepository.save(request.toEntity());
        log.info("Favorite saved: id={}, game={}, identifier={}", id, request.game(), request.identifier());
        return id;
    }

    public List<FavoriteProfile> listFavorites(int limit) {
        if (limit < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "limit must be at least 1");
        }
        return favoriteProfileRepository.findAll(limit);
    }
}
