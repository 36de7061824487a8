package com.bluecodes.gamestat.favorite.repository;

import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.gamestat.favorite.entity.FavoriteProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class FavoriteProfileRepository {

    private final DocumentStore documentStore;

    public String save(FavoriteProfile favorite) {
        return documentStore.create(FavoriteProfile.COLLECTION, favorite);
    }

    // 저장 순서대로
    public List<FavoriteProfile> findAll(int limit) {
        return documentStore.find(FavoriteProfile.COLLECTION,
                DocumentQuery.where().sortBy("createdAt"), limit, FavoriteProfile.class);
    }
}
