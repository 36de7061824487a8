package com.bluecodes.gamestat.searchlog.repository;

import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.gamestat.searchlog.entity.SearchLog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SearchLogRepository {

    private final DocumentStore documentStore;

    public String save(SearchLog searchLog) {
        return documentStore.create(SearchLog.COLLECTION, searchLog);
    }
}
