package com.bluecodes.common.document;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB 구현체.
 *
 * <p>{@link DocumentQuery}는 여기서만 {@link Criteria}로 바뀐다.
 * "id" 필드는 매핑 컨텍스트가 {@code _id}(ObjectId)로 변환한다.</p>
 *
 * <p>findAndModify는 MongoDB의 단일 문서 원자성에 그대로 기댄다.
 * 같은 코드를 두 트랜잭션이 동시에 잡으려 해도 {@code assigned:false} 조건을 만족하는 쪽은 하나뿐이다.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public String create(String collection, BaseDocument document) {
        Instant now = clock.instant();
        document.setCreatedAt(now);
        document.setUpdatedAt(now);
        BaseDocument saved = mongoTemplate.insert(document, collection);
        return saved.getId();
    }

    @Override
    public <T extends BaseDocument> List<T> find(String collection, DocumentQuery query, int limit, Class<T> type) {
        Query mongoQuery = toQuery(query);
        if (limit > 0) {
            mongoQuery.limit(limit);
        }
        return mongoTemplate.find(mongoQuery, type, collection);
    }

    @Override
    public <T extends BaseDocument> Optional<T> findAndModify(String collection, DocumentQuery query,
                                                              DocumentUpdate update, Class<T> type) {
        T modified = mongoTemplate.findAndModify(
                toQuery(query),
                toUpdate(update),
                FindAndModifyOptions.options().returnNew(true),
                type,
                collection);
        return Optional.ofNullable(modified);
    }

    @Override
    public long updateMany(String collection, DocumentQuery query, DocumentUpdate update,
                           Class<? extends BaseDocument> type) {
        return mongoTemplate.updateMulti(toQuery(query), toUpdate(update), type, collection)
                .getModifiedCount();
    }

    @Override
    public long count(String collection, DocumentQuery query, Class<? extends BaseDocument> type) {
        return mongoTemplate.count(toQuery(query), type, collection);
    }

    @Override
    public boolean ping() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            return true;
        } catch (DataAccessException e) {
            log.warn("MongoDB ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 같은 필드에 걸린 조건은 하나의 Criteria로 묶는다.
     * ({@code price >= 1000 AND price <= 5000} → {@code {priceCents: {$gte: 1000, $lte: 5000}}})
     */
    static Query toQuery(DocumentQuery query) {
        Map<String, Criteria> byField = new LinkedHashMap<>();
        for (DocumentQuery.Condition condition : query.getConditions()) {
            Criteria criteria = byField.computeIfAbsent(condition.field(), Criteria::where);
            switch (condition.operator()) {
                case EQ -> criteria.is(condition.value());
                case GTE -> criteria.gte(condition.value());
                case LTE -> criteria.lte(condition.value());
                case IN -> criteria.in((Collection<?>) condition.value());
            }
        }

        Query mongoQuery = new Query();
        byField.values().forEach(mongoQuery::addCriteria);
        query.sort().ifPresent(field -> mongoQuery.with(Sort.by(Sort.Direction.ASC, field)));
        return mongoQuery;
    }

    private Update toUpdate(DocumentUpdate update) {
        Update mongoUpdate = new Update();
        update.getAssignments().forEach(mongoUpdate::set);
        mongoUpdate.set(UPDATED_AT, clock.instant());
        return mongoUpdate;
    }
}
