package com.bluecodes.common.document;

import java.util.List;
import java.util.Optional;

/**
 * Document Store Adapter - 모든 서비스가 컬렉션에 접근하는 유일한 통로.
 *
 * <p>구현체는 두 가지다.
 * <ul>
 *   <li>{@link MongoDocumentStore}: 운영용. MongoTemplate 위에서 동작</li>
 *   <li>{@link InMemoryDocumentStore}: 로컬 실행/테스트용 ({@code document-store.type=memory})</li>
 * </ul>
 * 어느 쪽이든 {@link #findAndModify}는 단일 문서에 대해 원자적이어야 한다.
 * 코드 예약(reservation)의 정합성이 이 연산 하나에 걸려 있다.</p>
 */
public interface DocumentStore {

    String UPDATED_AT = "updatedAt";

    /**
     * 문서를 저장하고 생성된 id를 돌려준다. createdAt/updatedAt은 서버 시각으로 채운다.
     *
     * @throws org.springframework.dao.DuplicateKeyException unique 필드 중복 시
     */
    String create(String collection, BaseDocument document);

    /**
     * 조건에 맞는 문서를 최대 limit개 조회한다. limit이 0 이하이면 제한 없음.
     */
    <T extends BaseDocument> List<T> find(String collection, DocumentQuery query, int limit, Class<T> type);

    default <T extends BaseDocument> Optional<T> findOne(String collection, DocumentQuery query, Class<T> type) {
        return find(collection, query, 1, type).stream().findFirst();
    }

    /**
     * 조건에 맞는 첫 문서 하나를 원자적으로 수정하고 수정 후 상태를 돌려준다.
     * 맞는 문서가 없으면 empty. "조건부 쓰기(assign-if-still-unassigned)"의 기본 연산이다.
     */
    <T extends BaseDocument> Optional<T> findAndModify(String collection, DocumentQuery query,
                                                       DocumentUpdate update, Class<T> type);

    /** 조건에 맞는 모든 문서를 수정하고 수정된 개수를 돌려준다. */
    long updateMany(String collection, DocumentQuery query, DocumentUpdate update,
                    Class<? extends BaseDocument> type);

    long count(String collection, DocumentQuery query, Class<? extends BaseDocument> type);

    /** 저장소 연결 확인 (헬스 체크용). 예외를 던지지 않는다. */
    boolean ping();
}
