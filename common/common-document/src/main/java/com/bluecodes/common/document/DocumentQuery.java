package com.bluecodes.common.document;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 타입이 있는 문서 필터.
 *
 * <p>서비스 코드는 문자열 키 Map 대신 이 빌더로 조건을 만들고,
 * 저장소 구현체가 경계에서만 MongoDB Criteria 등으로 변환한다.
 * 같은 필드에 GTE/LTE를 함께 걸 수 있다 (가격 범위).</p>
 *
 * <pre>{@code
 * DocumentQuery.where()
 *         .eq("productId", productId)
 *         .eq("assigned", false)
 *         .sortBy("createdAt");
 * }</pre>
 */
public final class DocumentQuery {

    public static final String ID = "id";

    public enum Operator { EQ, GTE, LTE, IN }

    public record Condition(String field, Operator operator, Object value) {}

    private final List<Condition> conditions = new ArrayList<>();

    @Getter
    private String sortField;

    private DocumentQuery() {
    }

    /** 조건 없는 쿼리 (전체 조회) */
    public static DocumentQuery where() {
        return new DocumentQuery();
    }

    public static DocumentQuery byId(String id) {
        return where().eq(ID, id);
    }

    public DocumentQuery eq(String field, Object value) {
        return add(field, Operator.EQ, value);
    }

    /** value가 null이면 조건을 추가하지 않는다 (선택 필터용) */
    public DocumentQuery eqIfPresent(String field, Object value) {
        return value == null ? this : eq(field, value);
    }

    public DocumentQuery gte(String field, Object value) {
        return add(field, Operator.GTE, value);
    }

    public DocumentQuery gteIfPresent(String field, Object value) {
        return value == null ? this : gte(field, value);
    }

    public DocumentQuery lte(String field, Object value) {
        return add(field, Operator.LTE, value);
    }

    public DocumentQuery lteIfPresent(String field, Object value) {
        return value == null ? this : lte(field, value);
    }

    public DocumentQuery in(String field, Collection<?> values) {
        return add(field, Operator.IN, List.copyOf(values));
    }

    /** 오름차순 정렬 기준. findAndModify는 정렬 후 첫 문서를 대상으로 한다. */
    public DocumentQuery sortBy(String field) {
        this.sortField = field;
        return this;
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public Optional<String> sort() {
        return Optional.ofNullable(sortField);
    }

    private DocumentQuery add(String field, Operator operator, Object value) {
        conditions.add(new Condition(field, operator, value));
        return this;
    }

    @Override
    public String toString() {
        return "DocumentQuery" + conditions + (sortField == null ? "" : " sort=" + sortField);
    }
}
