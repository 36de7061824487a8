package com.bluecodes.common.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.index.Indexed;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 메모리 기반 구현체 - 로컬 실행과 테스트용.
 *
 * <p>문서는 Jackson으로 {@code Map<String, Object>} 행(row)으로 바꿔 보관하고,
 * 읽을 때마다 새 객체로 되돌린다. 호출자가 받은 객체를 고쳐도 저장된 행은 바뀌지 않는다.</p>
 *
 * <p>모든 연산은 하나의 모니터로 직렬화된다. findAndModify의 원자성은 이것으로 보장된다.
 * {@code @Indexed(unique = true)} 필드는 create 시점에 검사해 {@link DuplicateKeyException}을 던진다.</p>
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final Map<String, Map<String, Map<String, Object>>> collections = new HashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);
    }

    @Override
    public synchronized String create(String collection, BaseDocument document) {
        if (document.getId() == null) {
            document.setId(new ObjectId().toHexString());
        }
        Instant now = clock.instant();
        document.setCreatedAt(now);
        document.setUpdatedAt(now);

        Map<String, Map<String, Object>> rows = rows(collection);
        Map<String, Object> row = objectMapper.convertValue(document, ROW_TYPE);
        checkUnique(collection, rows, row, document.getClass());
        if (rows.containsKey(document.getId())) {
            throw new DuplicateKeyException("duplicate key on " + collection + "._id: " + document.getId());
        }
        rows.put(document.getId(), row);
        return document.getId();
    }

    @Override
    public synchronized <T extends BaseDocument> List<T> find(String collection, DocumentQuery query,
                                                              int limit, Class<T> type) {
        Stream<Map<String, Object>> matched = matching(collection, query);
        if (limit > 0) {
            matched = matched.limit(limit);
        }
        return matched.map(row -> objectMapper.convertValue(row, type)).toList();
    }

    @Override
    public synchronized <T extends BaseDocument> Optional<T> findAndModify(String collection, DocumentQuery query,
                                                                           DocumentUpdate update, Class<T> type) {
        return matching(collection, query)
                .findFirst()
                .map(row -> {
                    apply(row, update);
                    return objectMapper.convertValue(row, type);
                });
    }

    @Override
    public synchronized long updateMany(String collection, DocumentQuery query, DocumentUpdate update,
                                        Class<? extends BaseDocument> type) {
        List<Map<String, Object>> targets = matching(collection, query).toList();
        targets.forEach(row -> apply(row, update));
        return targets.size();
    }

    @Override
    public synchronized long count(String collection, DocumentQuery query, Class<? extends BaseDocument> type) {
        return matching(collection, query).count();
    }

    @Override
    public boolean ping() {
        return true;
    }

    private Map<String, Map<String, Object>> rows(String collection) {
        return collections.computeIfAbsent(collection, name -> new LinkedHashMap<>());
    }

    private Stream<Map<String, Object>> matching(String collection, DocumentQuery query) {
        Stream<Map<String, Object>> stream = rows(collection).values().stream()
                .filter(row -> query.getConditions().stream().allMatch(condition -> matches(row, condition)));
        return query.sort()
                .map(field -> stream.sorted(Comparator.comparing(
                        (Map<String, Object> row) -> row.get(field), InMemoryDocumentStore::compareValues)))
                .orElse(stream);
    }

    private boolean matches(Map<String, Object> row, DocumentQuery.Condition condition) {
        Object actual = row.get(condition.field());
        Object expected = normalize(condition.value());
        return switch (condition.operator()) {
            case EQ -> equalValues(actual, expected);
            case GTE -> actual != null && compareValues(actual, expected) >= 0;
            case LTE -> actual != null && compareValues(actual, expected) <= 0;
            case IN -> expected instanceof Collection<?> values
                    && values.stream().anyMatch(value -> equalValues(actual, value));
        };
    }

    private void apply(Map<String, Object> row, DocumentUpdate update) {
        update.getAssignments().forEach((field, value) -> row.put(field, normalize(value)));
        row.put(UPDATED_AT, normalize(clock.instant()));
    }

    /**
     * 조건/갱신 값을 행에 저장된 것과 같은 표현으로 맞춘다.
     * (enum → 이름 문자열, Instant → 숫자, 컬렉션 → List)
     */
    private Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.treeToValue(objectMapper.valueToTree(value), Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unsupported document value: " + value, e);
        }
    }

    private void checkUnique(String collection, Map<String, Map<String, Object>> rows,
                             Map<String, Object> candidate, Class<?> type) {
        for (String field : uniqueFields(type)) {
            Object value = candidate.get(field);
            if (value == null) {
                continue;
            }
            boolean taken = rows.values().stream().anyMatch(row -> equalValues(row.get(field), value));
            if (taken) {
                log.debug("Unique index violation on {}.{}", collection, field);
                throw new DuplicateKeyException("duplicate key on " + collection + "." + field + ": " + value);
            }
        }
    }

    private static List<String> uniqueFields(Class<?> type) {
        List<String> fields = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                Indexed indexed = field.getAnnotation(Indexed.class);
                if (indexed != null && indexed.unique()) {
                    fields.add(field.getName());
                }
            }
        }
        return fields;
    }

    private static boolean equalValues(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        return Objects.equals(left, right);
    }

    // null은 가장 앞에 온다 (MongoDB 정렬 규칙과 동일)
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left instanceof Number && right instanceof Number) {
            return toDecimal(left).compareTo(toDecimal(right));
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return comparable.compareTo(right);
        }
        return left.toString().compareTo(right.toString());
    }

    private static BigDecimal toDecimal(Object number) {
        return number instanceof BigDecimal decimal ? decimal : new BigDecimal(number.toString());
    }
}
