package com.bluecodes.common.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 필드 대입($set) 목록. updatedAt은 저장소가 자동으로 덧붙인다.
 */
public final class DocumentUpdate {

    private final Map<String, Object> assignments = new LinkedHashMap<>();

    private DocumentUpdate() {
    }

    public static DocumentUpdate update() {
        return new DocumentUpdate();
    }

    public DocumentUpdate set(String field, Object value) {
        assignments.put(field, value);
        return this;
    }

    /** value가 null이면 해당 필드를 건드리지 않는다 (merge-patch용) */
    public DocumentUpdate setIfPresent(String field, Object value) {
        return value == null ? this : set(field, value);
    }

    public Map<String, Object> getAssignments() {
        return Collections.unmodifiableMap(assignments);
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }
}
