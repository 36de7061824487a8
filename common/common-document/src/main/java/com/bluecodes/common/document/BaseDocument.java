package com.bluecodes.common.document;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * 모든 컬렉션 문서의 공통 필드.
 *
 * <p>id와 타임스탬프는 {@link DocumentStore}가 채운다. 서비스 코드가 직접 세팅하지 않는다.</p>
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public abstract class BaseDocument {

    @Id
    private String id;

    private Instant createdAt;

    private Instant updatedAt;
}
