package com.bluecodes.common.document;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * 저장소 구현체 선택.
 *
 * <pre>
 *   document-store.type: mongo   (기본값, DATABASE_URL → spring.data.mongodb.uri)
 *   document-store.type: memory  (외부 DB 없이 로컬 실행)
 * </pre>
 */
@Configuration
public class DocumentStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "document-store.type", havingValue = "mongo", matchIfMissing = true)
    public DocumentStore mongoDocumentStore(MongoTemplate mongoTemplate) {
        return new MongoDocumentStore(mongoTemplate, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(name = "document-store.type", havingValue = "memory")
    public DocumentStore inMemoryDocumentStore() {
        return new InMemoryDocumentStore(Clock.systemUTC());
    }
}
