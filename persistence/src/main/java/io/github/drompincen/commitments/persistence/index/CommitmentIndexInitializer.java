package io.github.drompincen.commitments.persistence.index;

import io.github.drompincen.commitments.persistence.document.CommitmentCalendarEventDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentDocument;
import io.github.drompincen.commitments.persistence.document.CommitmentEmailDocument;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the indexes declared on the commitment documents. Spring Boot leaves automatic index
 * creation off, and link uniqueness must be enforced by the store, so they are ensured at startup.
 */
@Component
public class CommitmentIndexInitializer {

    private static final Logger log = LoggerFactory.getLogger(CommitmentIndexInitializer.class);

    private static final List<Class<?>> INDEXED_DOCUMENTS = List.of(
            CommitmentDocument.class,
            CommitmentEmailDocument.class,
            CommitmentCalendarEventDocument.class);

    private final MongoTemplate mongoTemplate;

    public CommitmentIndexInitializer(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @PostConstruct
    public void ensureIndexes() {
        IndexResolver resolver = new MongoPersistentEntityIndexResolver(
                mongoTemplate.getConverter().getMappingContext());
        for (Class<?> type : INDEXED_DOCUMENTS) {
            IndexOperations indexOps = mongoTemplate.indexOps(type);
            resolver.resolveIndexFor(type).forEach(indexOps::ensureIndex);
            log.debug("Ensured indexes for {}", mongoTemplate.getCollectionName(type));
        }
    }
}
