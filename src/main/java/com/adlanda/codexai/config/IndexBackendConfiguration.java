package com.adlanda.codexai.config;

import com.adlanda.codexai.repository.InMemoryVectorIndexStore;
import com.adlanda.codexai.repository.NullIndexStore;
import com.adlanda.codexai.repository.PgVectorIndexStore;
import com.adlanda.codexai.repository.VectorIndexStore;
import com.adlanda.codexai.service.ContentHashService;
import com.adlanda.codexai.service.EmbeddingService;
import com.adlanda.codexai.service.TextChunker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the VectorIndexStore implementation from {@code codex.index.backend}.
 */
@Configuration
public class IndexBackendConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IndexBackendConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "codex.index", name = "backend", havingValue = "memory", matchIfMissing = true)
    public VectorIndexStore inMemoryVectorIndexStore(TextChunker chunker, EmbeddingService embeddingService,
                                                     ContentHashService hashService) {
        log.info("Using in-memory vector index");
        return new InMemoryVectorIndexStore(chunker, embeddingService, hashService);
    }

    @Bean
    @ConditionalOnProperty(prefix = "codex.index", name = "backend", havingValue = "none")
    public VectorIndexStore nullIndexStore() {
        log.info("Vector indexing disabled");
        return new NullIndexStore();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "codex.index", name = "backend", havingValue = "pgvector")
    static class PgVectorBackend {

        @Bean
        public PgVectorStore pgVectorStore(JdbcTemplate jdbcTemplate, EmbeddingModel embeddingModel,
                                           IndexProperties properties) {
            return PgVectorStore.builder(jdbcTemplate, embeddingModel)
                    .vectorTableName(properties.getTableName())
                    .dimensions(properties.getDimensions())
                    .initializeSchema(true)
                    .build();
        }

        @Bean
        public VectorIndexStore pgVectorIndexStore(PgVectorStore pgVectorStore, JdbcTemplate jdbcTemplate,
                                                   PlatformTransactionManager transactionManager,
                                                   TextChunker chunker, ContentHashService hashService,
                                                   ObjectMapper objectMapper, IndexProperties properties) {
            log.info("Using PGVector index table '{}'", properties.getTableName());
            return new PgVectorIndexStore(pgVectorStore, jdbcTemplate, new TransactionTemplate(transactionManager),
                    chunker, hashService, objectMapper, properties.getTableName());
        }
    }
}
