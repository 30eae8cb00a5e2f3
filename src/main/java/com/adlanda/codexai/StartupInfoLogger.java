package com.adlanda.codexai;

import com.adlanda.codexai.config.IndexProperties;
import com.adlanda.codexai.repository.VectorIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after StartupIndexRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorIndexStore indexStore;
    private final IndexProperties indexProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(VectorIndexStore indexStore, IndexProperties indexProperties) {
        this.indexStore = indexStore;
        this.indexProperties = indexProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Codex AI v{}
            Index: {} backend, {} chunks

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/ai/projects/{projectId}/query
              POST http://localhost:{}/api/v1/ai/projects/{projectId}/scene-draft
              POST http://localhost:{}/api/v1/ai/projects/{projectId}/rephrase
              POST http://localhost:{}/api/v1/ai/projects/{projectId}/split-chapter
              POST http://localhost:{}/api/v1/ai/projects/{projectId}/rebuild-index
              GET  http://localhost:{}/api/v1/index/projects/{projectId}

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, indexProperties.getBackend().name().toLowerCase(), indexStore.size(),
            port, port, port, port, port, port, port, port
        );
    }
}
