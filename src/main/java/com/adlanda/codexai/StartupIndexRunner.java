package com.adlanda.codexai;

import com.adlanda.codexai.config.IndexProperties;
import com.adlanda.codexai.content.ContentStore;
import com.adlanda.codexai.exception.CodexException;
import com.adlanda.codexai.model.RebuildResult;
import com.adlanda.codexai.service.ContentSyncManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds the index of every project on application startup.
 *
 * Enabled with {@code codex.index.rebuild-on-startup}. A failing project is logged
 * and the remaining projects are still rebuilt.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class StartupIndexRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupIndexRunner.class);

    private final ContentStore contentStore;
    private final ContentSyncManager syncManager;
    private final IndexProperties properties;

    public StartupIndexRunner(ContentStore contentStore,
                              ContentSyncManager syncManager,
                              IndexProperties properties) {
        this.contentStore = contentStore;
        this.syncManager = syncManager;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRebuildOnStartup()) {
            log.info("Startup index rebuild disabled");
            return;
        }

        List<String> projects = contentStore.listProjects();
        if (projects.isEmpty()) {
            log.warn("No projects found to index");
            return;
        }

        log.info("Rebuilding index for {} projects...", projects.size());
        int rebuilt = 0;
        for (String projectId : projects) {
            try {
                RebuildResult result = syncManager.rebuild(projectId);
                if (result.success()) {
                    rebuilt++;
                }
            } catch (CodexException e) {
                log.error("Failed to rebuild index for project {}: {}", projectId, e.getMessage(), e);
            }
        }
        log.info("Startup indexing complete: {}/{} projects rebuilt", rebuilt, projects.size());
    }
}
