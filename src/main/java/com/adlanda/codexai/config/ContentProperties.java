package com.adlanda.codexai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Location of the project content on disk ('codex.content' prefix).
 */
@Component
@ConfigurationProperties(prefix = "codex.content")
public class ContentProperties {

    /**
     * Directory holding one sub-directory per project.
     */
    private String baseDir = "./user_projects";

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }
}
