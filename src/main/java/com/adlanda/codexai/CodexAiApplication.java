package com.adlanda.codexai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Codex AI - Main Application
 *
 * Retrieval-augmented writing assistance for creative writing projects: answers
 * questions about a project, drafts scenes, rephrases selections and splits chapters
 * into scenes, keeping a per-project vector index in step with the project's documents.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embeddings and chat completion via OpenAI
 * - An in-memory index by default, PGVector as an optional backend
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class CodexAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodexAiApplication.class, args);
    }
}
