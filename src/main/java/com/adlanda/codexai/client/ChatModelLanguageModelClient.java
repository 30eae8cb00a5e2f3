package com.adlanda.codexai.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Language model client backed by Spring AI's ChatModel.
 *
 * The blocking provider call runs on the generation executor, so callers only ever
 * hold a future.
 */
@Component
public class ChatModelLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLanguageModelClient.class);

    private final ChatModel chatModel;
    private final Executor executor;

    public ChatModelLanguageModelClient(ChatModel chatModel,
                                        @Qualifier("generationExecutor") Executor executor) {
        this.chatModel = chatModel;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            long startTime = System.currentTimeMillis();
            String reply = chatModel.call(prompt);
            log.debug("Model replied with {} chars in {}ms",
                    reply == null ? 0 : reply.length(), System.currentTimeMillis() - startTime);
            return reply;
        }, executor);
    }
}
