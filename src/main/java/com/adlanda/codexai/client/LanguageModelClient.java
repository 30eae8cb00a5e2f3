package com.adlanda.codexai.client;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous text completion.
 *
 * The returned future completes with the model's reply, or exceptionally when the
 * provider call fails.
 */
public interface LanguageModelClient {

    CompletableFuture<String> complete(String prompt);
}
