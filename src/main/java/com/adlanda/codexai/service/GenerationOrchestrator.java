package com.adlanda.codexai.service;

import com.adlanda.codexai.client.LanguageModelClient;
import com.adlanda.codexai.config.RagProperties;
import com.adlanda.codexai.content.ContentStore;
import com.adlanda.codexai.exception.GenerationException;
import com.adlanda.codexai.exception.GenerationTimeoutException;
import com.adlanda.codexai.exception.NotFoundException;
import com.adlanda.codexai.exception.ParseException;
import com.adlanda.codexai.model.Answer;
import com.adlanda.codexai.model.ChapterSplitRequest;
import com.adlanda.codexai.model.GenerationRequest;
import com.adlanda.codexai.model.GenerationResult;
import com.adlanda.codexai.model.LoadedContext;
import com.adlanda.codexai.model.ProposedScene;
import com.adlanda.codexai.model.ProposedScenes;
import com.adlanda.codexai.model.QueryRequest;
import com.adlanda.codexai.model.RebuildResult;
import com.adlanda.codexai.model.RephraseRequest;
import com.adlanda.codexai.model.RephraseSuggestions;
import com.adlanda.codexai.model.SceneDraft;
import com.adlanda.codexai.model.SceneDraftRequest;
import com.adlanda.codexai.model.SourceAttribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the AI operations of a project.
 *
 * Each operation assembles explicit context, retrieves similar chunks that are not
 * already part of that context, prompts the language model and parses its reply.
 * Nothing here writes to the index except the rebuild, which is delegated to
 * {@link ContentSyncManager}.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final ContentStore contentStore;
    private final ContextAssembler contextAssembler;
    private final RetrievalService retrievalService;
    private final PromptBuilder promptBuilder;
    private final LanguageModelClient languageModel;
    private final ResponseParser responseParser;
    private final ContentSyncManager syncManager;
    private final RagProperties properties;

    public GenerationOrchestrator(ContentStore contentStore,
                                  ContextAssembler contextAssembler,
                                  RetrievalService retrievalService,
                                  PromptBuilder promptBuilder,
                                  LanguageModelClient languageModel,
                                  ResponseParser responseParser,
                                  ContentSyncManager syncManager,
                                  RagProperties properties) {
        this.contentStore = contentStore;
        this.contextAssembler = contextAssembler;
        this.retrievalService = retrievalService;
        this.promptBuilder = promptBuilder;
        this.languageModel = languageModel;
        this.responseParser = responseParser;
        this.syncManager = syncManager;
        this.properties = properties;
    }

    /**
     * Dispatches a request to its operation.
     */
    public GenerationResult execute(String projectId, GenerationRequest request) {
        if (request instanceof QueryRequest query) {
            return query(projectId, query.text());
        } else if (request instanceof SceneDraftRequest draft) {
            return generateSceneDraft(projectId, draft.chapterId(), draft.promptSummary(), draft.previousSceneCount());
        } else if (request instanceof RephraseRequest rephrase) {
            return rephraseText(projectId, rephrase.selectedText(), rephrase.contextBefore(), rephrase.contextAfter());
        } else if (request instanceof ChapterSplitRequest split) {
            return splitChapterIntoScenes(projectId, split.chapterId(), split.chapterText());
        }
        throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getSimpleName());
    }

    /**
     * Answers a question about the project from its plan, synopsis and retrieved chunks.
     */
    public Answer query(String projectId, String text) {
        log.info("Query on project {}", projectId);
        LoadedContext context = contextAssembler.load(projectId);
        List<SourceAttribution> sources = retrievalService.retrieve(
                projectId, text, properties.getQueryTopK(), context.filterPaths());

        String prompt = promptBuilder.queryPrompt(text, context, sources);
        String reply = complete("query", prompt);
        return new Answer(reply.trim(), sources);
    }

    /**
     * Drafts the next scene of a chapter.
     *
     * @param previousSceneCount scenes to include in full, null for the configured default
     */
    public SceneDraft generateSceneDraft(String projectId, String chapterId, String promptSummary,
                                         Integer previousSceneCount) {
        requireChapter(projectId, chapterId);
        int sceneCount = previousSceneCount == null
                ? properties.getPreviousSceneCount()
                : Math.max(0, previousSceneCount);
        log.info("Scene draft for project {}, chapter {} ({} previous scenes)", projectId, chapterId, sceneCount);

        LoadedContext context = contextAssembler.load(projectId, chapterId, sceneCount, promptSummary);
        List<SourceAttribution> sources = retrievalService.retrieve(projectId,
                promptBuilder.sceneRetrievalQuery(chapterId, promptSummary, context),
                properties.getGenerationTopK(), context.filterPaths());

        String prompt = promptBuilder.sceneDraftPrompt(chapterId, promptSummary, context, sources);
        return responseParser.sceneDraft(complete("scene draft", prompt));
    }

    /**
     * Suggests alternative phrasings for a text selection.
     *
     * @return at most the configured number of suggestions, in the model's order
     */
    public RephraseSuggestions rephraseText(String projectId, String selectedText,
                                            String contextBefore, String contextAfter) {
        if (!contentStore.projectExists(projectId)) {
            throw NotFoundException.project(projectId);
        }
        if (selectedText == null || selectedText.isBlank()) {
            log.debug("Nothing to rephrase in project {}", projectId);
            return new RephraseSuggestions(List.of());
        }
        int expected = properties.getRephraseSuggestionCount();
        log.info("Rephrase for project {} ({} chars, {} suggestions)", projectId, selectedText.length(), expected);

        LoadedContext context = contextAssembler.load(projectId);
        List<SourceAttribution> sources = retrievalService.retrieve(projectId,
                promptBuilder.rephraseRetrievalQuery(selectedText),
                properties.getGenerationTopK(), context.filterPaths());

        String prompt = promptBuilder.rephrasePrompt(selectedText, contextBefore, contextAfter,
                context, sources, expected);
        String reply = complete("rephrase", prompt);

        List<String> suggestions = responseParser.numberedList(reply, expected);
        if (suggestions.isEmpty()) {
            throw new GenerationException("Model reply contained no numbered suggestions");
        }
        if (suggestions.size() > expected) {
            log.debug("Keeping the first {} of {} suggestions", expected, suggestions.size());
            suggestions = suggestions.subList(0, expected);
        } else if (suggestions.size() < expected) {
            log.warn("Model returned {} suggestions, expected {}", suggestions.size(), expected);
        }
        return new RephraseSuggestions(suggestions);
    }

    /**
     * Proposes how a chapter's text divides into scenes.
     */
    public ProposedScenes splitChapterIntoScenes(String projectId, String chapterId, String chapterText) {
        requireChapter(projectId, chapterId);
        if (chapterText == null || chapterText.isBlank()) {
            log.debug("Chapter {} of project {} has no text to split", chapterId, projectId);
            return new ProposedScenes(List.of());
        }
        log.info("Splitting chapter {} of project {} ({} chars)", chapterId, projectId, chapterText.length());

        LoadedContext context = contextAssembler.load(projectId, chapterId, 0, chapterText);
        List<SourceAttribution> sources = retrievalService.retrieve(projectId,
                promptBuilder.splitRetrievalQuery(chapterText),
                properties.getGenerationTopK(), context.filterPaths());

        String prompt = promptBuilder.chapterSplitPrompt(chapterId, chapterText, context, sources);
        List<ProposedScene> scenes = responseParser.sceneList(complete("chapter split", prompt));
        if (scenes.isEmpty()) {
            throw new ParseException("Model reply contained no scene blocks");
        }

        int splitLength = scenes.stream().mapToInt(scene -> scene.content().length()).sum();
        int chapterLength = chapterText.strip().length();
        if (Math.abs(splitLength - chapterLength) > chapterLength / 5) {
            log.warn("Split of chapter {} has {} chars of scene text for {} chars of chapter text",
                    chapterId, splitLength, chapterLength);
        }
        log.info("Chapter {} split into {} scenes", chapterId, scenes.size());
        return new ProposedScenes(scenes);
    }

    public RebuildResult rebuildProjectIndex(String projectId) {
        return syncManager.rebuild(projectId);
    }

    private void requireChapter(String projectId, String chapterId) {
        if (!contentStore.projectExists(projectId)) {
            throw NotFoundException.project(projectId);
        }
        if (!contentStore.chapterExists(projectId, chapterId)) {
            throw NotFoundException.chapter(chapterId);
        }
    }

    /**
     * Calls the language model and waits for its reply up to the configured timeout.
     */
    private String complete(String operation, String prompt) {
        Duration timeout = properties.getGenerationTimeout();
        log.debug("Sending {} prompt ({} chars)", operation, prompt.length());

        CompletableFuture<String> future;
        try {
            future = languageModel.complete(prompt);
        } catch (RuntimeException e) {
            throw new GenerationException("Language model call for " + operation + " failed: " + e.getMessage(), e);
        }

        String reply;
        try {
            reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationException("Language model call for " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for " + operation + " reply", e);
        }

        if (reply == null || reply.isBlank()) {
            throw new GenerationException("Language model returned an empty reply for " + operation);
        }
        if (responseParser.isErrorReply(reply)) {
            throw new GenerationException("Language model reported a failure for " + operation + ": " + reply.trim());
        }
        return reply;
    }
}
