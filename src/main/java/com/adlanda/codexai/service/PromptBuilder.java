package com.adlanda.codexai.service;

import com.adlanda.codexai.model.LoadedContext;
import com.adlanda.codexai.model.SourceAttribution;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the language model prompts for each operation.
 *
 * Explicit context from {@link LoadedContext} and retrieved chunks are placed in
 * separate sections; retrieved chunks are labelled with their source.
 */
@Component
public class PromptBuilder {

    static final String SCENE_START = "<<<SCENE>>>";
    static final String SCENE_END = "<<<END_SCENE>>>";

    private static final String QUERY_SYSTEM_PROMPT = """
            You are an AI assistant answering questions about a creative writing project.
            Use the provided Project Plan, Project Synopsis and Retrieved Context Snippets to answer the user's query accurately and concisely.
            If the context doesn't contain the answer, say that you cannot answer based on the provided information.""";

    private static final String SCENE_SYSTEM_PROMPT = """
            You are an expert writing assistant helping a user draft the next scene in their creative writing project.
            Generate a coherent and engaging scene draft in Markdown format.
            Pay close attention to the Project Plan, Synopsis, Character Profiles and the Previous Scene(s) to keep the story consistent.
            Also consider the Additional Context retrieved via search.""";

    private static final String REPHRASE_SYSTEM_PROMPT = """
            You are an expert writing assistant. Your task is to rephrase the user's selected text, providing several alternative phrasings.
            Use the surrounding text and the broader project context so the suggestions fit the narrative style and tone.""";

    private static final String SPLIT_SYSTEM_PROMPT = """
            You are an AI assistant specialized in analyzing and structuring narrative text.
            Split the chapter text you are given into scenes without rewriting it.""";

    public String queryPrompt(String question, LoadedContext context, List<SourceAttribution> retrieved) {
        String user = "**User Query:**\n" + question + "\n\n"
                + section("Project Plan", orNotAvailable(context.projectPlan()))
                + section("Project Synopsis", orNotAvailable(context.projectSynopsis()))
                + section("Retrieved Context Snippets",
                        retrievedContext(retrieved, "No specific context snippets were retrieved via search."))
                + "**Instruction:** Based *only* on the provided Plan, Synopsis and Retrieved Context, answer the User Query.";
        return assemble(QUERY_SYSTEM_PROMPT, user);
    }

    public String sceneDraftPrompt(String chapterId, String promptSummary, LoadedContext context,
                                   List<SourceAttribution> retrieved) {
        StringBuilder user = new StringBuilder();
        if (promptSummary != null && !promptSummary.isBlank()) {
            user.append("Please write a draft for the next scene, focusing on the following guidance: '")
                .append(promptSummary.trim())
                .append("'. It should follow the previous scene(s) provided below.\n\n");
        } else {
            user.append("Please write a draft for the next scene, ensuring it follows the previous scene(s) provided below.\n\n");
        }

        user.append(section("Project Plan", orNotAvailable(context.projectPlan())));
        user.append(section("Project Synopsis", orNotAvailable(context.projectSynopsis())));

        List<String> scenes = context.previousScenes();
        if (scenes.isEmpty()) {
            user.append("**Previous Scene(s):** N/A (Generating the first scene)\n\n");
        } else {
            for (int i = 0; i < scenes.size(); i++) {
                String label = i == scenes.size() - 1 ? "Immediately Previous Scene" : "Previous Scene " + (i + 1);
                user.append(section(label, scenes.get(i)));
            }
        }

        if (!context.characterProfiles().isEmpty()) {
            user.append(section("Character Profiles", String.join("\n\n---\n\n", context.characterProfiles())));
        }

        user.append(section("Additional Retrieved Context",
                retrievedContext(retrieved, "No additional context retrieved via search.")));
        user.append("**New Scene Details:**\n")
            .append("- Belongs to: Chapter ID '").append(chapterId).append("'\n")
            .append("- Should logically follow the provided previous scene(s).\n\n")
            .append("""
                    **Instructions:**
                    - Generate the new scene content in pure Markdown format.
                    - Start with a heading holding the scene title, like '## Scene Title', followed by the narrative.
                    - Maintain consistency with characters, plot points and world details mentioned in the context.
                    - Do NOT add explanations or commentary outside the new scene's Markdown content.""");
        return assemble(SCENE_SYSTEM_PROMPT, user.toString());
    }

    public String rephrasePrompt(String selectedText, String contextBefore, String contextAfter,
                                 LoadedContext context, List<SourceAttribution> retrieved, int suggestionCount) {
        StringBuilder user = new StringBuilder();
        user.append("Please provide ").append(suggestionCount)
            .append(" alternative ways to phrase the 'Text to Rephrase' below, considering the context.\n\n");

        if (!context.projectSynopsis().isBlank()) {
            user.append(section("Project Synopsis", context.projectSynopsis()));
        }
        user.append(section("Broader Project Context",
                retrievedContext(retrieved, "No specific context was retrieved via search.")));

        boolean hasBefore = contextBefore != null && !contextBefore.isBlank();
        boolean hasAfter = contextAfter != null && !contextAfter.isBlank();
        if (hasBefore || hasAfter) {
            user.append("**Surrounding Text:**\n```\n");
            if (hasBefore) {
                user.append(contextBefore).append('\n');
            }
            user.append("[[[--- TEXT TO REPHRASE ---]]]\n").append(selectedText)
                .append("\n[[[--- END TEXT TO REPHRASE ---]]]\n");
            if (hasAfter) {
                user.append(contextAfter).append('\n');
            }
            user.append("```\n\n");
        } else {
            user.append("**Text to Rephrase:**\n```\n").append(selectedText).append("\n```\n\n");
        }

        user.append("**Instructions:**\n")
            .append("- Provide exactly ").append(suggestionCount).append(" distinct suggestions.\n")
            .append("""
                    - Each suggestion should be a plausible replacement for the original 'Text to Rephrase'.
                    - Maintain the original meaning and intent as closely as possible.
                    - Present the suggestions as a numbered list, starting with '1.'.
                    - Do NOT add explanations, commentary or introductory phrases before or after the numbered list.""");
        return assemble(REPHRASE_SYSTEM_PROMPT, user.toString());
    }

    public String chapterSplitPrompt(String chapterId, String chapterText, LoadedContext context,
                                     List<SourceAttribution> retrieved) {
        StringBuilder user = new StringBuilder();
        user.append("Split the text of chapter '").append(chapterId)
            .append("' below into a sequence of distinct scenes, in their original order.\n\n");
        user.append(section("Project Synopsis", orNotAvailable(context.projectSynopsis())));
        if (!context.characterProfiles().isEmpty()) {
            user.append(section("Character Profiles", String.join("\n\n---\n\n", context.characterProfiles())));
        }
        user.append(section("Additional Retrieved Context",
                retrievedContext(retrieved, "No additional context retrieved via search.")));
        user.append(section("Chapter Text", chapterText));
        user.append("**Output Format:**\nReturn every scene as one block, and nothing else:\n")
            .append(SCENE_START).append('\n')
            .append("TITLE: <short scene title>\n")
            .append("CONTENT:\n<the exact scene text from the chapter>\n")
            .append(SCENE_END).append("\n\n")
            .append("""
                    **Instructions:**
                    - Keep the chapter text unchanged; every part of it belongs to exactly one scene.
                    - Keep the scenes in the order they appear in the chapter.
                    - Do NOT add commentary before, between or after the blocks.""");
        return assemble(SPLIT_SYSTEM_PROMPT, user.toString());
    }

    /**
     * Retrieval query for a scene draft: the guidance when given, else the tail of the chapter.
     */
    public String sceneRetrievalQuery(String chapterId, String promptSummary, LoadedContext context) {
        StringBuilder query = new StringBuilder("Context for the next scene of chapter ").append(chapterId).append('.');
        if (promptSummary != null && !promptSummary.isBlank()) {
            query.append(" Scene focus: ").append(promptSummary.trim());
        } else if (!context.previousScenes().isEmpty()) {
            query.append(' ').append(tail(context.previousScenes().get(context.previousScenes().size() - 1), 500));
        }
        return query.toString();
    }

    public String rephraseRetrievalQuery(String selectedText) {
        return "Context relevant to: " + selectedText.trim();
    }

    public String splitRetrievalQuery(String chapterText) {
        return "Characters, places and events of: " + head(chapterText.trim(), 1000);
    }

    static String retrievedContext(List<SourceAttribution> retrieved, String emptyText) {
        if (retrieved.isEmpty()) {
            return emptyText;
        }
        return retrieved.stream()
                .map(source -> {
                    String character = source.characterName() != null
                            ? " [Character: " + source.characterName() + "]"
                            : "";
                    return "Source: " + source.sourcePath() + character + "\n\n" + source.text();
                })
                .collect(Collectors.joining("\n\n---\n\n"));
    }

    private static String section(String title, String body) {
        return "**" + title + ":**\n```markdown\n" + body + "\n```\n\n";
    }

    private static String assemble(String system, String user) {
        return system + "\n\nUser: " + user + "\n\nAssistant:";
    }

    private static String orNotAvailable(String text) {
        return text.isBlank() ? "Not Available" : text;
    }

    private static String head(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }

    private static String tail(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(text.length() - maxLen);
    }
}
